package ungen.expr;

/**
 * Node of a Verilog expression tree. Nodes are immutable values with structural equality.
 */
public interface Expression {
  /** Binding strength of the node as seen by its parent, see {@link Precedence}. */
  int precedence();

  <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X;
}
