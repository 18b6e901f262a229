package ungen.expr;

/**
 * <code>( inner )</code>, a grouping kept in the tree. The parser builds it for parentheses written in the source, the expansion
 * wraps every non-atomic definition it substitutes in one.
 */
public record Parenthesized(Expression inner) implements Expression {
  /** Wraps an expression unless it already renders as an atom. */
  public static Expression around(Expression expression) {
    return expression.precedence() < Precedence.ATOM ? new Parenthesized(expression) : expression;
  }

  @Override
  public int precedence() {
    return Precedence.ATOM;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitParenthesized(this);
  }
}
