package ungen.expr;

/**
 * <code>{count{expression}}</code>. A replicated list <code>{n{a, b}}</code> has a {@link Concatenation} as expression.
 */
public record Replication(Expression count, Expression expression) implements Expression {
  @Override
  public int precedence() {
    return Precedence.ATOM;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitReplication(this);
  }
}
