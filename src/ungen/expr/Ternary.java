package ungen.expr;

/** <code>condition ? thenExpr : elseExpr</code> */
public record Ternary(Expression condition, Expression thenExpr, Expression elseExpr) implements Expression {
  @Override
  public int precedence() {
    return Precedence.TERNARY;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitTernary(this);
  }
}
