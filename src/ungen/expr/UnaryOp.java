package ungen.expr;

public record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
  @Override
  public int precedence() {
    return Precedence.UNARY;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitUnaryOp(this);
  }
}
