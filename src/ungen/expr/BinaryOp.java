package ungen.expr;

public record BinaryOp(BinaryOperator operator, Expression left, Expression right) implements Expression {
  @Override
  public int precedence() {
    return operator.getPrecedence();
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitBinaryOp(this);
  }
}
