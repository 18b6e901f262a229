package ungen.expr;

import java.util.List;

/** <code>{a, b, ...}</code>, most significant item first. */
public record Concatenation(List<Expression> items) implements Expression {
  public Concatenation {
    if (items.isEmpty())
      throw new IllegalArgumentException("a concatenation needs at least one item");
    items = List.copyOf(items);
  }

  @Override
  public int precedence() {
    return Precedence.ATOM;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitConcatenation(this);
  }
}
