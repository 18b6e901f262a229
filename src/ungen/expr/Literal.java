package ungen.expr;

import java.util.Optional;

/**
 * Number literal, kept as written.
 * @param text literal text, e.g. <code>12</code>, <code>8'hFF</code>, <code>'0</code>
 * @param width bit width of sized literals
 */
public record Literal(String text, Optional<Integer> width) implements Expression {
  /** Creates a literal from its text, deriving the width of sized literals. */
  public static Literal of(String text) {
    int tick = text.indexOf('\'');
    if (tick <= 0)
      return new Literal(text, Optional.empty());
    return new Literal(text, Optional.of(Integer.parseInt(text.substring(0, tick).replace("_", ""))));
  }

  @Override
  public int precedence() {
    return Precedence.ATOM;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitLiteral(this);
  }
}
