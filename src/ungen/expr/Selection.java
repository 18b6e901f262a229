package ungen.expr;

/**
 * A bit-select applied to something other than a plain signal name, e.g. <code>(a + b)[3:0]</code>.
 * Arises from a select written after parentheses, braces or another select, and when a selected generated signal is replaced
 * by its definition.
 */
public record Selection(Expression base, BitSelect select) implements Expression {
  @Override
  public int precedence() {
    return Precedence.ATOM;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitSelection(this);
  }
}
