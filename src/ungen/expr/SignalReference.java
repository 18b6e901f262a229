package ungen.expr;

import java.util.Optional;

/**
 * Reference to a signal by name, optionally with a bit-select.
 */
public record SignalReference(String name, Optional<BitSelect> select) implements Expression {
  public static SignalReference of(String name) { return new SignalReference(name, Optional.empty()); }

  @Override
  public int precedence() {
    return Precedence.ATOM;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> visitor) throws X {
    return visitor.visitSignalReference(this);
  }
}
