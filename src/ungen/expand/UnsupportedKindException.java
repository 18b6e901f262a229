package ungen.expand;

import ungen.UnGenException;
import ungen.scan.SignalKind;

/** Name based lookup of a signal kind that cannot be resolved by name (registers). */
public class UnsupportedKindException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final SignalKind kind;

  public UnsupportedKindException(String name, SignalKind kind) {
    super("Signal " + name + " is a " + kind.getKeyword() + "; only wires can be resolved by name, use the line of one of its assignments instead");
    this.name = name;
    this.kind = kind;
  }

  public String getName() { return name; }
  public SignalKind getKind() { return kind; }
}
