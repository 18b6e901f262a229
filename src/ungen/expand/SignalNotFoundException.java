package ungen.expand;

import ungen.UnGenException;

/** No assignment matches the requested signal name or line. */
public class SignalNotFoundException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final int line;

  private SignalNotFoundException(String message, String name, int line) {
    super(message);
    this.name = name;
    this.line = line;
  }

  public static SignalNotFoundException forName(String name) {
    return new SignalNotFoundException("Signal " + name + " has no assignment in the source", name, 0);
  }
  public static SignalNotFoundException forLine(int line) {
    return new SignalNotFoundException("No assignment starts at line " + line, null, line);
  }

  /** The requested name, null for line based lookups. */
  public String getName() { return name; }
  /** The requested line, 0 for name based lookups. */
  public int getLine() { return line; }
}
