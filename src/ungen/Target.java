package ungen;

import java.util.Objects;
import ungen.expand.SignalNotFoundException;
import ungen.expand.SignalResolver;
import ungen.expand.UnsupportedKindException;
import ungen.scan.Signal;

/** The signal to expand: a wire given by name, or the assignment (wire or register) starting on a line. */
public final class Target {
  private final String name;
  private final int line;

  private Target(String name, int line) {
    this.name = name;
    this.line = line;
  }

  public static Target byName(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isBlank())
      throw new IllegalArgumentException("Signal name must not be empty");
    return new Target(name, 0);
  }

  /** @param line 1-based line on which the assignment starts */
  public static Target byLine(int line) {
    if (line < 1)
      throw new IllegalArgumentException("Line numbers start at 1, got " + line);
    return new Target(null, line);
  }

  public boolean isByName() { return name != null; }

  Signal resolve(SignalResolver resolver) throws SignalNotFoundException, UnsupportedKindException {
    return isByName() ? resolver.resolveByName(name) : resolver.resolveByLine(line);
  }

  @Override
  public String toString() {
    return isByName() ? "signal " + name : "line " + line;
  }
}
