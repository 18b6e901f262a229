package ungen.scan;

import java.util.Optional;

/**
 * A <code>wire</code>, <code>reg</code> or port declaration.
 * @param name declared identifier
 * @param kind net kind; ports without explicit net type are wires
 * @param range packed range text including brackets, e.g. <code>[7:0]</code>
 * @param direction port direction (input, output, inout) for port declarations
 * @param line 1-based declaration line
 */
public record Declaration(String name, SignalKind kind, Optional<String> range, Optional<String> direction, int line) {
  public boolean isPort() { return direction.isPresent(); }
}
