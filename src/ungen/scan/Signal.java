package ungen.scan;

/**
 * One assignment statement of a signal.
 * @param name assigned identifier
 * @param kind {@link SignalKind#WIRE} for continuous assignments and wire initializers, {@link SignalKind#REG} for procedural assignments
 * @param rawExpression right-hand side text, whitespace collapsed, without the terminating <code>;</code>
 * @param declarationLine 1-based line of the declaration, 0 if the file does not declare the name in a recognized form
 * @param assignmentLine 1-based line on which the assignment statement starts
 */
public record Signal(String name, SignalKind kind, String rawExpression, int declarationLine, int assignmentLine) {
  @Override
  public String toString() {
    return name + " = " + rawExpression;
  }
}
