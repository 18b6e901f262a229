package ungen;

/**
 * Base class of all failures reported while scanning a Verilog file, parsing a definition or expanding a signal.
 * Subclasses carry the diagnostic context (signal name, line number, offending text) as fields.
 */
public class UnGenException extends Exception {
  private static final long serialVersionUID = 1L;

  public UnGenException(String message) { super(message); }
  public UnGenException(String message, Throwable cause) { super(message, cause); }
}
