package ungen.expr;

import java.util.Optional;
import ungen.UnGenException;

/**
 * The expression uses a construct outside the supported subset,
 * e.g. a function call, a system function such as <code>$signed</code> or a hierarchical reference.
 */
public class UnsupportedConstructException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String expression;
  private final String construct;
  private final int column;
  private final String signal;
  private final int line;

  public UnsupportedConstructException(String expression, int column, String construct) {
    super("Unsupported construct '" + construct + "' at column " + (column + 1) + " in '" + expression + "'");
    this.expression = expression;
    this.construct = construct;
    this.column = column;
    this.signal = null;
    this.line = 0;
  }

  /** Attaches the definition the failing expression belongs to. */
  public UnsupportedConstructException(UnsupportedConstructException cause, String signal, int line) {
    super("Definition of " + signal + " (line " + line + "): " + cause.getMessage(), cause);
    this.expression = cause.expression;
    this.construct = cause.construct;
    this.column = cause.column;
    this.signal = signal;
    this.line = line;
  }

  public String getExpression() { return expression; }
  public String getConstruct() { return construct; }
  public int getColumn() { return column; }
  public Optional<String> getSignal() { return Optional.ofNullable(signal); }
  public int getLine() { return line; }
}
