package ungen.expr;

import java.util.Optional;
import ungen.UnGenException;

/** The token sequence of an expression does not match the expression grammar. */
public class ExpressionSyntaxException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String expression;
  private final int column;
  private final String signal;
  private final int line;

  /**
   * @param expression the full expression text being parsed
   * @param column 0-based offset of the offending token in expression
   * @param reason what the parser expected or found
   */
  public ExpressionSyntaxException(String expression, int column, String reason) {
    super(reason + " at column " + (column + 1) + " in '" + expression + "'");
    this.expression = expression;
    this.column = column;
    this.signal = null;
    this.line = 0;
  }

  /** Attaches the definition the failing expression belongs to. */
  public ExpressionSyntaxException(ExpressionSyntaxException cause, String signal, int line) {
    super("Definition of " + signal + " (line " + line + "): " + cause.getMessage(), cause);
    this.expression = cause.expression;
    this.column = cause.column;
    this.signal = signal;
    this.line = line;
  }

  public String getExpression() { return expression; }
  public int getColumn() { return column; }
  /** Name of the signal whose definition failed to parse, if known. */
  public Optional<String> getSignal() { return Optional.ofNullable(signal); }
  /** Line of the failing definition, 0 if unknown. */
  public int getLine() { return line; }
}
