package ungen.scan;

import ungen.UnGenException;

/** A declaration or assignment statement could not be scanned into the supported subset. */
public class ScanException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final int line;
  private final String text;

  /**
   * @param line 1-based line on which the offending statement starts
   * @param text the offending source text
   * @param reason what is wrong with it
   */
  public ScanException(int line, String text, String reason) {
    super("Line " + line + ": " + reason + ": '" + text + "'");
    this.line = line;
    this.text = text;
  }

  public int getLine() { return line; }
  public String getText() { return text; }
}
