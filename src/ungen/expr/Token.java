package ungen.expr;

/**
 * Lexical token of an expression.
 * @param position 0-based offset of the token in the expression text
 */
record Token(Type type, String text, int position) {
  enum Type { IDENTIFIER, NUMBER, SYMBOL, END }

  boolean is(String symbol) { return type == Type.SYMBOL && text.equals(symbol); }

  @Override
  public String toString() {
    return type == Type.END ? "end of expression" : "'" + text + "'";
  }
}
