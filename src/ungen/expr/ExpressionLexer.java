package ungen.expr;

import java.util.ArrayList;
import java.util.List;

/** Splits expression text into {@link Token}s. */
class ExpressionLexer {
  /** Operator and punctuation symbols, longest first so that matching is greedy. */
  private static final String[] symbols = {"<<<", ">>>", "===", "!==", "==", "!=", "<=", ">=", "<<", ">>", "&&", "||", "~&", "~|", "~^",
                                           "^~", "**", "+:", "-:", "+", "-", "*", "/", "%", "<", ">", "!", "~", "&", "|", "^", "?",
                                           ":", "(", ")", "{", "}", "[", "]", ","};

  private final String text;
  private int pos = 0;

  ExpressionLexer(String text) { this.text = text; }

  List<Token> tokenize() throws ExpressionSyntaxException, UnsupportedConstructException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
        pos++;
      if (pos >= text.length()) {
        tokens.add(new Token(Token.Type.END, "", pos));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private Token next() throws ExpressionSyntaxException, UnsupportedConstructException {
    int start = pos;
    char c = text.charAt(pos);
    if (isIdentStart(c)) {
      while (pos < text.length() && isIdentPart(text.charAt(pos)))
        pos++;
      if (pos + 1 < text.length() && text.charAt(pos) == '.' && isIdentStart(text.charAt(pos + 1)))
        throw new UnsupportedConstructException(text, start, "hierarchical reference " + text.substring(start, pos) + ".");
      return new Token(Token.Type.IDENTIFIER, text.substring(start, pos), start);
    }
    if (Character.isDigit(c))
      return number(start);
    if (c == '\'')
      return basedNumber(start, start);
    switch (c) {
    case '$':
      pos++;
      while (pos < text.length() && isIdentPart(text.charAt(pos)))
        pos++;
      throw new UnsupportedConstructException(text, start, "system function " + text.substring(start, pos));
    case '`':
      throw new UnsupportedConstructException(text, start, "macro usage");
    case '"':
      throw new UnsupportedConstructException(text, start, "string literal");
    case '\\':
      throw new UnsupportedConstructException(text, start, "escaped identifier");
    case '.':
      throw new UnsupportedConstructException(text, start, "member access");
    default:
      break;
    }
    for (String symbol : symbols) {
      if (text.startsWith(symbol, pos)) {
        pos += symbol.length();
        return new Token(Token.Type.SYMBOL, symbol, start);
      }
    }
    throw new ExpressionSyntaxException(text, start, "Unexpected character '" + c + "'");
  }

  /** Decimal number, optionally the size of a based literal like <code>8'hFF</code>. */
  private Token number(int start) throws ExpressionSyntaxException, UnsupportedConstructException {
    while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
      pos++;
    String digits = text.substring(start, pos);
    int afterSpace = pos;
    while (afterSpace < text.length() && Character.isWhitespace(text.charAt(afterSpace)))
      afterSpace++;
    if (afterSpace < text.length() && text.charAt(afterSpace) == '\'') {
      try {
        if (Integer.parseInt(digits.replace("_", "")) <= 0)
          throw new ExpressionSyntaxException(text, start, "Literal width must be positive");
      } catch (NumberFormatException e) {
        throw new ExpressionSyntaxException(text, start, "Literal width " + digits + " out of range");
      }
      pos = afterSpace;
      Token based = basedNumber(afterSpace, start);
      return new Token(Token.Type.NUMBER, digits + based.text(), start);
    }
    if (pos + 1 < text.length() && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1)))
      throw new UnsupportedConstructException(text, start, "real literal");
    if (pos < text.length() && isIdentStart(text.charAt(pos)))
      throw new ExpressionSyntaxException(text, pos, "Malformed number '" + text.substring(start, pos + 1) + "'");
    return new Token(Token.Type.NUMBER, digits, start);
  }

  /**
   * Based part of a literal starting at the tick, e.g. <code>'hFF</code>, <code>'sd3</code>, or a fill literal <code>'0</code>.
   * The returned text has whitespace removed.
   */
  private Token basedNumber(int tick, int tokenStart) throws ExpressionSyntaxException {
    pos = tick + 1;
    if (pos >= text.length())
      throw new ExpressionSyntaxException(text, tick, "Incomplete based literal");
    StringBuilder based = new StringBuilder("'");
    char c = text.charAt(pos);
    if (c == 's' || c == 'S') {
      based.append(c);
      pos++;
      if (pos >= text.length())
        throw new ExpressionSyntaxException(text, tick, "Incomplete based literal");
      c = text.charAt(pos);
    }
    String digitChars;
    switch (Character.toLowerCase(c)) {
    case 'b':
      digitChars = "01xz?_";
      break;
    case 'o':
      digitChars = "01234567xz?_";
      break;
    case 'd':
      digitChars = "0123456789xz?_";
      break;
    case 'h':
      digitChars = "0123456789abcdefxz?_";
      break;
    case '0':
    case '1':
    case 'x':
    case 'z':
      if (based.length() == 1 && tick == tokenStart) {
        // fill literal
        pos++;
        if (pos < text.length() && isIdentPart(text.charAt(pos)))
          throw new ExpressionSyntaxException(text, tokenStart, "Malformed fill literal");
        return new Token(Token.Type.NUMBER, "'" + c, tokenStart);
      }
      // fall through
    default:
      throw new ExpressionSyntaxException(text, pos, "Invalid base '" + c + "' in literal");
    }
    based.append(c);
    pos++;
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
      pos++;
    int digitsStart = pos;
    while (pos < text.length() && digitChars.indexOf(Character.toLowerCase(text.charAt(pos))) >= 0)
      pos++;
    if (pos == digitsStart)
      throw new ExpressionSyntaxException(text, digitsStart, "Missing digits in based literal");
    if (pos < text.length() && isIdentPart(text.charAt(pos)))
      throw new ExpressionSyntaxException(text, pos, "Invalid digit '" + text.charAt(pos) + "' in based literal");
    based.append(text, digitsStart, pos);
    return new Token(Token.Type.NUMBER, based.toString(), tokenStart);
  }

  static boolean isIdentStart(char c) { return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'; }
  static boolean isIdentPart(char c) { return isIdentStart(c) || (c >= '0' && c <= '9') || c == '$'; }
}
