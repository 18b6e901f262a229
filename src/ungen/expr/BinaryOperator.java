package ungen.expr;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Binary Verilog operators. All of them associate to the left. */
public enum BinaryOperator {
  LOGICAL_OR("||", Precedence.LOGICAL_OR),
  LOGICAL_AND("&&", Precedence.LOGICAL_AND),
  BITWISE_OR("|", Precedence.BITWISE_OR),
  BITWISE_XOR("^", Precedence.BITWISE_XOR),
  BITWISE_XNOR("~^", Precedence.BITWISE_XOR, "^~"),
  BITWISE_AND("&", Precedence.BITWISE_AND),
  EQ("==", Precedence.EQUALITY),
  NE("!=", Precedence.EQUALITY),
  CASE_EQ("===", Precedence.EQUALITY),
  CASE_NE("!==", Precedence.EQUALITY),
  LT("<", Precedence.RELATIONAL),
  LE("<=", Precedence.RELATIONAL),
  GT(">", Precedence.RELATIONAL),
  GE(">=", Precedence.RELATIONAL),
  SHL("<<", Precedence.SHIFT),
  SHR(">>", Precedence.SHIFT),
  ASHL("<<<", Precedence.SHIFT),
  ASHR(">>>", Precedence.SHIFT),
  ADD("+", Precedence.ADDITIVE),
  SUB("-", Precedence.ADDITIVE),
  MUL("*", Precedence.MULTIPLICATIVE),
  DIV("/", Precedence.MULTIPLICATIVE),
  MOD("%", Precedence.MULTIPLICATIVE),
  POW("**", Precedence.POWER);

  private final String symbol;
  private final int precedence;
  private final String alias;

  BinaryOperator(String symbol, int precedence) { this(symbol, precedence, null); }
  BinaryOperator(String symbol, int precedence, String alias) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.alias = alias;
  }

  /** The symbol the renderer emits. */
  public String getSymbol() { return symbol; }
  public int getPrecedence() { return precedence; }

  /** Looks up an operator by its symbol or alternative spelling. */
  public static Optional<BinaryOperator> fromSymbol(String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol) || symbol.equals(op.alias)).findFirst();
  }

  /** All operators of one precedence level. */
  public static List<BinaryOperator> atLevel(int precedence) {
    return Arrays.stream(values()).filter(op -> op.precedence == precedence).collect(Collectors.toList());
  }
}
