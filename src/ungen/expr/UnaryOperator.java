package ungen.expr;

import java.util.Arrays;
import java.util.Optional;

/** Prefix Verilog operators, including the reduction operators. */
public enum UnaryOperator {
  LOGICAL_NOT("!"),
  BITWISE_NOT("~"),
  NEGATE("-"),
  PLUS("+"),
  REDUCE_AND("&"),
  REDUCE_OR("|"),
  REDUCE_XOR("^"),
  REDUCE_NAND("~&"),
  REDUCE_NOR("~|"),
  REDUCE_XNOR("~^", "^~");

  private final String symbol;
  private final String alias;

  UnaryOperator(String symbol) { this(symbol, null); }
  UnaryOperator(String symbol, String alias) {
    this.symbol = symbol;
    this.alias = alias;
  }

  public String getSymbol() { return symbol; }

  public static Optional<UnaryOperator> fromSymbol(String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol) || symbol.equals(op.alias)).findFirst();
  }
}
