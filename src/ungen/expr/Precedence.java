package ungen.expr;

/** Binding strengths of the Verilog expression levels, loosest first. */
public final class Precedence {
  public static final int TERNARY = 1;
  public static final int LOGICAL_OR = 2;
  public static final int LOGICAL_AND = 3;
  public static final int BITWISE_OR = 4;
  public static final int BITWISE_XOR = 5;
  public static final int BITWISE_AND = 6;
  public static final int EQUALITY = 7;
  public static final int RELATIONAL = 8;
  public static final int SHIFT = 9;
  public static final int ADDITIVE = 10;
  public static final int MULTIPLICATIVE = 11;
  public static final int POWER = 12;
  public static final int UNARY = 13;
  /** Literals, references, concatenations and everything else that never needs parentheses. */
  public static final int ATOM = 14;

  private Precedence() {}
}
