package ungen.expr;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ExpressionParserTest {

  private ExpressionParser parser;

  @BeforeEach
  void setUp() throws Exception {
    parser = new ExpressionParser();
  }

  private static SignalReference ref(String name) { return SignalReference.of(name); }

  @Test
  void testMultiplicationBindsTighterThanAddition() throws Exception {
    Expression e = parser.parse("a + b * c");
    Assertions.assertEquals(new BinaryOp(BinaryOperator.ADD, ref("a"), new BinaryOp(BinaryOperator.MUL, ref("b"), ref("c"))), e);
  }

  @Test
  void testBinaryOperatorsAssociateLeft() throws Exception {
    Expression e = parser.parse("a - b - c");
    Assertions.assertEquals(new BinaryOp(BinaryOperator.SUB, new BinaryOp(BinaryOperator.SUB, ref("a"), ref("b")), ref("c")), e);
  }

  @Test
  void testTernaryAssociatesRight() throws Exception {
    Expression e = parser.parse("s0 ? a : s1 ? b : c");
    Assertions.assertEquals(new Ternary(ref("s0"), ref("a"), new Ternary(ref("s1"), ref("b"), ref("c"))), e);
  }

  @Test
  void testTernaryIsLoosest() throws Exception {
    Expression e = parser.parse("io_op == 2'h0 ? a | b : c");
    Ternary ternary = Assertions.assertInstanceOf(Ternary.class, e);
    Assertions.assertEquals(new BinaryOp(BinaryOperator.EQ, ref("io_op"), Literal.of("2'h0")), ternary.condition());
    Assertions.assertEquals(new BinaryOp(BinaryOperator.BITWISE_OR, ref("a"), ref("b")), ternary.thenExpr());
  }

  @Test
  void testParenthesesAreKept() throws Exception {
    Expression sum = new BinaryOp(BinaryOperator.ADD, ref("a"), ref("b"));
    Assertions.assertEquals(new BinaryOp(BinaryOperator.BITWISE_AND, new Parenthesized(sum), ref("mask")), parser.parse("(a + b) & mask"));
    // redundant parentheses too
    Assertions.assertEquals(new Parenthesized(new Parenthesized(ref("a"))), parser.parse("((a))"));
    Assertions.assertEquals(new BinaryOp(BinaryOperator.ADD, ref("a"), new Parenthesized(new BinaryOp(BinaryOperator.MUL, ref("b"), ref("c")))),
                            parser.parse("a + (b * c)"));
  }

  @Test
  void testLongMuxChain() throws Exception {
    int count = 5000;
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; ++i)
      text.append("sel == 13'h").append(Integer.toHexString(i)).append(" ? in_").append(i).append(" : ");
    text.append("dflt");
    Expression cur = parser.parse(text.toString());
    for (int i = 0; i < count; ++i) {
      Ternary ternary = Assertions.assertInstanceOf(Ternary.class, cur, "level " + i);
      Assertions.assertEquals(ref("in_" + i), ternary.thenExpr());
      cur = ternary.elseExpr();
    }
    Assertions.assertEquals(ref("dflt"), cur);
    Assertions.assertEquals(text.toString(), new ExpressionRenderer().render(parser.parse(text.toString())));
  }

  @Test
  void testBitwiseLevels() throws Exception {
    // & binds tighter than ^, which binds tighter than |
    Expression e = parser.parse("a | b ^ c & d");
    Assertions.assertEquals(new BinaryOp(BinaryOperator.BITWISE_OR, ref("a"),
                                         new BinaryOp(BinaryOperator.BITWISE_XOR, ref("b"),
                                                      new BinaryOp(BinaryOperator.BITWISE_AND, ref("c"), ref("d")))),
                            e);
    Assertions.assertEquals(BinaryOperator.BITWISE_XNOR, ((BinaryOp)parser.parse("a ^~ b")).operator());
  }

  @Test
  void testComparisonAndShiftLevels() throws Exception {
    Expression e = parser.parse("a << 1 < b && c != d");
    Assertions.assertEquals(new BinaryOp(BinaryOperator.LOGICAL_AND,
                                         new BinaryOp(BinaryOperator.LT, new BinaryOp(BinaryOperator.SHL, ref("a"), Literal.of("1")), ref("b")),
                                         new BinaryOp(BinaryOperator.NE, ref("c"), ref("d"))),
                            e);
  }

  @Test
  void testUnaryOperators() throws Exception {
    Assertions.assertEquals(new UnaryOp(UnaryOperator.REDUCE_NOR, ref("_GEN_4")), parser.parse("~|_GEN_4"));
    Assertions.assertEquals(new UnaryOp(UnaryOperator.BITWISE_NOT, new Parenthesized(new UnaryOp(UnaryOperator.REDUCE_AND, ref("a")))),
                            parser.parse("~(&a)"));
    Assertions.assertEquals(new BinaryOp(BinaryOperator.SUB, ref("a"), new UnaryOp(UnaryOperator.NEGATE, ref("b"))), parser.parse("a - -b"));
    // prefix operators bind tighter than any binary operator
    Assertions.assertEquals(new BinaryOp(BinaryOperator.LOGICAL_AND, new UnaryOp(UnaryOperator.LOGICAL_NOT, ref("a")), ref("b")),
                            parser.parse("!a && b"));
  }

  @Test
  void testLiterals() throws Exception {
    Assertions.assertEquals(new Literal("8'hFF", Optional.of(8)), parser.parse("8'hFF"));
    Assertions.assertEquals(new Literal("4'sb1010", Optional.of(4)), parser.parse("4 'sb1010"));
    Assertions.assertEquals(new Literal("1_000", Optional.empty()), parser.parse("1_000"));
    Assertions.assertEquals(new Literal("'hx", Optional.empty()), parser.parse("'hx"));
    Assertions.assertEquals(new Literal("'0", Optional.empty()), parser.parse("'0"));
    Assertions.assertEquals(new Literal("32'd4_294_967_295", Optional.of(32)), parser.parse("32'd4_294_967_295"));
  }

  @Test
  void testSelectsOnNames() throws Exception {
    Assertions.assertEquals(new SignalReference("a", Optional.of(BitSelect.index(Literal.of("3")))), parser.parse("a[3]"));
    Assertions.assertEquals(new SignalReference("a", Optional.of(BitSelect.range(Literal.of("7"), Literal.of("0")))), parser.parse("a[7:0]"));
    Assertions.assertEquals(new SignalReference("a", Optional.of(new BitSelect(BitSelect.Kind.INDEXED_UP, ref("i"), Optional.of(Literal.of("4"))))),
                            parser.parse("a[i+:4]"));
    Assertions.assertEquals(new SignalReference("a", Optional.of(new BitSelect(BitSelect.Kind.INDEXED_DOWN, ref("i"), Optional.of(Literal.of("4"))))),
                            parser.parse("a[i -: 4]"));
  }

  @Test
  void testSelectsOnOtherPrimaries() throws Exception {
    BitSelect bit0 = BitSelect.index(Literal.of("0"));
    Assertions.assertEquals(new Selection(new Parenthesized(new BinaryOp(BinaryOperator.ADD, ref("a"), ref("b"))), bit0), parser.parse("(a + b)[0]"));
    Assertions.assertEquals(new Selection(new Concatenation(List.of(ref("a"), ref("b"))), bit0), parser.parse("{a, b}[0]"));
    // a second select applies to the selected bits
    Assertions.assertEquals(new Selection(new SignalReference("mem", Optional.of(BitSelect.index(ref("addr")))), bit0),
                            parser.parse("mem[addr][0]"));
    // a parenthesized name is not a bare name any more
    Assertions.assertEquals(new Selection(new Parenthesized(ref("a")), bit0), parser.parse("(a)[0]"));
  }

  @Test
  void testConcatenationAndReplication() throws Exception {
    Assertions.assertEquals(new Concatenation(List.of(ref("a"), Literal.of("1'h0"), ref("b"))), parser.parse("{a, 1'h0, b}"));
    Assertions.assertEquals(new Replication(Literal.of("2"), ref("io_op")), parser.parse("{2{io_op}}"));
    Assertions.assertEquals(new Replication(Literal.of("4"), new Concatenation(List.of(ref("a"), ref("b")))), parser.parse("{4{a, b}}"));
    Assertions.assertEquals(new Replication(Literal.of("2"), new Concatenation(List.of(ref("a")))), parser.parse("{2{{a}}}"));
    Assertions.assertEquals(new Concatenation(List.of(new Replication(Literal.of("3"), ref("s")), ref("x"))), parser.parse("{{3{s}}, x}"));
  }

  @Test
  void testWhitespaceIsInsignificant() throws Exception {
    Assertions.assertEquals(parser.parse("a&b|c"), parser.parse("  a &\n b\t| c "));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "a +", "(a", "a)", "a b", "{}", "{2{}}", "a[1", "a[]", "a ? b", "8'q3", "8'h", "0'h1", "3x", "'", "a # b",
                          "{a, }"})
  void testSyntaxErrors(String text) {
    Assertions.assertThrows(ExpressionSyntaxException.class, () -> parser.parse(text));
  }

  @ParameterizedTest
  @ValueSource(strings = {"$signed(a)", "`WIDTH", "\"text\"", "\\esc ", "a.b", "top.sub.sig", "f(a)", "1.5", "a + $clog2(b)"})
  void testUnsupportedConstructs(String text) {
    Assertions.assertThrows(UnsupportedConstructException.class, () -> parser.parse(text));
  }

  @Test
  void testErrorColumn() {
    var e = Assertions.assertThrows(ExpressionSyntaxException.class, () -> parser.parse("a + b )"));
    Assertions.assertEquals(6, e.getColumn());
    Assertions.assertEquals("a + b )", e.getExpression());
    Assertions.assertTrue(e.getSignal().isEmpty());
  }
}
