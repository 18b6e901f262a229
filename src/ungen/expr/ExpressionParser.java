package ungen.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent parser for the right-hand sides of Verilog assignments.
 * <p>
 * Levels, loosest first: <code>?:</code> (right associative), <code>||</code>, <code>&amp;&amp;</code>, <code>|</code>,
 * <code>^ ~^</code>, <code>&amp;</code>, equality, relational, shift, additive, multiplicative, <code>**</code>, prefix operators, then
 * literals, references with an optional select, parentheses, concatenations and replications.
 * <p>
 * A parser instance is stateless; {@link #parse(String)} may be called any number of times.
 */
public class ExpressionParser {

  /**
   * Parses an expression.
   * @param rawText expression text without the terminating semicolon
   * @return the expression tree
   * @throws ExpressionSyntaxException if the text is not a well-formed expression
   * @throws UnsupportedConstructException if the text uses a construct outside the supported subset
   */
  public Expression parse(String rawText) throws ExpressionSyntaxException, UnsupportedConstructException {
    return new Run(rawText, new ExpressionLexer(rawText).tokenize()).parseAll();
  }

  /** State of a single parse. */
  private static class Run {
    private final String text;
    private final List<Token> tokens;
    private int cur = 0;

    Run(String text, List<Token> tokens) {
      this.text = text;
      this.tokens = tokens;
    }

    Expression parseAll() throws ExpressionSyntaxException, UnsupportedConstructException {
      if (peek().type() == Token.Type.END)
        throw new ExpressionSyntaxException(text, 0, "Empty expression");
      Expression ret = parseTernary();
      if (peek().type() != Token.Type.END)
        throw error("Unexpected " + peek() + " after expression");
      return ret;
    }

    private Token peek() { return tokens.get(cur); }
    private Token consume() { return tokens.get(cur++); }

    private ExpressionSyntaxException error(String reason) { return new ExpressionSyntaxException(text, peek().position(), reason); }

    private void expect(String symbol) throws ExpressionSyntaxException {
      if (!peek().is(symbol))
        throw error("Expected '" + symbol + "' but found " + peek());
      cur++;
    }

    /** Parses <code>c0 ? t0 : c1 ? t1 : ... : e</code>; the else-chain of a mux is collected in a loop. */
    private Expression parseTernary() throws ExpressionSyntaxException, UnsupportedConstructException {
      List<Expression> conditions = new ArrayList<>();
      List<Expression> thenExprs = new ArrayList<>();
      Expression operand = parseBinary(Precedence.LOGICAL_OR);
      while (peek().is("?")) {
        cur++;
        conditions.add(operand);
        thenExprs.add(parseTernary());
        expect(":");
        operand = parseBinary(Precedence.LOGICAL_OR);
      }
      Expression ret = operand;
      for (int i = conditions.size() - 1; i >= 0; --i)
        ret = new Ternary(conditions.get(i), thenExprs.get(i), ret);
      return ret;
    }

    private Expression parseBinary(int level) throws ExpressionSyntaxException, UnsupportedConstructException {
      if (level > Precedence.POWER)
        return parseUnary();
      Expression left = parseBinary(level + 1);
      while (true) {
        Optional<BinaryOperator> op = binaryOperatorAt(level);
        if (op.isEmpty())
          return left;
        cur++;
        Expression right = parseBinary(level + 1);
        left = new BinaryOp(op.get(), left, right);
      }
    }

    private Optional<BinaryOperator> binaryOperatorAt(int level) {
      Token token = peek();
      if (token.type() != Token.Type.SYMBOL)
        return Optional.empty();
      return BinaryOperator.fromSymbol(token.text()).filter(op -> op.getPrecedence() == level);
    }

    private Expression parseUnary() throws ExpressionSyntaxException, UnsupportedConstructException {
      Token token = peek();
      if (token.type() == Token.Type.SYMBOL) {
        Optional<UnaryOperator> op = UnaryOperator.fromSymbol(token.text());
        if (op.isPresent()) {
          cur++;
          return new UnaryOp(op.get(), parseUnary());
        }
      }
      return parseSelects(parsePrimary());
    }

    /** A primary together with the information whether it is a bare name that may take its select directly. */
    private record Primary(Expression expression, boolean bareName) {}

    private Primary parsePrimary() throws ExpressionSyntaxException, UnsupportedConstructException {
      Token token = consume();
      switch (token.type()) {
      case NUMBER:
        return new Primary(Literal.of(token.text()), false);
      case IDENTIFIER:
        if (peek().is("("))
          throw new UnsupportedConstructException(text, token.position(), "function call " + token.text() + "(...)");
        return new Primary(SignalReference.of(token.text()), true);
      case END:
        throw new ExpressionSyntaxException(text, token.position(), "Unexpected end of expression");
      default:
        break;
      }
      if (token.is("(")) {
        Expression inner = parseTernary();
        expect(")");
        return new Primary(new Parenthesized(inner), false);
      }
      if (token.is("{"))
        return new Primary(parseBraces(), false);
      throw new ExpressionSyntaxException(text, token.position(), "Unexpected " + token);
    }

    /** Concatenation or replication; the opening brace has been consumed. */
    private Expression parseBraces() throws ExpressionSyntaxException, UnsupportedConstructException {
      if (peek().is("}"))
        throw error("Empty concatenation");
      Expression first = parseTernary();
      if (peek().is("{")) {
        cur++;
        List<Expression> items = parseList();
        expect("}");
        return new Replication(first, items.size() == 1 ? items.get(0) : new Concatenation(items));
      }
      List<Expression> items = new ArrayList<>();
      items.add(first);
      while (peek().is(",")) {
        cur++;
        items.add(parseTernary());
      }
      expect("}");
      return new Concatenation(items);
    }

    /** Comma separated items up to and including the closing brace. */
    private List<Expression> parseList() throws ExpressionSyntaxException, UnsupportedConstructException {
      if (peek().is("}"))
        throw error("Empty replication");
      List<Expression> items = new ArrayList<>();
      items.add(parseTernary());
      while (peek().is(",")) {
        cur++;
        items.add(parseTernary());
      }
      expect("}");
      return items;
    }

    private Expression parseSelects(Primary primary) throws ExpressionSyntaxException, UnsupportedConstructException {
      Expression ret = primary.expression();
      boolean bareName = primary.bareName();
      while (peek().is("[")) {
        cur++;
        BitSelect select = parseSelect();
        if (bareName)
          ret = new SignalReference(((SignalReference)ret).name(), Optional.of(select));
        else
          ret = new Selection(ret, select);
        bareName = false;
      }
      return ret;
    }

    /** Select contents; the opening bracket has been consumed. */
    private BitSelect parseSelect() throws ExpressionSyntaxException, UnsupportedConstructException {
      Expression first = parseTernary();
      BitSelect.Kind kind = BitSelect.Kind.INDEX;
      if (peek().is(":"))
        kind = BitSelect.Kind.RANGE;
      else if (peek().is("+:"))
        kind = BitSelect.Kind.INDEXED_UP;
      else if (peek().is("-:"))
        kind = BitSelect.Kind.INDEXED_DOWN;
      Optional<Expression> second = Optional.empty();
      if (kind != BitSelect.Kind.INDEX) {
        cur++;
        second = Optional.of(parseTernary());
      }
      expect("]");
      return new BitSelect(kind, first, second);
    }
  }
}
