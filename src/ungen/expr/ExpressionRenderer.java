package ungen.expr;

import java.util.stream.Collectors;

/**
 * Turns an expression tree back into Verilog text. {@link Parenthesized} nodes are printed as written; elsewhere parentheses
 * are only added where the operator precedences require them. For trees built by {@link ExpressionParser} or by the expansion
 * no parentheses need to be added, so their text parses back to an equal tree.
 */
public class ExpressionRenderer implements ExpressionVisitor<String, RuntimeException> {

  public String render(Expression expression) { return expression.accept(this); }

  @Override
  public String visitLiteral(Literal literal) {
    return literal.text();
  }

  @Override
  public String visitSignalReference(SignalReference reference) {
    return reference.name() + reference.select().map(this::renderSelect).orElse("");
  }

  @Override
  public String visitUnaryOp(UnaryOp unaryOp) {
    // A nested prefix operator is parenthesized, ~(&a) must not turn into ~&a.
    Expression operand = unaryOp.operand();
    return unaryOp.operator().getSymbol() + wrapIf(operand, operand.precedence() <= Precedence.UNARY);
  }

  @Override
  public String visitBinaryOp(BinaryOp binaryOp) {
    int prec = binaryOp.precedence();
    return wrapIf(binaryOp.left(), binaryOp.left().precedence() < prec) + " " + binaryOp.operator().getSymbol() + " " +
        wrapIf(binaryOp.right(), binaryOp.right().precedence() <= prec);
  }

  @Override
  public String visitTernary(Ternary ternary) {
    // mux chains nest in the else branch, render them in a loop
    StringBuilder out = new StringBuilder();
    Ternary cur = ternary;
    while (true) {
      out.append(wrapIf(cur.condition(), cur.condition().precedence() <= Precedence.TERNARY)).append(" ? ");
      out.append(render(cur.thenExpr())).append(" : ");
      if (!(cur.elseExpr() instanceof Ternary))
        break;
      cur = (Ternary)cur.elseExpr();
    }
    return out.append(render(cur.elseExpr())).toString();
  }

  @Override
  public String visitConcatenation(Concatenation concatenation) {
    return concatenation.items().stream().map(this::render).collect(Collectors.joining(",", "{", "}"));
  }

  @Override
  public String visitReplication(Replication replication) {
    String inner;
    if (replication.expression() instanceof Concatenation && ((Concatenation)replication.expression()).items().size() > 1)
      inner = ((Concatenation)replication.expression()).items().stream().map(this::render).collect(Collectors.joining(","));
    else
      inner = render(replication.expression());
    return "{" + render(replication.count()) + "{" + inner + "}}";
  }

  @Override
  public String visitSelection(Selection selection) {
    Expression base = selection.base();
    // a[i] would parse as a selected name, so a plain name base keeps its parentheses
    boolean bare = base.precedence() == Precedence.ATOM && !(base instanceof SignalReference && ((SignalReference)base).select().isEmpty());
    return wrapIf(base, !bare) + renderSelect(selection.select());
  }

  @Override
  public String visitParenthesized(Parenthesized parenthesized) {
    return "(" + render(parenthesized.inner()) + ")";
  }

  private String renderSelect(BitSelect select) {
    return "[" + render(select.first()) + select.second().map(second -> select.kind().getSeparator() + render(second)).orElse("") + "]";
  }

  private String wrapIf(Expression expression, boolean parenthesize) {
    String ret = render(expression);
    return parenthesize ? "(" + ret + ")" : ret;
  }
}
