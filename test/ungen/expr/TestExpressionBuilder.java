package ungen.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Builds random expression trees over a small set of names and literals.
 * Apart from the groups for parentheses the renderer adds, rendering and parsing a tree again must give an equal tree;
 * compare them with {@link #withoutGroups(Expression)}.
 */
class TestExpressionBuilder {
  private static final String[] names = {"a", "b", "io_in", "_GEN", "_GEN_3", "x$1"};
  private static final String[] literals = {"0", "12", "1'h0", "8'hFF", "4'b10x1", "'1", "16'sd42"};

  private final Random rand;

  TestExpressionBuilder(Random rand) { this.rand = rand; }

  /**
   * @param depth maximum nesting depth, 0 builds a leaf
   */
  Expression build(int depth) {
    if (depth <= 0)
      return leaf();
    switch (rand.nextInt(10)) {
    case 0:
      return leaf();
    case 1:
    case 2: {
      BinaryOperator[] ops = BinaryOperator.values();
      return new BinaryOp(ops[rand.nextInt(ops.length)], build(depth - 1), build(depth - 1));
    }
    case 3: {
      UnaryOperator[] ops = UnaryOperator.values();
      return new UnaryOp(ops[rand.nextInt(ops.length)], build(depth - 1));
    }
    case 4:
      return new Ternary(build(depth - 1), build(depth - 1), build(depth - 1));
    case 5: {
      int count = 1 + rand.nextInt(3);
      List<Expression> items = new ArrayList<>();
      for (int i = 0; i < count; ++i)
        items.add(build(depth - 1));
      return new Concatenation(items);
    }
    case 6: {
      Expression inner = build(depth - 1);
      if (rand.nextBoolean())
        inner = new Concatenation(List.of(inner, build(depth - 1)));
      return new Replication(Literal.of(Integer.toString(1 + rand.nextInt(8))), inner);
    }
    case 7: {
      String name = names[rand.nextInt(names.length)];
      return new SignalReference(name, Optional.of(select(depth - 1)));
    }
    case 8:
      return new Parenthesized(build(depth - 1));
    default: {
      Expression base = build(depth - 1);
      return new Selection(base, select(depth - 1));
    }
    }
  }

  /** Copy of a tree with every {@link Parenthesized} replaced by its inner expression. */
  static Expression withoutGroups(Expression expression) { return expression.accept(ungroup); }

  private static final ExpressionVisitor<Expression, RuntimeException> ungroup = new ExpressionVisitor<>() {
    private BitSelect visit(BitSelect select) {
      return new BitSelect(select.kind(), select.first().accept(this), select.second().map(second -> second.accept(this)));
    }

    @Override
    public Expression visitLiteral(Literal literal) {
      return literal;
    }

    @Override
    public Expression visitSignalReference(SignalReference reference) {
      return new SignalReference(reference.name(), reference.select().map(this::visit));
    }

    @Override
    public Expression visitUnaryOp(UnaryOp unaryOp) {
      return new UnaryOp(unaryOp.operator(), unaryOp.operand().accept(this));
    }

    @Override
    public Expression visitBinaryOp(BinaryOp binaryOp) {
      return new BinaryOp(binaryOp.operator(), binaryOp.left().accept(this), binaryOp.right().accept(this));
    }

    @Override
    public Expression visitTernary(Ternary ternary) {
      return new Ternary(ternary.condition().accept(this), ternary.thenExpr().accept(this), ternary.elseExpr().accept(this));
    }

    @Override
    public Expression visitConcatenation(Concatenation concatenation) {
      return new Concatenation(concatenation.items().stream().map(item -> item.accept(this)).toList());
    }

    @Override
    public Expression visitReplication(Replication replication) {
      return new Replication(replication.count().accept(this), replication.expression().accept(this));
    }

    @Override
    public Expression visitSelection(Selection selection) {
      return new Selection(selection.base().accept(this), visit(selection.select()));
    }

    @Override
    public Expression visitParenthesized(Parenthesized parenthesized) {
      return parenthesized.inner().accept(this);
    }
  };

  private BitSelect select(int depth) {
    BitSelect.Kind[] kinds = BitSelect.Kind.values();
    BitSelect.Kind kind = kinds[rand.nextInt(kinds.length)];
    Expression first = build(depth);
    if (kind == BitSelect.Kind.INDEX)
      return BitSelect.index(first);
    return new BitSelect(kind, first, Optional.of(build(depth)));
  }

  private Expression leaf() {
    if (rand.nextBoolean())
      return SignalReference.of(names[rand.nextInt(names.length)]);
    return Literal.of(literals[rand.nextInt(literals.length)]);
  }
}
