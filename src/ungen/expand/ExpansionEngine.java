package ungen.expand;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import ungen.UnGenException;
import ungen.expr.BinaryOp;
import ungen.expr.BitSelect;
import ungen.expr.Concatenation;
import ungen.expr.Expression;
import ungen.expr.ExpressionParser;
import ungen.expr.ExpressionSyntaxException;
import ungen.expr.ExpressionVisitor;
import ungen.expr.Literal;
import ungen.expr.Parenthesized;
import ungen.expr.Replication;
import ungen.expr.Selection;
import ungen.expr.SignalReference;
import ungen.expr.Ternary;
import ungen.expr.UnaryOp;
import ungen.expr.UnsupportedConstructException;
import ungen.scan.Signal;

/**
 * Substitutes references to generated signals by their definitions, recursively, until only real signals, kept generated
 * signals, generated registers and references closing a cycle remain.
 */
public class ExpansionEngine {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SignalResolver resolver;
  private final GeneratedSignals generated;
  private final ExpressionParser parser = new ExpressionParser();

  public ExpansionEngine(SignalResolver resolver, GeneratedSignals generated) {
    this.resolver = resolver;
    this.generated = generated;
  }

  /**
   * Expands the definition of a signal.
   * @param root the signal to expand
   * @param keepIds generated ids to leave unexpanded
   * @return the expanded expression and the substituted signals
   * @throws DanglingReferenceException if a generated signal on the way has no definition
   * @throws ExpressionSyntaxException if a visited definition is not a valid expression
   * @throws UnsupportedConstructException if a visited definition uses an unsupported construct
   */
  public ExpansionResult expand(Signal root, Set<Integer> keepIds) throws UnGenException {
    ExpansionContext context = new ExpansionContext(keepIds);
    Expression rootExpr = parseDefinition(root);
    context.push(root.name());
    Expression ret = rootExpr.accept(new Substitution(context, root.name()));
    context.pop(root.name());
    // a definition that is a lone reference does not need the group around its replacement
    if (rootExpr instanceof SignalReference && ret instanceof Parenthesized)
      ret = ((Parenthesized)ret).inner();
    if (context.getCycleBoundaryCount() > 0)
      logger.debug("Left {} reference(s) unexpanded at cycle boundaries: {}", context.getCycleBoundaryCount(), context.getCycleBoundaries());
    return new ExpansionResult(root, ret, context.getExpanded(), context.getCycleBoundaries());
  }

  /** Parses the raw expression of a definition, attaching the signal to parse failures. */
  Expression parseDefinition(Signal signal) throws ExpressionSyntaxException, UnsupportedConstructException {
    try {
      return parser.parse(signal.rawExpression());
    } catch (ExpressionSyntaxException e) {
      throw new ExpressionSyntaxException(e, signal.name(), signal.assignmentLine());
    } catch (UnsupportedConstructException e) {
      throw new UnsupportedConstructException(e, signal.name(), signal.assignmentLine());
    }
  }

  /** Expands one generated wire whose name has been checked not to be active. */
  private Expression expandGenerated(ExpansionContext context, Signal signal) throws UnGenException {
    Optional<Expression> cached = context.getCompleted(signal.name());
    if (cached.isPresent())
      return cached.get();
    Expression definition = parseDefinition(signal);
    context.recordExpanded(signal);
    int boundariesBefore = context.getCycleBoundaryCount();
    context.push(signal.name());
    Expression ret = definition.accept(new Substitution(context, signal.name()));
    context.pop(signal.name());
    if (context.getCycleBoundaryCount() == boundariesBefore)
      context.putCompleted(signal.name(), ret);
    return ret;
  }

  /** Rebuilds a definition tree with generated references substituted. */
  private class Substitution implements ExpressionVisitor<Expression, UnGenException> {
    private final ExpansionContext context;
    /** Signal whose definition is being rebuilt. */
    private final String owner;

    Substitution(ExpansionContext context, String owner) {
      this.context = context;
      this.owner = owner;
    }

    private Expression visit(Expression expression) throws UnGenException { return expression.accept(this); }

    private Optional<Expression> visit(Optional<Expression> expression) throws UnGenException {
      return expression.isPresent() ? Optional.of(visit(expression.get())) : Optional.empty();
    }

    private BitSelect visit(BitSelect select) throws UnGenException {
      return new BitSelect(select.kind(), visit(select.first()), visit(select.second()));
    }

    @Override
    public Expression visitLiteral(Literal literal) {
      return literal;
    }

    @Override
    public Expression visitSignalReference(SignalReference reference) throws UnGenException {
      Optional<BitSelect> select = reference.select().isPresent() ? Optional.of(visit(reference.select().get())) : Optional.empty();
      SignalReference leaf = new SignalReference(reference.name(), select);
      String name = reference.name();
      if (!generated.isGenerated(name))
        return leaf;
      OptionalInt id = generated.idOf(name);
      if (context.isKept(id)) {
        logger.trace("Keeping {}", name);
        return leaf;
      }
      if (context.isActive(name)) {
        logger.debug("{} closes a cycle through {}, leaving it unexpanded", name, context.getActiveStack());
        context.recordCycleBoundary(name);
        return leaf;
      }
      Optional<Signal> signal = resolver.resolveGenerated(name, owner);
      if (signal.isEmpty())
        return leaf;
      logger.trace("Expanding {} in the definition of {}", name, owner);
      Expression replacement = expandGenerated(context, signal.get());
      if (select.isEmpty())
        return Parenthesized.around(replacement);
      if (replacement instanceof SignalReference && ((SignalReference)replacement).select().isEmpty())
        return new SignalReference(((SignalReference)replacement).name(), select);
      return new Selection(Parenthesized.around(replacement), select.get());
    }

    @Override
    public Expression visitUnaryOp(UnaryOp unaryOp) throws UnGenException {
      return new UnaryOp(unaryOp.operator(), visit(unaryOp.operand()));
    }

    @Override
    public Expression visitBinaryOp(BinaryOp binaryOp) throws UnGenException {
      return new BinaryOp(binaryOp.operator(), visit(binaryOp.left()), visit(binaryOp.right()));
    }

    @Override
    public Expression visitTernary(Ternary ternary) throws UnGenException {
      return new Ternary(visit(ternary.condition()), visit(ternary.thenExpr()), visit(ternary.elseExpr()));
    }

    @Override
    public Expression visitConcatenation(Concatenation concatenation) throws UnGenException {
      List<Expression> items = new ArrayList<>(concatenation.items().size());
      for (Expression item : concatenation.items())
        items.add(visit(item));
      return new Concatenation(items);
    }

    @Override
    public Expression visitReplication(Replication replication) throws UnGenException {
      return new Replication(visit(replication.count()), visit(replication.expression()));
    }

    @Override
    public Expression visitSelection(Selection selection) throws UnGenException {
      return new Selection(visit(selection.base()), visit(selection.select()));
    }

    @Override
    public Expression visitParenthesized(Parenthesized parenthesized) throws UnGenException {
      return new Parenthesized(visit(parenthesized.inner()));
    }
  }
}
