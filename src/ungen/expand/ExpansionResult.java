package ungen.expand;

import java.util.List;
import ungen.expr.Expression;
import ungen.scan.Signal;

/**
 * Outcome of expanding one signal.
 * @param root the expanded signal
 * @param expression the expanded expression
 * @param expanded generated signals substituted, in first substitution order
 * @param cycleBoundaries generated references left unexpanded because they close a cycle
 */
public record ExpansionResult(Signal root, Expression expression, List<Signal> expanded, List<String> cycleBoundaries) {}
