package ungen.expr;

/**
 * Visitor over the {@link Expression} node types.
 * @param <R> result type
 * @param <X> checked exception the visitor may throw, {@link RuntimeException} if none
 */
public interface ExpressionVisitor<R, X extends Exception> {
  R visitLiteral(Literal literal) throws X;
  R visitSignalReference(SignalReference reference) throws X;
  R visitUnaryOp(UnaryOp unaryOp) throws X;
  R visitBinaryOp(BinaryOp binaryOp) throws X;
  R visitTernary(Ternary ternary) throws X;
  R visitConcatenation(Concatenation concatenation) throws X;
  R visitReplication(Replication replication) throws X;
  R visitSelection(Selection selection) throws X;
  R visitParenthesized(Parenthesized parenthesized) throws X;
}
