package latex2go.ast.latex;

import latex2go.ast.SourceSpan;

/**
 * Closed set of expression nodes produced by the LaTeX parser.
 *
 * Every consumer goes through {@link ExprVisitor}, so adding a variant breaks
 * the build until parser and generator both handle it.
 */
public sealed interface Expr permits NumberLiteral, Variable, BinaryExpr, FuncCall, SumExpr, IntegralExpr,
		DerivativeExpr, LimitExpr, FactorialExpr, PiecewiseExpr {
	SourceSpan span();

	<R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X;
}
