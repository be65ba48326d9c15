package latex2go.ast.latex;

public interface ExprVisitor<R, X extends Exception> {
	R visitNumber(NumberLiteral number) throws X;

	R visitVariable(Variable variable) throws X;

	R visitBinary(BinaryExpr binary) throws X;

	R visitCall(FuncCall call) throws X;

	R visitSum(SumExpr sum) throws X;

	R visitIntegral(IntegralExpr integral) throws X;

	R visitDerivative(DerivativeExpr derivative) throws X;

	R visitLimit(LimitExpr limit) throws X;

	R visitFactorial(FactorialExpr factorial) throws X;

	R visitPiecewise(PiecewiseExpr piecewise) throws X;
}
