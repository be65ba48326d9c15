package latex2go.parse.latex;

import latex2go.ast.latex.BinaryExpr;
import latex2go.ast.latex.DerivativeExpr;
import latex2go.ast.latex.Expr;
import latex2go.ast.latex.ExprVisitor;
import latex2go.ast.latex.FactorialExpr;
import latex2go.ast.latex.FuncCall;
import latex2go.ast.latex.IntegralExpr;
import latex2go.ast.latex.LimitExpr;
import latex2go.ast.latex.NumberLiteral;
import latex2go.ast.latex.PiecewiseCase;
import latex2go.ast.latex.PiecewiseExpr;
import latex2go.ast.latex.SumExpr;
import latex2go.ast.latex.Variable;

/**
 * Prints an Expr as a compact s-expression so tests can compare whole trees.
 */
final class ExprFormatter implements ExprVisitor<String, RuntimeException> {
	static String format(Expr expr) {
		return expr.accept(new ExprFormatter());
	}

	@Override
	public String visitNumber(NumberLiteral number) {
		double v = number.value();
		return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
	}

	@Override
	public String visitVariable(Variable variable) {
		return variable.name();
	}

	@Override
	public String visitBinary(BinaryExpr binary) {
		return "(" + binary.op() + " " + binary.left().accept(this) + " " + binary.right().accept(this) + ")";
	}

	@Override
	public String visitCall(FuncCall call) {
		StringBuilder sb = new StringBuilder("(\\").append(call.name());
		for (Expr arg : call.args()) {
			sb.append(' ').append(arg.accept(this));
		}
		return sb.append(')').toString();
	}

	@Override
	public String visitSum(SumExpr sum) {
		return "(" + (sum.product() ? "prod" : "sum") + " " + sum.var() + " " + sum.lower().accept(this) + " "
				+ sum.upper().accept(this) + " " + sum.body().accept(this) + ")";
	}

	@Override
	public String visitIntegral(IntegralExpr integral) {
		String bounds = integral.definite()
				? " " + integral.lower().accept(this) + " " + integral.upper().accept(this)
				: "";
		return "(int " + integral.var() + bounds + " " + integral.body().accept(this) + ")";
	}

	@Override
	public String visitDerivative(DerivativeExpr derivative) {
		return "(" + (derivative.partial() ? "partial" : "d") + " " + derivative.var() + " " + derivative.order()
				+ " " + derivative.body().accept(this) + ")";
	}

	@Override
	public String visitLimit(LimitExpr limit) {
		return "(lim " + limit.var() + " " + limit.approaches().accept(this) + " " + limit.body().accept(this) + ")";
	}

	@Override
	public String visitFactorial(FactorialExpr factorial) {
		return "(! " + factorial.operand().accept(this) + ")";
	}

	@Override
	public String visitPiecewise(PiecewiseExpr piecewise) {
		StringBuilder sb = new StringBuilder("(cases");
		for (PiecewiseCase c : piecewise.cases()) {
			sb.append(" (").append(c.value().accept(this)).append(' ')
					.append(c.isDefault() ? "otherwise" : c.condition().accept(this)).append(')');
		}
		return sb.append(')').toString();
	}
}
