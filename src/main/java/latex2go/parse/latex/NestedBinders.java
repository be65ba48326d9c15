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
 * Finds a construct inside a body that binds the given variable name again.
 * Rebinding a name inside its own scope is rejected.
 */
final class NestedBinders implements ExprVisitor<Expr, RuntimeException> {
	private final String name;

	private NestedBinders(String name) {
		this.name = name;
	}

	/**
	 * @return the first nested construct rebinding {@code name}, or null
	 */
	static Expr findRebinding(Expr body, String name) {
		return body == null ? null : body.accept(new NestedBinders(name));
	}

	private Expr scan(Expr... exprs) {
		for (Expr e : exprs) {
			if (e == null) {
				continue;
			}
			Expr found = e.accept(this);
			if (found != null) {
				return found;
			}
		}
		return null;
	}

	@Override
	public Expr visitNumber(NumberLiteral number) {
		return null;
	}

	@Override
	public Expr visitVariable(Variable variable) {
		return null;
	}

	@Override
	public Expr visitBinary(BinaryExpr binary) {
		return scan(binary.left(), binary.right());
	}

	@Override
	public Expr visitCall(FuncCall call) {
		return scan(call.args().toArray(new Expr[0]));
	}

	@Override
	public Expr visitSum(SumExpr sum) {
		return sum.var().equals(name) ? sum : scan(sum.lower(), sum.upper(), sum.body());
	}

	@Override
	public Expr visitIntegral(IntegralExpr integral) {
		return integral.var().equals(name) ? integral : scan(integral.lower(), integral.upper(), integral.body());
	}

	@Override
	public Expr visitDerivative(DerivativeExpr derivative) {
		return derivative.var().equals(name) ? derivative : scan(derivative.body());
	}

	@Override
	public Expr visitLimit(LimitExpr limit) {
		return limit.var().equals(name) ? limit : scan(limit.approaches(), limit.body());
	}

	@Override
	public Expr visitFactorial(FactorialExpr factorial) {
		return scan(factorial.operand());
	}

	@Override
	public Expr visitPiecewise(PiecewiseExpr piecewise) {
		for (PiecewiseCase c : piecewise.cases()) {
			Expr found = scan(c.value(), c.condition());
			if (found != null) {
				return found;
			}
		}
		return null;
	}
}
