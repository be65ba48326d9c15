package latex2go.transform;

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

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the variables an expression reads but does not bind, in
 * lexicographic order. These become the generated function's parameters.
 *
 * A derivative binds its variable inside the sampled closure but is evaluated
 * at the caller's value of that variable, so the variable stays free.
 */
public final class FreeVariables implements ExprVisitor<SortedSet<String>, RuntimeException> {
	private static final FreeVariables INSTANCE = new FreeVariables();

	private FreeVariables() {
	}

	public static SortedSet<String> of(Expr expr) {
		return Collections.unmodifiableSortedSet(expr.accept(INSTANCE));
	}

	private SortedSet<String> union(Expr... exprs) {
		SortedSet<String> names = new TreeSet<>();
		for (Expr e : exprs) {
			if (e != null) {
				names.addAll(e.accept(this));
			}
		}
		return names;
	}

	private SortedSet<String> without(Expr body, String bound) {
		SortedSet<String> names = body.accept(this);
		names.remove(bound);
		return names;
	}

	@Override
	public SortedSet<String> visitNumber(NumberLiteral number) {
		return new TreeSet<>();
	}

	@Override
	public SortedSet<String> visitVariable(Variable variable) {
		SortedSet<String> names = new TreeSet<>();
		names.add(variable.name());
		return names;
	}

	@Override
	public SortedSet<String> visitBinary(BinaryExpr binary) {
		return union(binary.left(), binary.right());
	}

	@Override
	public SortedSet<String> visitCall(FuncCall call) {
		return union(call.args().toArray(new Expr[0]));
	}

	@Override
	public SortedSet<String> visitSum(SumExpr sum) {
		SortedSet<String> names = union(sum.lower(), sum.upper());
		names.addAll(without(sum.body(), sum.var()));
		return names;
	}

	@Override
	public SortedSet<String> visitIntegral(IntegralExpr integral) {
		SortedSet<String> names = union(integral.lower(), integral.upper());
		names.addAll(without(integral.body(), integral.var()));
		return names;
	}

	@Override
	public SortedSet<String> visitDerivative(DerivativeExpr derivative) {
		SortedSet<String> names = without(derivative.body(), derivative.var());
		names.add(derivative.var());
		return names;
	}

	@Override
	public SortedSet<String> visitLimit(LimitExpr limit) {
		SortedSet<String> names = union(limit.approaches());
		names.addAll(without(limit.body(), limit.var()));
		return names;
	}

	@Override
	public SortedSet<String> visitFactorial(FactorialExpr factorial) {
		return union(factorial.operand());
	}

	@Override
	public SortedSet<String> visitPiecewise(PiecewiseExpr piecewise) {
		SortedSet<String> names = new TreeSet<>();
		for (PiecewiseCase c : piecewise.cases()) {
			names.addAll(union(c.value(), c.condition()));
		}
		return names;
	}
}
