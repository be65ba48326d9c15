package latex2go.transform;

import latex2go.ast.golang.GoAssignOpStmt;
import latex2go.ast.golang.GoBasicLit;
import latex2go.ast.golang.GoBinaryExpr;
import latex2go.ast.golang.GoBlock;
import latex2go.ast.golang.GoCallExpr;
import latex2go.ast.golang.GoCommentStmt;
import latex2go.ast.golang.GoDefineStmt;
import latex2go.ast.golang.GoExpr;
import latex2go.ast.golang.GoFile;
import latex2go.ast.golang.GoForStmt;
import latex2go.ast.golang.GoFuncDecl;
import latex2go.ast.golang.GoFuncLit;
import latex2go.ast.golang.GoIdent;
import latex2go.ast.golang.GoIfStmt;
import latex2go.ast.golang.GoImportDecl;
import latex2go.ast.golang.GoIncStmt;
import latex2go.ast.golang.GoParam;
import latex2go.ast.golang.GoParenExpr;
import latex2go.ast.golang.GoReturnStmt;
import latex2go.ast.golang.GoSelectorExpr;
import latex2go.ast.golang.GoStmt;
import latex2go.ast.golang.GoVarStmt;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * LaTeX AST -> Go AST lowering.
 *
 * Constructs without a closed form are replaced by fixed numerical schemes:
 * trapezoidal integration, central differences and a one-sided epsilon step
 * for limits. Helper identifiers all start with '_', which no LaTeX identifier can.
 */
public final class LatexToGoTransformer {
	private static final Logger logger = LoggerFactory.getLogger(LatexToGoTransformer.class);

	static final String FLOAT = "float64";
	static final String MATH = "math";

	private static final Set<String> MATH_FUNCTIONS = Set.of("Sqrt", "Sin", "Cos", "Tan");

	static final int INTEGRAL_PANELS = 1000;
	static final String FIRST_DERIVATIVE_STEP = "1e-5";
	static final String SECOND_DERIVATIVE_STEP = "1e-4";
	static final String LIMIT_EPSILON = "1e-10";

	public GoTranslation transform(Expr root, String packageName, String functionName) throws GenerateException {
		Objects.requireNonNull(root, "root");
		Objects.requireNonNull(packageName, "packageName");
		Objects.requireNonNull(functionName, "functionName");

		Lowering lowering = new Lowering();
		Lowered body = root.accept(lowering);

		List<String> parameters = FreeVariables.of(root).stream()
				.map(GoNames::sanitize)
				.collect(Collectors.toList());
		List<GoParam> params = parameters.stream()
				.map(name -> new GoParam(name, FLOAT))
				.collect(Collectors.toList());
		List<GoImportDecl> imports = body.needsMath() ? List.of(new GoImportDecl(MATH)) : List.of();

		GoFuncDecl func = new GoFuncDecl(functionName, params, FLOAT, body.asBody());
		logger.debug("lowered {} into func {} with parameters {}", root.getClass().getSimpleName(), functionName,
				parameters);
		return new GoTranslation(new GoFile(packageName, imports, List.of(func)), parameters, body.needsMath(),
				lowering.limitations);
	}

	/**
	 * Lowers a single sub-expression without wrapping it into a file.
	 */
	public Lowered lower(Expr expr) throws GenerateException {
		return expr.accept(new Lowering());
	}

	private static final class Lowering implements ExprVisitor<Lowered, GenerateException> {
		private final List<Limitation> limitations = new ArrayList<>();

		@Override
		public Lowered visitNumber(NumberLiteral literal) throws GenerateException {
			double value = literal.value();
			if (Double.isInfinite(value) || Double.isNaN(value)) {
				throw new GenerateException(GenerateException.Kind.UNSUPPORTED_CONSTRUCT,
						"number literal out of range at pos " + literal.span().startOffset());
			}
			return Lowered.expr(lit(goNumber(literal.text())), false);
		}

		@Override
		public Lowered visitVariable(Variable variable) {
			return Lowered.expr(ident(GoNames.sanitize(variable.name())), false);
		}

		@Override
		public Lowered visitBinary(BinaryExpr binary) throws GenerateException {
			String op = binary.op();
			if (binary.isComparison()) {
				throw new GenerateException(GenerateException.Kind.UNSUPPORTED_CONSTRUCT,
						"comparison '" + op + "' is only supported as a cases condition");
			}

			Lowered left = binary.left().accept(this);
			Lowered right = binary.right().accept(this);
			boolean needsMath = left.needsMath() || right.needsMath();

			switch (op) {
				case "+", "-", "*" -> {
					return Lowered.expr(binary(left.asExpr(), op, right.asExpr()), needsMath);
				}
				case "/" -> {
					return divide(left, right, false);
				}
				case "^" -> {
					return Lowered.expr(mathCall("Pow", left.asExpr(), right.asExpr()), true);
				}
				default -> throw new GenerateException(GenerateException.Kind.UNSUPPORTED_CONSTRUCT,
						"unsupported binary operator: " + op);
			}
		}

		@Override
		public Lowered visitCall(FuncCall call) throws GenerateException {
			String name = call.name();
			List<Expr> args = call.args();

			if (name.equals("frac")) {
				if (args.size() != 2) {
					throw new GenerateException(GenerateException.Kind.MALFORMED_AST,
							"\\frac requires 2 argument(s), got " + args.size());
				}
				Lowered numerator = args.get(0).accept(this);
				Lowered denominator = args.get(1).accept(this);
				return divide(numerator, denominator, true);
			}

			String goName = titleCase(name);
			if (!MATH_FUNCTIONS.contains(goName)) {
				throw new GenerateException(GenerateException.Kind.UNSUPPORTED_CONSTRUCT,
						"unsupported LaTeX function: " + name);
			}
			if (args.size() != 1) {
				throw new GenerateException(GenerateException.Kind.MALFORMED_AST,
						"\\" + name + " requires 1 argument(s), got " + args.size());
			}
			Lowered arg = args.get(0).accept(this);
			return Lowered.expr(mathCall(goName, arg.asExpr()), true);
		}

		@Override
		public Lowered visitFactorial(FactorialExpr factorial) throws GenerateException {
			// n! = Gamma(n + 1)
			Lowered operand = factorial.operand().accept(this);
			return Lowered.expr(mathCall("Gamma", binary(operand.asExpr(), "+", lit("1.0"))), true);
		}

		@Override
		public Lowered visitSum(SumExpr sum) throws GenerateException {
			String construct = sum.product() ? "\\prod" : "\\sum";
			String var = GoNames.sanitize(sum.var());
			String acc = sum.product() ? "_prod" : "_sum";
			List<GoStmt> stmts = new ArrayList<>();

			Lowered lower = lowerBound(sum.lower(), construct + " lower bound", stmts);
			Lowered upper = lowerBound(sum.upper(), construct + " upper bound", stmts);
			Lowered body = sum.body().accept(this);

			// both bounds are read before the counter shadows a parameter of the same name
			stmts.add(new GoDefineStmt(acc, lit(sum.product() ? "1.0" : "0.0")));
			stmts.add(new GoVarStmt("_lo", FLOAT, lower.asExpr(), "Lower bound"));
			stmts.add(new GoVarStmt("_hi", FLOAT, upper.asExpr(), "Upper bound"));
			stmts.add(new GoForStmt(
					new GoDefineStmt(var, ident("_lo")),
					binary(ident(var), "<=", ident("_hi")),
					new GoIncStmt(var),
					GoBlock.of(new GoAssignOpStmt(acc, sum.product() ? "*" : "+", body.asExpr()))));
			stmts.add(new GoReturnStmt(ident(acc)));

			return Lowered.block(stmts, lower.needsMath() || upper.needsMath() || body.needsMath());
		}

		private Lowered lowerBound(Expr bound, String description, List<GoStmt> stmts) throws GenerateException {
			if (bound instanceof NumberLiteral literal) {
				double value = literal.value();
				if (value == Math.rint(value) && !Double.isInfinite(value)) {
					return literal.accept(this);
				}
				note(Limitation.Kind.SUMMATION_BOUND_TRUNCATED,
						description + " " + literal.text() + " is truncated to an integer", stmts);
			}
			Lowered lowered = bound.accept(this);
			return Lowered.expr(mathCall("Trunc", lowered.asExpr()), true);
		}

		@Override
		public Lowered visitIntegral(IntegralExpr integral) throws GenerateException {
			String var = GoNames.sanitize(integral.var());
			Lowered body = integral.body().accept(this);
			List<GoStmt> stmts = new ArrayList<>();

			if (!integral.definite()) {
				note(Limitation.Kind.INDEFINITE_INTEGRAL,
						"indefinite integral with respect to " + var + " has no numeric value; returning NaN", stmts);
				stmts.add(new GoReturnStmt(mathCall("NaN")));
				return Lowered.block(stmts, true);
			}
			if (integral.lower() == null || integral.upper() == null) {
				throw new GenerateException(GenerateException.Kind.MALFORMED_AST,
						"definite integral requires both a lower and an upper bound");
			}

			Lowered lower = integral.lower().accept(this);
			Lowered upper = integral.upper().accept(this);

			stmts.add(closure(var, body));
			stmts.add(new GoVarStmt("_a", FLOAT, lower.asExpr(), "Lower bound"));
			stmts.add(new GoVarStmt("_b", FLOAT, upper.asExpr(), "Upper bound"));
			stmts.add(new GoDefineStmt("_n", lit(Integer.toString(INTEGRAL_PANELS)), "Trapezoidal rule panels"));
			stmts.add(new GoDefineStmt("_h",
					binary(binary(ident("_b"), "-", ident("_a")), "/", call(ident(FLOAT), ident("_n")))));
			stmts.add(new GoDefineStmt("_sum",
					binary(lit("0.5"), "*", binary(sample(ident("_a")), "+", sample(ident("_b"))))));
			GoExpr interior = binary(ident("_a"), "+", binary(call(ident(FLOAT), ident("_k")), "*", ident("_h")));
			stmts.add(new GoForStmt(
					new GoDefineStmt("_k", lit("1")),
					binary(ident("_k"), "<", ident("_n")),
					new GoIncStmt("_k"),
					GoBlock.of(new GoAssignOpStmt("_sum", "+", sample(interior)))));
			stmts.add(new GoReturnStmt(binary(ident("_sum"), "*", ident("_h"))));

			return Lowered.block(stmts, body.needsMath() || lower.needsMath() || upper.needsMath());
		}

		@Override
		public Lowered visitDerivative(DerivativeExpr derivative) throws GenerateException {
			String var = GoNames.sanitize(derivative.var());
			Lowered body = derivative.body().accept(this);
			GoExpr at = ident(var);
			GoExpr h = ident("_h");
			List<GoStmt> stmts = new ArrayList<>();

			switch (derivative.order()) {
				case 1 -> {
					stmts.add(closure(var, body));
					stmts.add(new GoDefineStmt("_h", lit(FIRST_DERIVATIVE_STEP), "Central difference approximation"));
					GoExpr numerator = binary(sample(binary(at, "+", h)), "-", sample(binary(at, "-", h)));
					stmts.add(new GoReturnStmt(binary(numerator, "/", binary(lit("2"), "*", h))));
					return Lowered.block(stmts, body.needsMath());
				}
				case 2 -> {
					stmts.add(closure(var, body));
					stmts.add(new GoDefineStmt("_h", lit(SECOND_DERIVATIVE_STEP),
							"Second-order central difference approximation"));
					GoExpr numerator = binary(
							binary(sample(binary(at, "+", h)), "-", binary(lit("2"), "*", sample(at))),
							"+",
							sample(binary(at, "-", h)));
					stmts.add(new GoReturnStmt(binary(numerator, "/", binary(h, "*", h))));
					return Lowered.block(stmts, body.needsMath());
				}
				default -> {
					note(Limitation.Kind.UNSUPPORTED_DERIVATIVE_ORDER,
							"derivative of order " + derivative.order() + " is not supported; returning 0", stmts);
					stmts.add(new GoReturnStmt(lit("0.0")));
					return Lowered.block(stmts, false);
				}
			}
		}

		@Override
		public Lowered visitLimit(LimitExpr limit) throws GenerateException {
			String var = GoNames.sanitize(limit.var());
			Lowered approaches = limit.approaches().accept(this);
			Lowered body = limit.body().accept(this);

			List<GoStmt> stmts = new ArrayList<>();
			stmts.add(closure(var, body));
			stmts.add(new GoDefineStmt("_epsilon", lit(LIMIT_EPSILON), "Approach from above by a small epsilon"));
			stmts.add(new GoReturnStmt(sample(binary(approaches.asExpr(), "+", ident("_epsilon")))));
			return Lowered.block(stmts, approaches.needsMath() || body.needsMath());
		}

		@Override
		public Lowered visitPiecewise(PiecewiseExpr piecewise) throws GenerateException {
			List<PiecewiseCase> cases = piecewise.cases();
			if (cases.isEmpty()) {
				throw new GenerateException(GenerateException.Kind.MALFORMED_AST, "cases environment has no cases");
			}

			List<GoStmt> stmts = new ArrayList<>();
			boolean needsMath = false;
			boolean hasDefault = false;
			for (int i = 0; i < cases.size(); i++) {
				PiecewiseCase c = cases.get(i);
				Lowered value = c.value().accept(this);
				needsMath |= value.needsMath();

				if (c.isDefault()) {
					if (i != cases.size() - 1) {
						throw new GenerateException(GenerateException.Kind.MALFORMED_AST,
								"default case must be the last case in a cases environment");
					}
					stmts.addAll(value.asBody().stmts());
					hasDefault = true;
					continue;
				}

				Lowered condition = lowerCondition(c.condition());
				needsMath |= condition.needsMath();
				stmts.add(new GoIfStmt(condition.asExpr(), value.asBody()));
			}

			if (!hasDefault) {
				stmts.add(new GoReturnStmt(mathCall("NaN")));
				needsMath = true;
			}
			return Lowered.block(stmts, needsMath);
		}

		private Lowered lowerCondition(Expr condition) throws GenerateException {
			if (condition instanceof BinaryExpr binary && binary.isComparison()) {
				Lowered left = binary.left().accept(this);
				Lowered right = binary.right().accept(this);
				return Lowered.expr(binary(left.asExpr(), binary.op(), right.asExpr()),
						left.needsMath() || right.needsMath());
			}
			// any other value is true when non-zero
			Lowered value = condition.accept(this);
			return Lowered.expr(binary(value.asExpr(), "!=", lit("0")), value.needsMath());
		}

		private void note(Limitation.Kind kind, String message, List<GoStmt> stmts) {
			limitations.add(new Limitation(kind, message));
			stmts.add(new GoCommentStmt("LIMITATION: " + message));
		}
	}

	// --- Go AST helpers ---

	private static GoIdent ident(String name) {
		return new GoIdent(name);
	}

	private static GoBasicLit lit(String value) {
		return new GoBasicLit(value);
	}

	private static GoCallExpr call(GoExpr fun, GoExpr... args) {
		return new GoCallExpr(fun, List.of(args));
	}

	private static GoCallExpr mathCall(String name, GoExpr... args) {
		return call(new GoSelectorExpr(MATH, name), args);
	}

	private static GoCallExpr sample(GoExpr at) {
		return call(ident("_f"), at);
	}

	/**
	 * {@code _f := func(var float64) float64 { <body> }}
	 */
	private static GoDefineStmt closure(String var, Lowered body) {
		GoFuncLit fn = new GoFuncLit(List.of(new GoParam(var, FLOAT)), FLOAT, body.asBody());
		return new GoDefineStmt("_f", fn);
	}

	/**
	 * Builds {@code left op right}, parenthesizing operands that bind more loosely.
	 * The right operand is also parenthesized at equal precedence, which keeps
	 * {@code a - (b - c)} and the evaluation order of {@code a + (b + c)} intact.
	 */
	static GoExpr binary(GoExpr left, String op, GoExpr right) {
		int precedence = operatorPrecedence(op);
		GoExpr l = precedenceOf(left) < precedence ? new GoParenExpr(left) : left;
		GoExpr r = precedenceOf(right) <= precedence ? new GoParenExpr(right) : right;
		return new GoBinaryExpr(l, op, r);
	}

	/**
	 * Division. Two untyped integer constants would divide as integers in Go,
	 * so the numerator is made a float constant first.
	 *
	 * Go rejects a constant zero divisor at compile time. Such a quotient is
	 * emitted as {@code numerator * math.Inf(1)}, which has the same IEEE 754
	 * result: +Inf, -Inf, or NaN for a zero numerator.
	 */
	private static Lowered divide(Lowered num, Lowered den, boolean explicitParens) {
		GoExpr numerator = num.asExpr();
		GoExpr denominator = den.asExpr();
		boolean needsMath = num.needsMath() || den.needsMath();

		Double divisor = constantValue(denominator);
		if (divisor != null && divisor == 0.0) {
			logger.debug("constant zero divisor, dividing by math.Inf(1) instead");
			GoExpr left = explicitParens ? new GoParenExpr(numerator) : numerator;
			return Lowered.expr(binary(left, "*", mathCall("Inf", lit("1"))), true);
		}

		if (isIntegerConstant(numerator) && isIntegerConstant(denominator)) {
			numerator = asFloatConstant(numerator);
		}
		if (explicitParens) {
			return Lowered.expr(new GoBinaryExpr(new GoParenExpr(numerator), "/", new GoParenExpr(denominator)),
					needsMath);
		}
		return Lowered.expr(binary(numerator, "/", denominator), needsMath);
	}

	/**
	 * Value of an expression built only from literals and {@code + - * /}, or null.
	 */
	static Double constantValue(GoExpr expr) {
		if (expr instanceof GoBasicLit literal) {
			String v = literal.value();
			boolean numeric = !v.isEmpty() && (Character.isDigit(v.charAt(0)) || v.charAt(0) == '-');
			return numeric ? Double.valueOf(v) : null;
		}
		if (expr instanceof GoParenExpr paren) {
			return constantValue(paren.inner());
		}
		if (expr instanceof GoBinaryExpr binary) {
			Double left = constantValue(binary.left());
			Double right = constantValue(binary.right());
			if (left == null || right == null) {
				return null;
			}
			switch (binary.op()) {
				case "+":
					return left + right;
				case "-":
					return left - right;
				case "*":
					return left * right;
				case "/":
					return left / right;
				default:
					return null;
			}
		}
		return null;
	}

	static boolean isIntegerConstant(GoExpr expr) {
		if (expr instanceof GoBasicLit literal) {
			String v = literal.value();
			return v.indexOf('.') < 0 && v.indexOf('e') < 0 && v.indexOf('E') < 0;
		}
		if (expr instanceof GoParenExpr paren) {
			return isIntegerConstant(paren.inner());
		}
		if (expr instanceof GoBinaryExpr binary) {
			String op = binary.op();
			return (op.equals("+") || op.equals("-") || op.equals("*"))
					&& isIntegerConstant(binary.left()) && isIntegerConstant(binary.right());
		}
		return false;
	}

	private static GoExpr asFloatConstant(GoExpr expr) {
		if (expr instanceof GoBasicLit literal) {
			return lit(literal.value() + ".0");
		}
		return call(ident(FLOAT), expr);
	}

	static int operatorPrecedence(String op) {
		switch (op) {
			case "*":
			case "/":
				return 5;
			case "+":
			case "-":
				return 4;
			case "==":
			case "!=":
			case "<":
			case "<=":
			case ">":
			case ">=":
				return 3;
			default:
				throw new IllegalArgumentException("unknown Go operator: " + op);
		}
	}

	private static int precedenceOf(GoExpr expr) {
		if (expr instanceof GoBinaryExpr binary) {
			return operatorPrecedence(binary.op());
		}
		return Integer.MAX_VALUE;
	}

	/**
	 * LaTeX number text as a Go literal. A leading zero would make an integer octal.
	 */
	static String goNumber(String text) {
		if (text.indexOf('.') >= 0) {
			return text;
		}
		int i = text.startsWith("-") ? 1 : 0;
		int digits = i;
		while (digits < text.length() - 1 && text.charAt(digits) == '0') {
			digits++;
		}
		return text.substring(0, i) + text.substring(digits);
	}

	private static String titleCase(String name) {
		if (name.isEmpty()) {
			return name;
		}
		String lower = name.toLowerCase(Locale.ROOT);
		return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
	}
}
