package latex2go.parse.latex;

import latex2go.ast.SourceSpan;
import latex2go.ast.latex.BinaryExpr;
import latex2go.ast.latex.DerivativeExpr;
import latex2go.ast.latex.Expr;
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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pratt parser for the LaTeX math subset.
 *
 * Each call to {@link #parse} runs on its own token buffer, diagnostics list and
 * dispatch tables, so one instance may be shared freely.
 */
public final class LatexParser {
	private static final Logger logger = LoggerFactory.getLogger(LatexParser.class);

	static final int LOWEST = 1;
	static final int COMPARE = 2;
	static final int SUM = 3;
	static final int PRODUCT = 4;
	static final int EXPONENT = 5;
	static final int PREFIX = 6;
	static final int POSTFIX = 7;

	private static final Map<LatexTokenType, Integer> PRECEDENCES;
	private static final Map<LatexTokenType, String> INFIX_OPS;

	static {
		Map<LatexTokenType, Integer> p = new EnumMap<>(LatexTokenType.class);
		p.put(LatexTokenType.EQUALS, COMPARE);
		p.put(LatexTokenType.LESS, COMPARE);
		p.put(LatexTokenType.GREATER, COMPARE);
		p.put(LatexTokenType.PLUS, SUM);
		p.put(LatexTokenType.MINUS, SUM);
		p.put(LatexTokenType.ASTERISK, PRODUCT);
		p.put(LatexTokenType.SLASH, PRODUCT);
		p.put(LatexTokenType.CARET, EXPONENT);
		p.put(LatexTokenType.EXCLAMATION, POSTFIX);
		PRECEDENCES = Collections.unmodifiableMap(p);

		Map<LatexTokenType, String> ops = new EnumMap<>(LatexTokenType.class);
		ops.put(LatexTokenType.PLUS, "+");
		ops.put(LatexTokenType.MINUS, "-");
		ops.put(LatexTokenType.ASTERISK, "*");
		ops.put(LatexTokenType.SLASH, "/");
		ops.put(LatexTokenType.CARET, "^");
		ops.put(LatexTokenType.EQUALS, "==");
		ops.put(LatexTokenType.LESS, "<");
		ops.put(LatexTokenType.GREATER, ">");
		INFIX_OPS = Collections.unmodifiableMap(ops);
	}

	/**
	 * Commands that act as binary operators.
	 */
	private record InfixCommand(String op, int precedence) {
	}

	private static final Map<String, InfixCommand> INFIX_COMMANDS = Map.ofEntries(
			Map.entry("cdot", new InfixCommand("*", PRODUCT)),
			Map.entry("times", new InfixCommand("*", PRODUCT)),
			Map.entry("div", new InfixCommand("/", PRODUCT)),
			Map.entry("lt", new InfixCommand("<", COMPARE)),
			Map.entry("gt", new InfixCommand(">", COMPARE)),
			Map.entry("le", new InfixCommand("<=", COMPARE)),
			Map.entry("leq", new InfixCommand("<=", COMPARE)),
			Map.entry("ge", new InfixCommand(">=", COMPARE)),
			Map.entry("geq", new InfixCommand(">=", COMPARE)),
			Map.entry("ne", new InfixCommand("!=", COMPARE)),
			Map.entry("neq", new InfixCommand("!=", COMPARE)));

	private static final Map<String, Integer> FIXED_ARITY = Map.of(
			"frac", 2,
			"sqrt", 1,
			"sin", 1,
			"cos", 1,
			"tan", 1);

	private static final Set<String> ARROW_COMMANDS = Set.of("to", "rightarrow", "longrightarrow");
	private static final Set<String> DEFAULT_CASE_WORDS = Set.of("otherwise", "else");
	private static final Set<String> CONDITION_WORDS = Set.of("if", "for", "when");

	public Expr parse(String source) throws ParseException {
		return parseWithWarnings(source).expr();
	}

	public ParseResult parseWithWarnings(String source) throws ParseException {
		Objects.requireNonNull(source, "source");
		Session session = new Session(new LatexLexer(source));
		Expr expr = session.parseTopLevel();

		List<Diagnostic> diagnostics = session.diagnostics;
		if (expr == null || diagnostics.stream().anyMatch(Diagnostic::isError)) {
			logger.debug("parse of '{}' failed with {} diagnostic(s)", source, diagnostics.size());
			throw new ParseException(diagnostics);
		}

		List<Diagnostic> warnings = diagnostics.stream()
				.filter(d -> !d.isError())
				.collect(Collectors.toList());
		for (Diagnostic w : warnings) {
			logger.warn("{}", w);
		}
		return new ParseResult(expr, warnings);
	}

	private interface PrefixParselet {
		Expr parse();
	}

	private interface InfixParselet {
		Expr parse(Expr left);
	}

	/**
	 * Unwinds the current parse once the token stream can no longer be trusted.
	 */
	private static final class Bailout extends RuntimeException {
		Bailout() {
			super(null, null, false, false);
		}
	}

	private static final class Session {
		private final TokenBuffer tokens;
		private final List<Diagnostic> diagnostics = new ArrayList<>();
		private final Map<LatexTokenType, PrefixParselet> prefixFns;
		private final Map<LatexTokenType, InfixParselet> infixFns;

		Session(LatexLexer lexer) {
			this.tokens = new TokenBuffer(lexer);

			Map<LatexTokenType, PrefixParselet> prefix = new EnumMap<>(LatexTokenType.class);
			prefix.put(LatexTokenType.IDENT, this::parseIdentifier);
			prefix.put(LatexTokenType.NUMBER, this::parseNumberLiteral);
			prefix.put(LatexTokenType.LPAREN, this::parseGroupedExpression);
			prefix.put(LatexTokenType.MINUS, this::parsePrefixMinus);
			prefix.put(LatexTokenType.COMMAND, this::parseCommandExpression);
			prefix.put(LatexTokenType.BEGIN, this::parsePiecewiseExpression);
			this.prefixFns = Collections.unmodifiableMap(prefix);

			Map<LatexTokenType, InfixParselet> infix = new EnumMap<>(LatexTokenType.class);
			for (LatexTokenType type : INFIX_OPS.keySet()) {
				infix.put(type, this::parseInfixExpression);
			}
			infix.put(LatexTokenType.EXCLAMATION, this::parseFactorialExpression);
			infix.put(LatexTokenType.COMMAND, this::parseInfixCommand);
			this.infixFns = Collections.unmodifiableMap(infix);
		}

		Expr parseTopLevel() {
			try {
				Expr expr = parseExpression(LOWEST);
				if (!peekIs(LatexTokenType.EOF)) {
					LatexToken t = peek();
					errorAt(t.offset(), "unexpected token after expression: " + t.type() + " ('" + t.literal() + "')");
					return null;
				}
				return expr;
			} catch (Bailout b) {
				return null;
			}
		}

		// --- token cursor ---

		private LatexToken cur() {
			return tokens.peek(0);
		}

		private LatexToken peek() {
			return tokens.peek(1);
		}

		private LatexToken peekAt(int distance) {
			return tokens.peek(distance);
		}

		private boolean peekIs(LatexTokenType type) {
			return peek().type() == type;
		}

		private void nextToken() {
			tokens.advance();
		}

		private void expectPeek(LatexTokenType type, String message) {
			if (!peekIs(type)) {
				fail(message + ", got " + peek().type() + " ('" + peek().literal() + "')");
			}
			nextToken();
		}

		// --- diagnostics ---

		private void error(String message) {
			errorAt(cur().offset(), message);
		}

		private void errorAt(int offset, String message) {
			diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, offset, message));
		}

		private void warn(String message) {
			diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, cur().offset(), message));
		}

		private Bailout fail(String message) {
			error(message);
			throw new Bailout();
		}

		// --- Pratt core ---

		private Expr parseExpression(int precedence) {
			PrefixParselet prefix = prefixFns.get(cur().type());
			if (prefix == null) {
				throw fail("no prefix parse function found for token " + cur().type() + " ('" + cur().literal() + "')");
			}
			Expr left = prefix.parse();

			while (!peekIs(LatexTokenType.EOF) && precedence < precedenceOf(peek())) {
				InfixParselet infix = infixFns.get(peek().type());
				if (infix == null) {
					return left;
				}
				nextToken();
				left = infix.parse(left);
			}
			return left;
		}

		private static int precedenceOf(LatexToken token) {
			if (token.type() == LatexTokenType.COMMAND) {
				InfixCommand command = INFIX_COMMANDS.get(token.literal());
				return command == null ? LOWEST : command.precedence();
			}
			return PRECEDENCES.getOrDefault(token.type(), LOWEST);
		}

		private Expr parseIdentifier() {
			return new Variable(cur().literal(), cur().span());
		}

		private Expr parseNumberLiteral() {
			return new NumberLiteral(Double.parseDouble(cur().literal()), cur().literal(), cur().span());
		}

		// unary minus has no node of its own: -x is (-1) * x
		private Expr parsePrefixMinus() {
			LatexToken start = cur();
			nextToken();
			Expr operand = parseExpression(PREFIX);
			return new BinaryExpr("*", new NumberLiteral(-1.0, start.span()), operand,
					SourceSpan.between(start.span(), operand.span()));
		}

		private Expr parseGroupedExpression() {
			nextToken();
			Expr inner = parseExpression(LOWEST);
			if (!peekIs(LatexTokenType.RPAREN)) {
				throw fail("missing closing parenthesis");
			}
			nextToken();
			return inner;
		}

		private Expr parseInfixExpression(Expr left) {
			LatexToken operator = cur();
			String op = INFIX_OPS.get(operator.type());
			int precedence = precedenceOf(operator);

			// "<=" and ">=" arrive as two tokens
			if ((op.equals("<") || op.equals(">")) && peekIs(LatexTokenType.EQUALS)) {
				nextToken();
				op = op + "=";
			}
			nextToken();

			// ^ is right-associative
			int rightPrecedence = op.equals("^") ? precedence - 1 : precedence;
			Expr right = parseExpression(rightPrecedence);
			return new BinaryExpr(op, left, right, SourceSpan.between(left.span(), right.span()));
		}

		private Expr parseInfixCommand(Expr left) {
			InfixCommand command = INFIX_COMMANDS.get(cur().literal());
			nextToken();
			Expr right = parseExpression(command.precedence());
			return new BinaryExpr(command.op(), left, right, SourceSpan.between(left.span(), right.span()));
		}

		private Expr parseFactorialExpression(Expr left) {
			return new FactorialExpr(left, SourceSpan.between(left.span(), cur().span()));
		}

		// --- commands ---

		private Expr parseCommandExpression() {
			switch (cur().literal()) {
				case "sum":
					return parseSumExpression(false);
				case "prod":
					return parseSumExpression(true);
				case "int":
					return parseIntegralExpression();
				case "lim":
					return parseLimitExpression();
				case "frac":
					if (derivativeAhead()) {
						return parseDerivativeExpression();
					}
					return parseCommandArguments(cur());
				default:
					return parseCommandArguments(cur());
			}
		}

		private Expr parseCommandArguments(LatexToken command) {
			String name = command.literal();
			List<Expr> args = new ArrayList<>();
			boolean emptyGroup = false;

			while (peekIs(LatexTokenType.LBRACE)) {
				nextToken();
				if (peekIs(LatexTokenType.RBRACE)) {
					error("argument expression cannot be empty inside {} for command \\" + name);
					emptyGroup = true;
					nextToken();
					continue;
				}
				nextToken();
				Expr arg = parseExpression(LOWEST);
				if (!peekIs(LatexTokenType.RBRACE)) {
					throw fail("missing '}' after argument for command \\" + name);
				}
				nextToken();
				args.add(arg);
			}

			if (args.isEmpty() && !emptyGroup) {
				throw fail("expected '{' arguments after command '\\" + name + "', got " + peek().type());
			}

			Integer required = FIXED_ARITY.get(name);
			if (required != null && !emptyGroup && args.size() != required) {
				errorAt(command.offset(), "\\" + name + " requires " + required + " argument(s), got " + args.size());
			}
			return new FuncCall(name, args, new SourceSpan(command.offset(), cur().span().endOffset()));
		}

		private Expr parseSumExpression(boolean product) {
			LatexToken start = cur();
			String name = "\\" + start.literal();

			expectPeek(LatexTokenType.UNDERSCORE, "expected '_' for lower bound after " + name);
			expectPeek(LatexTokenType.LBRACE, "expected '{' after '_' in " + name);
			expectPeek(LatexTokenType.IDENT, "expected identifier for summation variable in " + name);
			String var = cur().literal();
			expectPeek(LatexTokenType.EQUALS, "expected '=' after variable in " + name + " lower bound");
			nextToken();
			Expr lower = parseExpression(LOWEST);
			expectPeek(LatexTokenType.RBRACE, "expected '}' after lower bound in " + name);

			expectPeek(LatexTokenType.CARET, "expected '^' for upper bound after lower bound in " + name);
			Expr upper = parseScript(name, "upper bound");

			nextToken();
			Expr body = parseExpression(LOWEST);
			checkRebinding(body, var, name);
			return new SumExpr(product, var, lower, upper, body, SourceSpan.between(start.span(), body.span()));
		}

		private Expr parseIntegralExpression() {
			LatexToken start = cur();
			boolean definite = false;
			Expr lower = null;
			Expr upper = null;

			if (peekIs(LatexTokenType.UNDERSCORE)) {
				definite = true;
				nextToken();
				lower = parseScript("\\int", "lower bound");
				expectPeek(LatexTokenType.CARET, "expected '^' for upper bound after lower bound in \\int");
				upper = parseScript("\\int", "upper bound");
			}

			nextToken();
			Expr body = parseExpression(LOWEST);

			// trailing differential: "dx", or "d x"
			String var = "x";
			if (isDifferential(peek())) {
				nextToken();
				var = cur().literal().substring(1);
			} else if (peek().is(LatexTokenType.IDENT, "d") && peekAt(2).type() == LatexTokenType.IDENT) {
				nextToken();
				nextToken();
				var = cur().literal();
			} else if (body instanceof Variable v && isDifferential(v.name())) {
				// "\int_0^1 dt": the differential was read as the integrand
				errorAt(v.span().startOffset(), "missing integrand before differential '" + v.name() + "' in \\int");
			}

			checkRebinding(body, var, "\\int");
			return new IntegralExpr(definite, var, lower, upper, body,
					new SourceSpan(start.offset(), cur().span().endOffset()));
		}

		/**
		 * Parses the argument of a {@code _} or {@code ^} script: a braced expression
		 * or a single identifier/number token.
		 */
		private Expr parseScript(String construct, String what) {
			if (peekIs(LatexTokenType.LBRACE)) {
				nextToken();
				if (peekIs(LatexTokenType.RBRACE)) {
					throw fail(what + " cannot be empty in " + construct);
				}
				nextToken();
				Expr value = parseExpression(LOWEST);
				expectPeek(LatexTokenType.RBRACE, "expected '}' after " + what + " in " + construct);
				return value;
			}
			if (peekIs(LatexTokenType.NUMBER)) {
				nextToken();
				return parseNumberLiteral();
			}
			if (peekIs(LatexTokenType.IDENT)) {
				nextToken();
				return parseIdentifier();
			}
			throw fail("expected '{' after '" + cur().literal() + "' in " + construct);
		}

		private Expr parseLimitExpression() {
			LatexToken start = cur();
			if (peekIs(LatexTokenType.UNDERSCORE)) {
				nextToken();
				expectPeek(LatexTokenType.LBRACE, "expected '{' after '_' in \\lim");
			} else if (peekIs(LatexTokenType.LBRACE)) {
				nextToken();
			} else {
				throw fail("expected '_' or '{' after \\lim, got " + peek().type());
			}

			expectPeek(LatexTokenType.IDENT, "expected identifier for limit variable in \\lim");
			String var = cur().literal();

			int arrow = arrowLength();
			if (arrow == 0) {
				warn("couldn't find 'to' in limit expression, assuming implied");
			}
			for (int i = 0; i < arrow; i++) {
				nextToken();
			}

			if (peekIs(LatexTokenType.RBRACE) || peekIs(LatexTokenType.EOF)) {
				throw fail("expected value for '" + var + "' to approach in \\lim");
			}
			nextToken();
			Expr approaches = parseExpression(LOWEST);
			expectPeek(LatexTokenType.RBRACE, "expected '}' after approach value in \\lim");

			nextToken();
			Expr body = parseExpression(LOWEST);
			checkRebinding(body, var, "\\lim");
			return new LimitExpr(var, approaches, body, SourceSpan.between(start.span(), body.span()));
		}

		/**
		 * Number of tokens spelling the limit arrow right after the variable, or 0.
		 * Accepted: {@code \to}, {@code \rightarrow}, {@code to}, {@code t o},
		 * {@code \t o} and {@code ->}.
		 */
		private int arrowLength() {
			LatexToken first = peekAt(1);
			LatexToken second = peekAt(2);
			if (first.type() == LatexTokenType.COMMAND && ARROW_COMMANDS.contains(first.literal())) {
				return 1;
			}
			if (first.is(LatexTokenType.IDENT, "to")) {
				return 1;
			}
			boolean splitTo = first.is(LatexTokenType.IDENT, "t") || first.is(LatexTokenType.COMMAND, "t");
			if (splitTo && second.is(LatexTokenType.IDENT, "o")) {
				return 2;
			}
			if (first.type() == LatexTokenType.MINUS && second.type() == LatexTokenType.GREATER) {
				return 2;
			}
			return 0;
		}

		/**
		 * Detects {@code \frac{d}{dx}}, {@code \frac{\partial}{\partial x}} and their
		 * {@code ^n} forms without consuming anything.
		 */
		private boolean derivativeAhead() {
			if (peekAt(1).type() != LatexTokenType.LBRACE) {
				return false;
			}
			LatexToken marker = peekAt(2);
			boolean partial;
			if (marker.is(LatexTokenType.IDENT, "d")) {
				partial = false;
			} else if (marker.is(LatexTokenType.COMMAND, "partial")) {
				partial = true;
			} else {
				return false;
			}

			int next = 3;
			if (peekAt(next).type() == LatexTokenType.CARET) {
				if (peekAt(next + 1).type() != LatexTokenType.NUMBER) {
					return false;
				}
				next += 2;
			}
			if (peekAt(next).type() != LatexTokenType.RBRACE || peekAt(next + 1).type() != LatexTokenType.LBRACE) {
				return false;
			}
			LatexToken denominator = peekAt(next + 2);
			return partial ? denominator.is(LatexTokenType.COMMAND, "partial") : isDifferential(denominator);
		}

		private Expr parseDerivativeExpression() {
			LatexToken start = cur();
			nextToken();
			nextToken();
			boolean partial = cur().type() == LatexTokenType.COMMAND;
			int order = parseDerivativeOrder();
			expectPeek(LatexTokenType.RBRACE, "expected '}' after derivative numerator");
			expectPeek(LatexTokenType.LBRACE, "expected '{' for derivative denominator");
			nextToken();

			String var;
			if (partial) {
				expectPeek(LatexTokenType.IDENT, "expected variable after \\partial in derivative denominator");
				var = cur().literal();
			} else {
				var = cur().literal().substring(1);
			}
			int denominatorOrder = parseDerivativeOrder();
			if (denominatorOrder != order) {
				error("derivative order mismatch: numerator has order " + order + ", denominator has order "
						+ denominatorOrder);
			}
			expectPeek(LatexTokenType.RBRACE, "expected '}' after derivative denominator");

			if (peekIs(LatexTokenType.EOF) || peekIs(LatexTokenType.RBRACE) || peekIs(LatexTokenType.RPAREN)) {
				throw fail("expected expression to differentiate after \\frac{d}{d" + var + "}");
			}
			nextToken();
			Expr body = parseExpression(LOWEST);
			checkRebinding(body, var, "derivative");
			return new DerivativeExpr(partial, var, order, body, SourceSpan.between(start.span(), body.span()));
		}

		private int parseDerivativeOrder() {
			if (!peekIs(LatexTokenType.CARET)) {
				return 1;
			}
			nextToken();
			expectPeek(LatexTokenType.NUMBER, "expected integer derivative order after '^'");
			String literal = cur().literal();
			if (literal.indexOf('.') < 0 && literal.length() < 10) {
				int order = Integer.parseInt(literal);
				if (order >= 1) {
					return order;
				}
			}
			error("derivative order must be a positive integer, got " + literal);
			return 1;
		}

		// --- \begin{cases} ... \end{cases} ---

		private Expr parsePiecewiseExpression() {
			LatexToken start = cur();
			expectPeek(LatexTokenType.LBRACE, "expected '{' after \\begin for cases environment");
			expectPeek(LatexTokenType.IDENT, "expected 'cases' for piecewise environment");
			if (!cur().literal().equals("cases")) {
				throw fail("unsupported environment '" + cur().literal() + "', expected 'cases'");
			}
			expectPeek(LatexTokenType.RBRACE, "expected '}' after 'cases' in \\begin");
			nextToken();

			List<PiecewiseCase> cases = new ArrayList<>();
			while (cur().type() != LatexTokenType.END) {
				if (cur().type() == LatexTokenType.EOF) {
					throw fail("missing \\end{cases} for cases environment");
				}
				Expr value = parseExpression(LOWEST);
				Expr condition = null;
				if (peekIs(LatexTokenType.AMPERSAND)) {
					nextToken();
					if (!peekIs(LatexTokenType.ROW_BREAK) && !peekIs(LatexTokenType.END)) {
						nextToken();
						condition = parseCondition();
					}
				}
				cases.add(new PiecewiseCase(value, condition));

				if (peekIs(LatexTokenType.ROW_BREAK)) {
					nextToken();
				} else if (!peekIs(LatexTokenType.END)) {
					throw fail("expected '\\\\' or \\end{cases} after case, got " + peek().type() + " ('"
							+ peek().literal() + "')");
				}
				nextToken();
			}

			if (cases.isEmpty()) {
				error("cases environment must contain at least one case");
			}
			expectPeek(LatexTokenType.LBRACE, "expected '{' after \\end");
			expectPeek(LatexTokenType.IDENT, "expected 'cases' in \\end{}");
			if (!cur().literal().equals("cases")) {
				throw fail("expected 'cases' in \\end{}, got '" + cur().literal() + "'");
			}
			expectPeek(LatexTokenType.RBRACE, "expected '}' after 'cases' in \\end");
			return new PiecewiseExpr(cases, SourceSpan.between(start.span(), cur().span()));
		}

		/**
		 * @return the condition, or null for a default row such as {@code \text{otherwise}}
		 */
		private Expr parseCondition() {
			if (!cur().is(LatexTokenType.COMMAND, "text")) {
				return parseExpression(LOWEST);
			}

			expectPeek(LatexTokenType.LBRACE, "expected '{' after \\text");
			List<String> words = new ArrayList<>();
			while (peekIs(LatexTokenType.IDENT)) {
				nextToken();
				words.add(cur().literal());
			}
			expectPeek(LatexTokenType.RBRACE, "expected '}' after \\text");

			if (words.isEmpty() || DEFAULT_CASE_WORDS.contains(words.get(0))) {
				return null;
			}
			if (words.size() == 1 && CONDITION_WORDS.contains(words.get(0))) {
				if (peekIs(LatexTokenType.ROW_BREAK) || peekIs(LatexTokenType.END)) {
					throw fail("expected condition after \\text{" + words.get(0) + "}");
				}
				nextToken();
				return parseExpression(LOWEST);
			}
			throw fail("unsupported \\text{" + String.join(" ", words) + "} in cases condition");
		}

		// --- helpers ---

		private static boolean isDifferential(LatexToken token) {
			return token.type() == LatexTokenType.IDENT && isDifferential(token.literal());
		}

		private static boolean isDifferential(String name) {
			return name.length() > 1 && name.startsWith("d");
		}

		private void checkRebinding(Expr body, String var, String construct) {
			Expr inner = NestedBinders.findRebinding(body, var);
			if (inner != null) {
				errorAt(inner.span().startOffset(),
						"variable '" + var + "' is already bound by an enclosing " + construct);
			}
		}
	}
}
