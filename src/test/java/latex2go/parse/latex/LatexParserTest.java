package latex2go.parse.latex;

import latex2go.ast.latex.BinaryExpr;
import latex2go.ast.latex.Expr;
import latex2go.ast.latex.NumberLiteral;
import latex2go.ast.latex.Variable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexParserTest {
	private final LatexParser parser = new LatexParser();

	private String parse(String input) throws ParseException {
		return ExprFormatter.format(parser.parse(input));
	}

	private ParseException failure(String input) {
		return assertThrows(ParseException.class, () -> parser.parse(input));
	}

	@Test
	void productBindsTighterThanSum() throws Exception {
		assertEquals("(+ a (* b c))", parse("a + b * c"));
		assertEquals("(- (- a b) c)", parse("a - b - c"));
		assertEquals("(+ (/ a b) c)", parse("a / b + c"));
	}

	@Test
	void powerIsRightAssociative() throws Exception {
		assertEquals("(^ a (^ b c))", parse("a ^ b ^ c"));
		assertEquals("(^ (^ a b) c)", parse("(a ^ b) ^ c"));
	}

	@Test
	void unaryMinusIsMultiplicationByMinusOne() throws Exception {
		Expr expr = parser.parse("-a");

		BinaryExpr product = assertInstanceOf(BinaryExpr.class, expr);
		assertEquals("*", product.op());
		assertEquals(-1.0, assertInstanceOf(NumberLiteral.class, product.left()).value());
		assertEquals("a", assertInstanceOf(Variable.class, product.right()).name());

		assertEquals("(* -1 (+ a b))", parse("- (a + b)"));
	}

	@Test
	void unaryMinusBindsTighterThanPower() throws Exception {
		assertEquals("(^ (* -1 a) 2)", parse("-a^2"));
	}

	@Test
	void factorialIsPostfix() throws Exception {
		assertEquals("(! n)", parse("n!"));
		assertEquals("(+ (! n) 1)", parse("n! + 1"));
		assertEquals("(* 2 (! (+ a b)))", parse("2 * (a + b)!"));
	}

	@Test
	void operatorCommands() throws Exception {
		assertEquals("(/ (* a b) c)", parse("a \\cdot b \\div c"));
		assertEquals("(* a b)", parse("a \\times b"));
	}

	@Test
	void commandArguments() throws Exception {
		assertEquals("(+ (\\sqrt x) (\\frac a b))", parse("\\sqrt{x} + \\frac{a}{b}"));
		assertEquals("(^ (\\sin x) 2)", parse("\\sin{x}^2"));
		assertEquals("(\\frac (+ a 1) (\\cos y))", parse("\\frac{a + 1}{\\cos{y}}"));
	}

	@Test
	void numbersKeepTheirFraction() throws Exception {
		assertEquals("(* 0.5 x)", parse("0.5 * x"));
	}

	@Test
	void recordsSpans() throws Exception {
		Expr expr = parser.parse("ab + 12");

		assertEquals(0, expr.span().startOffset());
		assertEquals(7, expr.span().endOffset());
	}

	@Test
	void emptyInputHasNoPrefixFunction() {
		ParseException ex = failure("");

		assertEquals("parsing failed:\n\tparse error at pos 0: no prefix parse function found for token EOF ('')",
				ex.getMessage());
	}

	@Test
	void danglingOperator() {
		ParseException ex = failure("a +");

		assertTrue(ex.getMessage().contains("no prefix parse function found for token EOF"), ex.getMessage());
	}

	@Test
	void unmatchedParenthesis() {
		ParseException ex = failure("(a + b");

		assertEquals(1, ex.diagnostics().size());
		assertEquals("missing closing parenthesis", ex.diagnostics().get(0).message());
	}

	@Test
	void fracArityIsChecked() {
		assertTrue(failure("\\frac{a}").getMessage().contains("\\frac requires 2 argument(s), got 1"));
		assertTrue(failure("\\frac{a}{b}{c}").getMessage().contains("\\frac requires 2 argument(s), got 3"));
		assertTrue(failure("\\sin{a}{b}").getMessage().contains("\\sin requires 1 argument(s), got 2"));
	}

	@Test
	void emptyArgumentIsReportedOnce() {
		ParseException ex = failure("\\frac{}{b}");

		assertEquals(1, ex.diagnostics().size());
		assertEquals("argument expression cannot be empty inside {} for command \\frac",
				ex.diagnostics().get(0).message());
	}

	@Test
	void sqrtErrors() {
		assertTrue(failure("\\sqrt{}").getMessage()
				.contains("argument expression cannot be empty inside {} for command \\sqrt"));
		assertTrue(failure("\\sqrt{x").getMessage().contains("missing '}' after argument for command \\sqrt"));
		assertTrue(failure("\\sqrt").getMessage()
				.contains("expected '{' arguments after command '\\sqrt', got EOF"));
	}

	@Test
	void trailingTokensFailTheParse() {
		ParseException ex = failure("\\sqrt{x} y");

		assertEquals("parsing failed:\n\tparse error at pos 9: unexpected token after expression: IDENT ('y')",
				ex.getMessage());
	}

	@Test
	void illegalCharacterHasNoPrefixFunction() {
		ParseException ex = failure("a + #");

		assertTrue(ex.getMessage().contains("no prefix parse function found for token ILLEGAL ('#')"));
		assertEquals(4, ex.diagnostics().get(0).offset());
	}

	@Test
	void malformedInputAlwaysTerminates() {
		String[] inputs = {"}}}", "&&", "\\begin{cases}", "\\begin{cases} 1 \\\\", "\\lim", "\\lim_{", "\\int_",
				"\\sum_{i=1}", "\\frac{d}{dx}", "((((", "\\\\", "^", "!", "\\end{cases}", "x _ y"};
		for (String input : inputs) {
			assertThrows(ParseException.class, () -> parser.parse(input), input);
		}
	}

	@Test
	void parserIsReusable() throws Exception {
		assertEquals("(+ a b)", parse("a + b"));
		failure("(");
		assertEquals("(+ a b)", parse("a + b"));
	}
}
