package latex2go.parse.latex;

import latex2go.ast.latex.PiecewiseExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexParserConstructsTest {
	private final LatexParser parser = new LatexParser();

	private String parse(String input) throws ParseException {
		return ExprFormatter.format(parser.parse(input));
	}

	private String errorOf(String input) {
		return assertThrows(ParseException.class, () -> parser.parse(input)).getMessage();
	}

	@Test
	void summation() throws Exception {
		assertEquals("(sum i 1 n i)", parse("\\sum_{i=1}^{n} i"));
		assertEquals("(sum i 1 n (^ i 2))", parse("\\sum_{i=1}^n i^2"));
		assertEquals("(sum i 0 10 (+ i 1))", parse("\\sum_{i=0}^{10} i + 1"));
	}

	@Test
	void product() throws Exception {
		assertEquals("(prod k 1 5 k)", parse("\\prod_{k=1}^{5} k"));
	}

	@Test
	void summationNeedsLowerBound() {
		assertTrue(errorOf("\\sum i").contains("expected '_' for lower bound after \\sum"));
		assertTrue(errorOf("\\sum_{1}^{n} i").contains("expected identifier for summation variable in \\sum"));
	}

	@Test
	void nestedSummationsWithDistinctVariables() throws Exception {
		assertEquals("(sum i 1 n (sum j 1 i j))", parse("\\sum_{i=1}^{n} \\sum_{j=1}^{i} j"));
	}

	@Test
	void rebindingAVariableIsRejected() {
		String message = errorOf("\\sum_{i=1}^{n} \\sum_{i=1}^{2} i");

		assertTrue(message.contains("variable 'i' is already bound by an enclosing \\sum"), message);
	}

	@Test
	void definiteIntegral() throws Exception {
		assertEquals("(int x 0 1 (^ x 2))", parse("\\int_{0}^{1} x^2 dx"));
		assertEquals("(int t 0 1 t)", parse("\\int_0^1 t d t"));
	}

	@Test
	void integralVariableDefaultsToX() throws Exception {
		assertEquals("(int x 0 1 y)", parse("\\int_{0}^{1} y"));
	}

	@Test
	void integralWithOnlyADifferentialIsRejected() throws Exception {
		String message = errorOf("\\int_0^1 dt");

		assertTrue(message.contains("parse error at pos 9: missing integrand before differential 'dt' in \\int"),
				message);
		assertEquals("(int t 0 1 dt)", parse("\\int_0^1 dt dt"));
	}

	@Test
	void indefiniteIntegral() throws Exception {
		assertEquals("(int x x)", parse("\\int x dx"));
	}

	@Test
	void firstDerivative() throws Exception {
		assertEquals("(d x 1 (^ x 2))", parse("\\frac{d}{dx} x^2"));
		assertEquals("(partial y 1 (* x y))", parse("\\frac{\\partial}{\\partial y} x * y"));
	}

	@Test
	void higherOrderDerivative() throws Exception {
		assertEquals("(d x 2 (^ x 3))", parse("\\frac{d^2}{dx^2} x^3"));
		assertEquals("(partial t 3 t)", parse("\\frac{\\partial^3}{\\partial t^3} t"));
	}

	@Test
	void derivativeOrdersMustAgree() {
		assertTrue(errorOf("\\frac{d^2}{dx^3} x").contains("derivative order mismatch"));
	}

	@Test
	void fracOfDifferentialsIsAPlainFraction() throws Exception {
		assertEquals("(\\frac dy dx)", parse("\\frac{dy}{dx}"));
	}

	@Test
	void limit() throws Exception {
		assertEquals("(lim x 0 (\\frac (\\sin x) x))", parse("\\lim_{x \\to 0} \\frac{\\sin{x}}{x}"));
		assertEquals("(lim h 0 h)", parse("\\lim{h \\rightarrow 0} h"));
	}

	@Test
	void limitArrowSpellings() throws Exception {
		List<String> inputs = List.of(
				"\\lim_{x \\to 1} x",
				"\\lim_{x to 1} x",
				"\\lim_{x t o 1} x",
				"\\lim_{x \\t o 1} x",
				"\\lim_{x \\rightarrow 1} x",
				"\\lim_{x -> 1} x");
		for (String input : inputs) {
			ParseResult result = parser.parseWithWarnings(input);
			assertEquals("(lim x 1 x)", ExprFormatter.format(result.expr()), input);
			assertTrue(result.warnings().isEmpty(), input);
		}
	}

	@Test
	void limitWithoutArrowOnlyWarns() throws Exception {
		ParseResult result = parser.parseWithWarnings("\\lim_{x 0} x + 1");

		assertEquals("(lim x 0 (+ x 1))", ExprFormatter.format(result.expr()));
		assertEquals(1, result.warnings().size());
		Diagnostic warning = result.warnings().get(0);
		assertEquals(Diagnostic.Severity.WARNING, warning.severity());
		assertTrue(warning.toString().startsWith("parse warning at pos "), warning.toString());
		assertTrue(warning.message().contains("couldn't find 'to'"));
	}

	@Test
	void piecewiseWithDefault() throws Exception {
		String input = "\\begin{cases} x & x > 0 \\\\ 0 & \\text{otherwise} \\end{cases}";

		assertEquals("(cases (x (> x 0)) (0 otherwise))", parse(input));
	}

	@Test
	void piecewiseConditionForms() throws Exception {
		String input = "\\begin{cases} 1 & \\text{if } x \\leq 0 \\\\ 2 & x \\neq 3 \\\\ 3 & \\end{cases}";

		assertEquals("(cases (1 (<= x 0)) (2 (!= x 3)) (3 otherwise))", parse(input));
	}

	@Test
	void piecewiseWithoutDefault() throws Exception {
		PiecewiseExpr piecewise = assertInstanceOf(PiecewiseExpr.class,
				parser.parse("\\begin{cases} -1 & x < 0 \\\\ 1 & x >= 0 \\end{cases}"));

		assertEquals(2, piecewise.cases().size());
		assertEquals("(cases ((* -1 1) (< x 0)) (1 (>= x 0)))", ExprFormatter.format(piecewise));
	}

	@Test
	void comparisonOperators() throws Exception {
		assertEquals("(== a b)", parse("a = b"));
		assertEquals("(<= x 1)", parse("x <= 1"));
		assertEquals("(>= x (+ 1 y))", parse("x \\geq 1 + y"));
	}

	@Test
	void piecewiseErrors() {
		assertTrue(errorOf("\\begin{cases} 1 & x > 0").contains("expected '\\\\' or \\end{cases} after case"));
		assertTrue(errorOf("\\begin{matrix} 1 \\end{matrix}").contains("unsupported environment 'matrix'"));
		assertTrue(errorOf("\\begin{cases}\\end{cases}").contains("cases environment must contain at least one case"));
		assertTrue(errorOf("\\begin{cases} 1 & \\text{sometimes} \\end{cases}")
				.contains("unsupported \\text{sometimes} in cases condition"));
	}
}
