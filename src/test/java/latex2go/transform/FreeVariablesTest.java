package latex2go.transform;

import latex2go.parse.latex.LatexParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FreeVariablesTest {
	private final LatexParser parser = new LatexParser();

	private List<String> freeIn(String latex) throws Exception {
		return List.copyOf(FreeVariables.of(parser.parse(latex)));
	}

	@Test
	void collectsVariablesInSortedOrder() throws Exception {
		assertEquals(List.of("x", "y"), freeIn("y^2 + x^2"));
		assertEquals(List.of("a", "b", "c"), freeIn("c * b + a * c"));
	}

	@Test
	void constantsHaveNoFreeVariables() throws Exception {
		assertEquals(List.of(), freeIn("2 + 3!"));
	}

	@Test
	void summationVariableIsBound() throws Exception {
		assertEquals(List.of("n"), freeIn("\\sum_{i=1}^{n} i"));
		assertEquals(List.of("k", "n"), freeIn("\\prod_{i=1}^{n} i * k"));
	}

	@Test
	void integralVariableIsBoundButBoundsAreFree() throws Exception {
		assertEquals(List.of("a", "b"), freeIn("\\int_{a}^{b} x dx"));
		assertEquals(List.of("y"), freeIn("\\int_{0}^{1} x * y dx"));
	}

	@Test
	void derivativeVariableStaysFreeAsEvaluationPoint() throws Exception {
		assertEquals(List.of("s", "t"), freeIn("\\frac{d}{dt} t * s"));
	}

	@Test
	void limitVariableIsBound() throws Exception {
		assertEquals(List.of("x"), freeIn("\\lim_{h \\to 0} h + x"));
		assertEquals(List.of("a"), freeIn("\\lim_{h \\to a} h"));
	}

	@Test
	void piecewiseConditionsContribute() throws Exception {
		assertEquals(List.of("x", "y"), freeIn("\\begin{cases} y & x > 0 \\\\ 0 & \\text{otherwise} \\end{cases}"));
	}
}
