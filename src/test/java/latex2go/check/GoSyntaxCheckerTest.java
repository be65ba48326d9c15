package latex2go.check;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GoSyntaxCheckerTest {
	private final GoSyntaxChecker checker = new GoSyntaxChecker();

	@Test
	void acceptsGeneratedShape() {
		String source = "package main\n\nimport \"math\"\n\nfunc calculate(x float64) float64 {\n"
				+ "\t_f := func(x float64) float64 {\n\t\treturn math.Pow(x, 2)\n\t}\n"
				+ "\treturn _f(x)\n}\n";

		assertEquals(List.of(), checker.check(source));
	}

	@Test
	void requiresPackageClause() {
		assertEquals(List.of("missing package clause"), checker.check("func f() float64 {\n\treturn 1\n}\n"));
	}

	@Test
	void rejectsInvalidPackageNames() {
		assertEquals(List.of("invalid package name 'if'"), checker.check("package if\n"));
		assertEquals(List.of("invalid package name '1'"), checker.check("package 1main\n"));
		assertTrue(checker.check("package my-pkg\n").get(0).startsWith("unexpected '-' after package name"));
	}

	@Test
	void rejectsInvalidFunctionNames() {
		List<String> problems = checker.check("package main\n\nfunc my-func() float64 {\n\treturn 1\n}\n");

		assertEquals(1, problems.size());
		assertTrue(problems.get(0).startsWith("invalid function name"), problems.toString());
	}

	@Test
	void detectsUnbalancedDelimiters() {
		assertEquals(List.of("unclosed '{' at pos 31"),
				checker.check("package main\n\nfunc f() float64 {\n\treturn (1)\n"));
		assertEquals(List.of("unbalanced ')' at pos 42"),
				checker.check("package main\n\nfunc f() float64 {\n\treturn 1)\n}\n"));
	}

	@Test
	void reportsIllegalCharacters() {
		List<String> problems = checker.check("package main\n\nfunc f() float64 {\n\treturn 1 # 2\n}\n");

		assertEquals(List.of("illegal character '#' at pos 43"), problems);
	}
}
