package latex2go.check;

import latex2go.transform.GoNames;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Structural sanity check of printed Go source. It does not type-check; it
 * catches the failures a bad package/function name or a printer bug would
 * cause.
 */
public final class GoSyntaxChecker {
	private final GoLexer lexer = new GoLexer();

	/**
	 * @return the problems found, empty when the source looks valid
	 */
	public List<String> check(String source) {
		List<String> problems = new ArrayList<>();
		List<GoToken> tokens = lexer.lex(source);

		checkPackageClause(tokens, problems);
		checkFuncNames(tokens, problems);
		checkDelimiters(tokens, problems);

		for (GoToken t : tokens) {
			if (t.type() == GoTokenType.ILLEGAL) {
				problems.add("illegal character '" + t.lexeme() + "' at pos " + t.span().startOffset());
			}
		}
		return problems;
	}

	private static void checkPackageClause(List<GoToken> tokens, List<String> problems) {
		if (!tokens.get(0).is(GoTokenType.IDENT, "package")) {
			problems.add("missing package clause");
			return;
		}
		GoToken name = at(tokens, 1);
		if (name.type() != GoTokenType.IDENT || !GoNames.isIdentifier(name.lexeme())) {
			problems.add("invalid package name '" + name.lexeme() + "'");
			return;
		}
		GoToken next = at(tokens, 2);
		boolean declStart = next.type() == GoTokenType.EOF
				|| next.is(GoTokenType.IDENT, "import")
				|| next.is(GoTokenType.IDENT, "func");
		if (!declStart) {
			problems.add("unexpected '" + next.lexeme() + "' after package name at pos " + next.span().startOffset());
		}
	}

	private static void checkFuncNames(List<GoToken> tokens, List<String> problems) {
		for (int i = 0; i + 1 < tokens.size(); i++) {
			if (!tokens.get(i).is(GoTokenType.IDENT, "func")) {
				continue;
			}
			GoToken next = tokens.get(i + 1);
			if (next.is(GoTokenType.SYMBOL, "(")) {
				// function literal
				continue;
			}
			GoToken after = at(tokens, i + 2);
			boolean valid = next.type() == GoTokenType.IDENT && GoNames.isIdentifier(next.lexeme())
					&& after.is(GoTokenType.SYMBOL, "(");
			if (!valid) {
				problems.add("invalid function name at pos " + next.span().startOffset());
			}
		}
	}

	private static void checkDelimiters(List<GoToken> tokens, List<String> problems) {
		Deque<GoToken> open = new ArrayDeque<>();
		for (GoToken t : tokens) {
			if (t.type() != GoTokenType.SYMBOL) {
				continue;
			}
			String lexeme = t.lexeme();
			if (lexeme.equals("(") || lexeme.equals("{") || lexeme.equals("[")) {
				open.push(t);
			} else if (lexeme.equals(")") || lexeme.equals("}") || lexeme.equals("]")) {
				GoToken top = open.peek();
				if (top == null || !matches(top.lexeme(), lexeme)) {
					problems.add("unbalanced '" + lexeme + "' at pos " + t.span().startOffset());
					return;
				}
				open.pop();
			}
		}
		if (!open.isEmpty()) {
			GoToken top = open.peek();
			problems.add("unclosed '" + top.lexeme() + "' at pos " + top.span().startOffset());
		}
	}

	// the list always ends with EOF, which repeats past the end
	private static GoToken at(List<GoToken> tokens, int index) {
		return tokens.get(Math.min(index, tokens.size() - 1));
	}

	private static boolean matches(String opening, String closing) {
		return (opening.equals("(") && closing.equals(")"))
				|| (opening.equals("{") && closing.equals("}"))
				|| (opening.equals("[") && closing.equals("]"));
	}
}
