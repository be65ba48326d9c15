package latex2go.check;

import latex2go.ast.SourceSpan;
import latex2go.transform.GoNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tiny lexer for the Go subset this project emits.
 *
 * Notes:
 * - Skips whitespace.
 * - Skips // line comments and /* block comments *\/.
 * - Identifiers are ASCII only; any other character becomes an ILLEGAL token.
 * - Numbers accept a fraction and an exponent ({@code 1.5e-10}).
 */
public final class GoLexer {
	private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(
			":=", "+=", "-=", "*=", "/=", "<=", ">=", "==", "!=", "++", "--", "&&", "||");
	private static final String ONE_CHAR_SYMBOLS = "+-*/%<>=!&|^(){}[],;.:";

	public List<GoToken> lex(String input) {
		List<GoToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					i = consumeLineComment(input, i);
					continue;
				}
				if (n == '*') {
					i = consumeBlockComment(input, i);
					continue;
				}
			}

			int start = i;
			if (c == '"') {
				i = consumeQuoted(input, i);
				tokens.add(token(GoTokenType.STRING, input, start, i));
				continue;
			}

			if (GoNames.isIdentifierStart(c)) {
				i++;
				while (i < input.length() && GoNames.isIdentifierPart(input.charAt(i))) {
					i++;
				}
				tokens.add(token(GoTokenType.IDENT, input, start, i));
				continue;
			}

			if (Character.isDigit(c) && c < 128) {
				i = consumeNumber(input, i);
				tokens.add(token(GoTokenType.NUMBER, input, start, i));
				continue;
			}

			String two = (i + 1 < input.length()) ? input.substring(i, i + 2) : "";
			if (TWO_CHAR_SYMBOLS.contains(two)) {
				i += 2;
				tokens.add(token(GoTokenType.SYMBOL, input, start, i));
				continue;
			}

			i++;
			GoTokenType type = ONE_CHAR_SYMBOLS.indexOf(c) >= 0 ? GoTokenType.SYMBOL : GoTokenType.ILLEGAL;
			tokens.add(token(type, input, start, i));
		}

		tokens.add(new GoToken(GoTokenType.EOF, "", new SourceSpan(input.length(), input.length())));
		return tokens;
	}

	private static GoToken token(GoTokenType type, String input, int start, int end) {
		return new GoToken(type, input.substring(start, end), new SourceSpan(start, end));
	}

	private static int consumeNumber(String input, int start) {
		int i = start;
		while (i < input.length() && isAsciiDigit(input.charAt(i))) {
			i++;
		}
		if (i + 1 < input.length() && input.charAt(i) == '.' && isAsciiDigit(input.charAt(i + 1))) {
			i++;
			while (i < input.length() && isAsciiDigit(input.charAt(i))) {
				i++;
			}
		}
		if (i < input.length() && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
			int j = i + 1;
			if (j < input.length() && (input.charAt(j) == '+' || input.charAt(j) == '-')) {
				j++;
			}
			if (j < input.length() && isAsciiDigit(input.charAt(j))) {
				i = j;
				while (i < input.length() && isAsciiDigit(input.charAt(i))) {
					i++;
				}
			}
		}
		return i;
	}

	private static boolean isAsciiDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static int consumeLineComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\n') {
				return i + 1;
			}
			i++;
		}
		return i;
	}

	private static int consumeBlockComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			if (input.charAt(i) == '*' && i + 1 < input.length() && input.charAt(i + 1) == '/') {
				return i + 2;
			}
			i++;
		}
		return i;
	}

	private static int consumeQuoted(String input, int start) {
		int i = start + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (c == '"' || c == '\n') {
				return i + 1;
			}
			i++;
		}
		return i;
	}
}
