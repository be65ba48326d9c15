package latex2go.parse.latex;

import latex2go.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Scanner for the LaTeX math subset.
 *
 * Notes:
 * - Whitespace between tokens is skipped.
 * - Tokens are produced lazily; the stream ends with exactly one EOF token.
 * - {@code \begin} and {@code \end} are tagged BEGIN / END instead of COMMAND.
 * - Unpaired UTF-16 surrogates are replaced by a single '?' before scanning.
 */
public final class LatexLexer implements Iterator<LatexToken> {
	static final char PLACEHOLDER = '?';

	private final String input;
	private int pos;
	private boolean exhausted;

	public LatexLexer(String source) {
		this.input = replaceMalformed(source);
	}

	@Override
	public boolean hasNext() {
		return !exhausted;
	}

	@Override
	public LatexToken next() {
		if (exhausted) {
			throw new NoSuchElementException("token stream already ended");
		}
		LatexToken token = scan();
		if (token.type() == LatexTokenType.EOF) {
			exhausted = true;
		}
		return token;
	}

	/**
	 * Drains the remaining tokens, EOF included.
	 */
	public List<LatexToken> tokenize() {
		List<LatexToken> tokens = new ArrayList<>();
		while (hasNext()) {
			tokens.add(next());
		}
		return tokens;
	}

	private LatexToken scan() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
		if (pos >= input.length()) {
			return token(LatexTokenType.EOF, "", pos, pos);
		}

		int start = pos;
		char c = input.charAt(pos);

		if (c == '\\') {
			return scanBackslash(start);
		}
		if (isLetter(c)) {
			pos++;
			while (pos < input.length() && isLetter(input.charAt(pos))) {
				pos++;
			}
			return token(LatexTokenType.IDENT, input.substring(start, pos), start, pos);
		}
		if (isDigit(c)) {
			return scanNumber(start);
		}

		pos++;
		LatexTokenType type = switch (c) {
			case '+' -> LatexTokenType.PLUS;
			case '-' -> LatexTokenType.MINUS;
			case '*' -> LatexTokenType.ASTERISK;
			case '/' -> LatexTokenType.SLASH;
			case '^' -> LatexTokenType.CARET;
			case '=' -> LatexTokenType.EQUALS;
			case '!' -> LatexTokenType.EXCLAMATION;
			case '<' -> LatexTokenType.LESS;
			case '>' -> LatexTokenType.GREATER;
			case '_' -> LatexTokenType.UNDERSCORE;
			case '(' -> LatexTokenType.LPAREN;
			case ')' -> LatexTokenType.RPAREN;
			case '{' -> LatexTokenType.LBRACE;
			case '}' -> LatexTokenType.RBRACE;
			case '&' -> LatexTokenType.AMPERSAND;
			default -> LatexTokenType.ILLEGAL;
		};
		return token(type, String.valueOf(c), start, pos);
	}

	private LatexToken scanBackslash(int start) {
		pos++;
		if (pos < input.length() && input.charAt(pos) == '\\') {
			pos++;
			return token(LatexTokenType.ROW_BREAK, "\\\\", start, pos);
		}
		if (pos >= input.length() || !isLetter(input.charAt(pos))) {
			return token(LatexTokenType.ILLEGAL, "\\", start, pos);
		}

		int nameStart = pos;
		while (pos < input.length() && isLetter(input.charAt(pos))) {
			pos++;
		}
		String name = input.substring(nameStart, pos);
		LatexTokenType type = switch (name) {
			case "begin" -> LatexTokenType.BEGIN;
			case "end" -> LatexTokenType.END;
			default -> LatexTokenType.COMMAND;
		};
		return token(type, name, start, pos);
	}

	private LatexToken scanNumber(int start) {
		boolean seenDot = false;
		while (pos < input.length()) {
			char ch = input.charAt(pos);
			if (isDigit(ch)) {
				pos++;
				continue;
			}
			// a '.' only belongs to the number when a digit follows it
			if (ch == '.' && !seenDot && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
				seenDot = true;
				pos++;
				continue;
			}
			break;
		}
		return token(LatexTokenType.NUMBER, input.substring(start, pos), start, pos);
	}

	private static LatexToken token(LatexTokenType type, String literal, int start, int end) {
		return new LatexToken(type, literal, new SourceSpan(start, end));
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static String replaceMalformed(String source) {
		StringBuilder sb = null;
		for (int i = 0; i < source.length(); i++) {
			char c = source.charAt(i);
			boolean malformed;
			if (Character.isHighSurrogate(c)) {
				malformed = i + 1 >= source.length() || !Character.isLowSurrogate(source.charAt(i + 1));
				if (!malformed) {
					if (sb != null) {
						sb.append(c).append(source.charAt(i + 1));
					}
					i++;
					continue;
				}
			} else {
				malformed = Character.isLowSurrogate(c);
			}

			if (malformed && sb == null) {
				sb = new StringBuilder(source.length());
				sb.append(source, 0, i);
			}
			if (sb != null) {
				sb.append(malformed ? PLACEHOLDER : c);
			}
		}
		return sb == null ? source : sb.toString();
	}
}
