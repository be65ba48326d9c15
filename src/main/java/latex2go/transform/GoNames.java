package latex2go.transform;

import java.util.Set;

/**
 * Maps LaTeX identifiers onto Go identifiers.
 */
public final class GoNames {
	/**
	 * Go keywords plus the name of the imported {@code math} package.
	 */
	public static final Set<String> RESERVED = Set.of(
			"break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for", "func",
			"go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select", "struct",
			"switch", "type", "var",
			"math");

	private GoNames() {
	}

	public static String sanitize(String name) {
		return RESERVED.contains(name) ? name + "_" : name;
	}

	public static boolean isReserved(String name) {
		return RESERVED.contains(name);
	}

	/**
	 * @return true when {@code name} is a syntactically valid, non-keyword Go identifier
	 */
	public static boolean isIdentifier(String name) {
		if (name == null || name.isEmpty() || isGoKeyword(name)) {
			return false;
		}
		if (!isIdentifierStart(name.charAt(0))) {
			return false;
		}
		for (int i = 1; i < name.length(); i++) {
			if (!isIdentifierPart(name.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	public static boolean isIdentifierStart(char c) {
		return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	public static boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || (c >= '0' && c <= '9');
	}

	private static boolean isGoKeyword(String name) {
		return RESERVED.contains(name) && !name.equals("math");
	}
}
