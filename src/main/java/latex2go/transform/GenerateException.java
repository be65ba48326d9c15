package latex2go.transform;

public class GenerateException extends Exception {
	public enum Kind {
		UNSUPPORTED_CONSTRUCT,
		MALFORMED_AST,
		FORMAT_FAILURE
	}

	private final Kind kind;
	private final String rawSource;

	public GenerateException(Kind kind, String message) {
		this(kind, message, null);
	}

	public GenerateException(Kind kind, String message, String rawSource) {
		super(message);
		this.kind = kind;
		this.rawSource = rawSource;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The printed source that failed validation; only set for {@link Kind#FORMAT_FAILURE}.
	 */
	public String rawSource() {
		return rawSource;
	}
}
