package latex2go.parse.latex;

/**
 * A parse-time finding at a source offset. Only ERROR diagnostics fail a parse.
 */
public record Diagnostic(Severity severity, int offset, String message) {
	public enum Severity {
		ERROR, WARNING
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		String prefix = severity == Severity.WARNING ? "parse warning at pos " : "parse error at pos ";
		return prefix + offset + ": " + message;
	}
}
