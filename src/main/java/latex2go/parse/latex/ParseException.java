package latex2go.parse.latex;

import java.util.List;
import java.util.stream.Collectors;

public class ParseException extends Exception {
	private final List<Diagnostic> diagnostics;

	public ParseException(List<Diagnostic> diagnostics) {
		super(render(diagnostics));
		this.diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}

	private static String render(List<Diagnostic> diagnostics) {
		return diagnostics.stream()
				.map(Diagnostic::toString)
				.collect(Collectors.joining("\n\t", "parsing failed:\n\t", ""));
	}
}
