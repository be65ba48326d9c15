package latex2go.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original LaTeX text.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public static SourceSpan between(SourceSpan start, SourceSpan end) {
		return new SourceSpan(start.startOffset(), end.endOffset());
	}
}
