package latex2go.transform;

/**
 * A construct that was translated but not computed faithfully. Reported next
 * to a successful generation, never instead of one.
 */
public record Limitation(Kind kind, String message) {
	public enum Kind {
		INDEFINITE_INTEGRAL,
		UNSUPPORTED_DERIVATIVE_ORDER,
		SUMMATION_BOUND_TRUNCATED
	}
}
