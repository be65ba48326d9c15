package latex2go;

import latex2go.transform.Limitation;

import java.util.List;

/**
 * A validated Go source file plus what the generator inferred while producing it.
 *
 * @param source       formatted Go source, ending in a newline
 * @param importsMath  whether {@code import "math"} was emitted
 * @param parameters   the function's parameters, sorted
 * @param limitations  constructs that were translated but not computed faithfully
 */
public record GeneratedCode(String source, boolean importsMath, List<String> parameters,
		List<Limitation> limitations) {
	public GeneratedCode {
		parameters = List.copyOf(parameters);
		limitations = List.copyOf(limitations);
	}

	public boolean hasLimitations() {
		return !limitations.isEmpty();
	}
}
