package latex2go.transform;

import latex2go.ast.golang.GoFile;

import java.util.List;

/**
 * A lowered Go file together with the facts the generator reports about it.
 */
public record GoTranslation(GoFile file, List<String> parameters, boolean importsMath, List<Limitation> limitations) {
	public GoTranslation {
		parameters = List.copyOf(parameters);
		limitations = List.copyOf(limitations);
	}
}
