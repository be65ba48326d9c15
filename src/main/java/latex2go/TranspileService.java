package latex2go;

import latex2go.ast.latex.Expr;
import latex2go.parse.latex.LatexParser;
import latex2go.parse.latex.ParseException;
import latex2go.transform.GenerateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Runs one translation: input provider -> parser -> generator -> code writer.
 */
public final class TranspileService {
	private static final Logger logger = LoggerFactory.getLogger(TranspileService.class);

	static final String INPUT_STAGE = "failed to get latex input";
	static final String PARSE_STAGE = "failed to parse latex";
	static final String GENERATE_STAGE = "failed to generate go code";
	static final String WRITE_STAGE = "failed to write go code";

	private final LatexProvider provider;
	private final CodeWriter writer;
	private final LatexParser parser;
	private final GoGenerator generator;

	public TranspileService(LatexProvider provider, CodeWriter writer) {
		this(provider, writer, new LatexParser(), new GoGenerator());
	}

	public TranspileService(LatexProvider provider, CodeWriter writer, LatexParser parser, GoGenerator generator) {
		this.provider = Objects.requireNonNull(provider, "provider");
		this.writer = Objects.requireNonNull(writer, "writer");
		this.parser = Objects.requireNonNull(parser, "parser");
		this.generator = Objects.requireNonNull(generator, "generator");
	}

	public GeneratedCode run() throws TranspileException {
		LatexInput input;
		try {
			input = provider.getLatexInput();
		} catch (IOException ex) {
			throw new TranspileException(INPUT_STAGE, ex);
		}
		if (input.latex() == null || input.latex().isBlank()) {
			throw new TranspileException(INPUT_STAGE,
					new IllegalArgumentException("input LaTeX string cannot be empty"));
		}
		TranspilerOptions options = input.options() == null
				? new TranspilerOptions()
				: input.options().withDefaults();

		Expr expr;
		try {
			expr = parser.parse(input.latex());
		} catch (ParseException ex) {
			throw new TranspileException(PARSE_STAGE, ex);
		}

		GeneratedCode code;
		try {
			code = generator.generate(expr, options.moduleName(), options.functionName());
		} catch (GenerateException ex) {
			throw new TranspileException(GENERATE_STAGE, ex);
		}

		try {
			writer.write(code.source());
		} catch (IOException ex) {
			throw new TranspileException(WRITE_STAGE, ex);
		}

		logger.info("Successfully generated Go code: package {}, func {}({})", options.moduleName(),
				options.functionName(), String.join(", ", code.parameters()));
		return code;
	}
}
