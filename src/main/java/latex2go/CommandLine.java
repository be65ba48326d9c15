package latex2go;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Command line flags, doubling as the {@link LatexProvider} for a CLI run.
 *
 * Flags take their value either as the next argument or after '='
 * ({@code --package=calc}). An input of {@code -} reads the LaTeX from stdin.
 */
public final class CommandLine implements LatexProvider {
	public static final String USAGE = String.join("\n",
			"latex2go converts LaTeX math equations to Go code",
			"",
			"Usage:",
			"  latex2go -i <latex> [flags]",
			"",
			"Flags:",
			"  -i, --input string       LaTeX equation string, or - to read stdin (required)",
			"  -o, --output string      Output Go file path (default: stdout)",
			"      --package string     Go package name for the generated file (default \"main\")",
			"      --func-name string   Function name in the generated Go code (default \"calculate\")",
			"  -h, --help               help for latex2go",
			"");

	static final String STDIN_MARKER = "-";

	private final String input;
	private final TranspilerOptions options;
	private final boolean helpRequested;
	private final InputStream stdin;

	private CommandLine(String input, TranspilerOptions options, boolean helpRequested, InputStream stdin) {
		this.input = input;
		this.options = options;
		this.helpRequested = helpRequested;
		this.stdin = stdin;
	}

	public static CommandLine parse(String[] args, InputStream stdin) throws UsageException {
		String input = null;
		String output = null;
		String packageName = null;
		String funcName = null;
		boolean help = false;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			String name = arg;
			String inlineValue = null;
			int eq = arg.indexOf('=');
			if (arg.startsWith("--") && eq > 0) {
				name = arg.substring(0, eq);
				inlineValue = arg.substring(eq + 1);
			}

			switch (name) {
				case "-h", "--help" -> help = true;
				case "-i", "--input", "-o", "--output", "--package", "--func-name" -> {
					String value = inlineValue;
					if (value == null) {
						if (i + 1 >= args.length) {
							throw new UsageException("flag needs an argument: " + name);
						}
						value = args[++i];
					}
					switch (name) {
						case "-i", "--input" -> input = value;
						case "-o", "--output" -> output = value;
						case "--package" -> packageName = value;
						default -> funcName = value;
					}
				}
				default -> {
					if (arg.startsWith("-") && !arg.equals(STDIN_MARKER)) {
						throw new UsageException("unknown flag: " + name);
					}
					throw new UsageException("unexpected argument: " + arg);
				}
			}
		}

		if (!help && input == null) {
			throw new UsageException("required flag \"input\" not set");
		}
		TranspilerOptions options = new TranspilerOptions(packageName, funcName, output).withDefaults();
		return new CommandLine(input, options, help, stdin);
	}

	public boolean helpRequested() {
		return helpRequested;
	}

	public TranspilerOptions options() {
		return options;
	}

	@Override
	public LatexInput getLatexInput() throws IOException {
		String latex = input;
		if (STDIN_MARKER.equals(input)) {
			latex = new String(stdin.readAllBytes(), StandardCharsets.UTF_8).trim();
		}
		return new LatexInput(latex, options);
	}
}
