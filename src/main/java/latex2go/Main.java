package latex2go;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;

public final class Main {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	private Main() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.in, System.out, System.err));
	}

	static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		CommandLine commandLine;
		try {
			commandLine = CommandLine.parse(args, in);
		} catch (UsageException ex) {
			err.println("Error: " + ex.getMessage());
			err.print(CommandLine.USAGE);
			return EXIT_USAGE;
		}

		if (commandLine.helpRequested()) {
			out.print(CommandLine.USAGE);
			return EXIT_OK;
		}

		try {
			CodeWriter writer = CodeWriters.forOutputPath(commandLine.options().outputPath(), out);
			new TranspileService(commandLine, writer).run();
			return EXIT_OK;
		} catch (TranspileException ex) {
			logger.debug("transpilation failed", ex);
			err.println("Error: " + ex.getMessage());
			return EXIT_FAILURE;
		}
	}
}
