package latex2go;

import java.io.IOException;
import java.io.PrintStream;

public final class StdoutCodeWriter implements CodeWriter {
	private final PrintStream out;

	public StdoutCodeWriter() {
		this(System.out);
	}

	public StdoutCodeWriter(PrintStream out) {
		this.out = out;
	}

	@Override
	public void write(String code) throws IOException {
		out.print(code);
		out.flush();
		if (out.checkError()) {
			throw new IOException("failed to write code to stdout");
		}
	}
}
