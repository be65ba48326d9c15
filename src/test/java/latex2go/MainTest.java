package latex2go;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args) {
		return Main.run(args, new ByteArrayInputStream(new byte[0]),
				new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String stdout() {
		return out.toString(StandardCharsets.UTF_8);
	}

	private String stderr() {
		return err.toString(StandardCharsets.UTF_8);
	}

	@Test
	void printsGeneratedCodeToStdout() {
		assertEquals(Main.EXIT_OK, run("-i", "x + 1", "--func-name", "inc"));

		assertTrue(stdout().contains("func inc(x float64) float64 {"), stdout());
		assertEquals("", stderr());
	}

	@Test
	void writesToOutputFile(@TempDir Path dir) throws Exception {
		Path target = dir.resolve("area.go");

		assertEquals(Main.EXIT_OK, run("-i", "w * h", "-o", target.toString(), "--package", "geometry"));

		assertEquals("", stdout());
		assertTrue(Files.readString(target).startsWith("package geometry\n"));
	}

	@Test
	void reportsTranslationErrors() {
		assertEquals(Main.EXIT_FAILURE, run("-i", "\\frac{a}"));

		assertTrue(stderr().startsWith("Error: failed to parse latex"), stderr());
		assertEquals("", stdout());
	}

	@Test
	void reportsUsageErrors() {
		assertEquals(Main.EXIT_USAGE, run());

		assertTrue(stderr().startsWith("Error: required flag \"input\" not set"), stderr());
		assertTrue(stderr().contains("Usage:"));
	}

	@Test
	void printsHelp() {
		assertEquals(Main.EXIT_OK, run("--help"));

		assertEquals(CommandLine.USAGE, stdout());
	}
}
