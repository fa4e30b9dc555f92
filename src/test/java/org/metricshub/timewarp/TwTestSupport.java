package org.metricshub.timewarp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Reusable helpers for running Time Warp programs in tests. The fluent
 * builders ({@link #programTest(String)} and {@link #cliTest(String)}) let
 * tests describe a program, its input and the expected outcome before
 * running it through {@link TimeWarp} or {@link Cli}.
 */
public final class TwTestSupport {

	private TwTestSupport() {}

	/**
	 * Creates a builder for a test running a program through the
	 * {@link TimeWarp} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return the builder
	 */
	public static ProgramTestBuilder programTest(String description) {
		return new ProgramTestBuilder(description);
	}

	/**
	 * Creates a builder for a test running the {@link Cli}.
	 *
	 * @param description human readable description used in assertion messages
	 * @return the builder
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Joins lines with {@code \n}, adding a final line break.
	 *
	 * @param lines the lines
	 * @return the text
	 */
	public static String lines(String... lines) {
		StringBuilder sb = new StringBuilder();
		for (String line : lines) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}

	/**
	 * Builds and runs a program with the {@link TimeWarp} facade.
	 */
	public static final class ProgramTestBuilder {
		private final String description;
		private final TwSettings settings = new TwSettings();
		private LanguageKind language = LanguageKind.BASIC;
		private String source;
		private final List<String> inputs = new ArrayList<String>();
		private String expectedOutput;
		private ExecutionEvent.CompletionReason expectedReason;
		private RuntimeErrorKind expectedError;

		private ProgramTestBuilder(String description) {
			this.description = description;
		}

		public ProgramTestBuilder basic(String... sourceLines) {
			return language(LanguageKind.BASIC, sourceLines);
		}

		public ProgramTestBuilder pascal(String... sourceLines) {
			return language(LanguageKind.PASCAL, sourceLines);
		}

		public ProgramTestBuilder prolog(String... sourceLines) {
			return language(LanguageKind.PROLOG, sourceLines);
		}

		private ProgramTestBuilder language(LanguageKind kind, String... sourceLines) {
			this.language = kind;
			this.source = lines(sourceLines);
			return this;
		}

		/**
		 * @param answers answers to the program's input requests, in order
		 * @return this builder
		 */
		public ProgramTestBuilder input(String... answers) {
			inputs.addAll(Arrays.asList(answers));
			return this;
		}

		public ProgramTestBuilder maxInstructions(long max) {
			settings.setMaxInstructions(max);
			return this;
		}

		public ProgramTestBuilder occursCheck() {
			settings.setOccursCheck(true);
			return this;
		}

		public ProgramTestBuilder seed(long seed) {
			settings.setRandomSeed(seed);
			return this;
		}

		/**
		 * @param lines expected output lines, each followed by a line break
		 * @return this builder
		 */
		public ProgramTestBuilder expectLines(String... lines) {
			this.expectedOutput = lines(lines);
			return this;
		}

		public ProgramTestBuilder expectOutput(String output) {
			this.expectedOutput = output;
			return this;
		}

		public ProgramTestBuilder expectCompletion(ExecutionEvent.CompletionReason reason) {
			this.expectedReason = reason;
			return this;
		}

		public ProgramTestBuilder expectError(RuntimeErrorKind kind) {
			this.expectedError = kind;
			return this;
		}

		/**
		 * Runs the program without asserting anything.
		 *
		 * @return the transcript
		 */
		public Transcript run() {
			return new TimeWarp(settings).run(language, source, inputs);
		}

		/**
		 * Runs the program and asserts the configured expectations. Without an
		 * expected error, the run must complete.
		 *
		 * @return the transcript, for further assertions
		 */
		public Transcript runAndAssert() {
			Transcript transcript = run();
			ExecutionEvent terminal = transcript.getTerminalEvent();
			if (expectedError != null) {
				assertTrue(
						description + ": expected a runtime error but got " + terminal,
						terminal instanceof ExecutionEvent.RuntimeError);
				assertEquals(description, expectedError, ((ExecutionEvent.RuntimeError) terminal).getErrorKind());
			} else {
				if (!(terminal instanceof ExecutionEvent.Completed)) {
					fail(description + ": unexpected " + terminal);
				}
				if (expectedReason != null) {
					assertEquals(description, expectedReason, ((ExecutionEvent.Completed) terminal).getReason());
				}
			}
			if (expectedOutput != null) {
				assertEquals(description, expectedOutput, transcript.getOutput());
			}
			return transcript;
		}
	}

	/**
	 * Builds and runs a {@link Cli} invocation on a temporary program file.
	 */
	public static final class CliTestBuilder {
		private final String description;
		private final List<String> arguments = new ArrayList<String>();
		private String fileName;
		private String fileContents;
		private String stdin = "";
		private String expectedOutput;
		private Integer expectedExit;

		private CliTestBuilder(String description) {
			this.description = description;
		}

		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * The program file, appended after the arguments.
		 *
		 * @param name file name, whose extension may select the language
		 * @param sourceLines program lines
		 * @return this builder
		 */
		public CliTestBuilder program(String name, String... sourceLines) {
			this.fileName = name;
			this.fileContents = lines(sourceLines);
			return this;
		}

		public CliTestBuilder stdin(String text) {
			this.stdin = text;
			return this;
		}

		public CliTestBuilder expect(String output) {
			this.expectedOutput = output;
			return this;
		}

		public CliTestBuilder expectExit(int code) {
			this.expectedExit = code;
			return this;
		}

		/**
		 * Runs the CLI.
		 *
		 * @return the exit code, the standard output and the standard error
		 * @throws IOException when the temporary file cannot be written
		 */
		public CliResult run() throws IOException {
			Path dir = Files.createTempDirectory("timewarp-cli");
			List<String> args = new ArrayList<String>(arguments);
			Path file = null;
			if (fileName != null) {
				file = dir.resolve(fileName);
				Files.write(file, fileContents.getBytes(StandardCharsets.UTF_8));
				args.add(file.toString());
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int code;
			try (PrintStream outStream = new PrintStream(out, true, "UTF-8");
					PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
				Cli cli = new Cli(
						new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
						outStream,
						errStream);
				code = cli.execute(args.toArray(new String[0]));
			} finally {
				if (file != null) {
					Files.deleteIfExists(file);
				}
				Files.deleteIfExists(dir);
			}
			return new CliResult(
					code,
					new String(out.toByteArray(), StandardCharsets.UTF_8),
					new String(err.toByteArray(), StandardCharsets.UTF_8),
					file == null ? null : file.toString());
		}

		public CliResult runAndAssert() throws IOException {
			CliResult result = run();
			if (expectedExit != null) {
				assertEquals(description + " (exit code, stderr: " + result.getErr() + ")", expectedExit.intValue(), result.getExitCode());
			}
			if (expectedOutput != null) {
				assertEquals(description, expectedOutput, result.getOut().replace("\r\n", "\n"));
			}
			return result;
		}
	}

	/**
	 * Captured outcome of a CLI run.
	 */
	public static final class CliResult {
		private final int exitCode;
		private final String out;
		private final String err;
		private final String programPath;

		CliResult(int exitCode, String out, String err, String programPath) {
			this.exitCode = exitCode;
			this.out = out;
			this.err = err;
			this.programPath = programPath;
		}

		public int getExitCode() {
			return exitCode;
		}

		public String getOut() {
			return out;
		}

		public String getErr() {
			return err;
		}

		public String getProgramPath() {
			return programPath;
		}
	}
}
