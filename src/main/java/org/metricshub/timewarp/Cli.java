package org.metricshub.timewarp;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Time Warp
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.util.ProgramFileSource;
import org.metricshub.timewarp.util.TwLogger;
import org.metricshub.timewarp.util.TwSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for Time Warp.
 */
public final class Cli {

	/** The run completed. */
	public static final int EXIT_OK = 0;

	/** The run ended with a runtime error. */
	public static final int EXIT_RUNTIME_ERROR = 1;

	/** The program has a syntax error, or the command line is wrong. */
	public static final int EXIT_SYNTAX_ERROR = 2;

	private static final Logger LOG = TwLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "timewarp.jar";
		}
		JAR_NAME = myName;
	}

	private final TwSettings settings = new TwSettings();
	private final PrintStream out;
	private final PrintStream err;

	private ProgramFileSource programSource;
	private LanguageKind language;
	private boolean checkOnly;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which input lines are read
	 * @param out stream where program output is written
	 * @param err stream where syntax and runtime errors are reported
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link TwSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TwSettings getSettings() {
		return settings;
	}

	/**
	 * @return the language forced with {@code -l}, or {@code null}
	 */
	public LanguageKind getLanguage() {
		return language;
	}

	public boolean isCheckOnly() {
		return checkOnly;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException when the arguments are invalid
	 */
	public void parse(String[] args) {

		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				break;
			} else if (arg.equals("-l") || arg.equals("--language")) {
				checkParameterHasArgument(args, argIdx);
				language = LanguageKind.fromName(args[++argIdx]);
			} else if (arg.equals("--check")) {
				checkOnly = true;
			} else if (arg.equals("--graphics")) {
				settings.setGraphicsTrace(true);
			} else if (arg.equals("--seed")) {
				checkParameterHasArgument(args, argIdx);
				settings.setRandomSeed(parseNumber(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--occurs-check")) {
				settings.setOccursCheck(true);
			} else if (arg.equals("--max-instructions")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxInstructions(parseNumber(args[argIdx], args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("Program file not provided.");
		}
		if (argIdx + 1 < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx + 1]);
		}
		programSource = new ProgramFileSource(args[argIdx]);
		if (!new File(programSource.getFilePath()).isFile()) {
			throw new IllegalArgumentException("Program file not found: " + programSource.getFilePath());
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static long parseNumber(String option, String value) {
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'", e);
		}
	}

	/**
	 * Loads and runs the program named on the command line. Output events
	 * are printed to the output stream as they arrive; every input request
	 * reads one line from the input stream, and the run is aborted at end of
	 * input.
	 *
	 * @return the exit code
	 * @throws IOException when the program file or the input cannot be read
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return EXIT_OK;
		}
		if (programSource == null) {
			throw new IllegalStateException("parse() must be called before run()");
		}

		TimeWarp timeWarp = new TimeWarp(settings);
		Program program;
		try {
			program = language == null ? timeWarp.load(programSource) : timeWarp.load(language, programSource);
		} catch (ParserException e) {
			err.println(
					programSource.getFilePath() + ":" + e.getLine() + ":" + e.getColumn() + ": " + e.getReason());
			return EXIT_SYNTAX_ERROR;
		}
		if (checkOnly) {
			return EXIT_OK;
		}
		LOG.debug("Running {} with settings:\n{}", programSource, settings.toDescriptionString());
		PrintStream programOut = settings.getOutputStream();

		BufferedReader input = new BufferedReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
		ExecutionState state = timeWarp.start(program);
		ExecutionEvent event = timeWarp.step(state);
		while (!event.isTerminal()) {
			if (event instanceof ExecutionEvent.Output) {
				ExecutionEvent.Output output = (ExecutionEvent.Output) event;
				programOut.print(output.getText());
				if (output.isLineEnd()) {
					programOut.println();
				}
				event = timeWarp.step(state);
			} else if (event instanceof ExecutionEvent.Draw) {
				if (settings.isGraphicsTrace()) {
					programOut.println(((ExecutionEvent.Draw) event).getPrimitive());
				}
				event = timeWarp.step(state);
			} else {
				String prompt = ((ExecutionEvent.InputRequested) event).getPrompt();
				if (prompt != null) {
					programOut.print(prompt);
				}
				programOut.flush();
				String line = input.readLine();
				if (line == null) {
					timeWarp.abort(state);
					event = timeWarp.step(state);
				} else {
					event = timeWarp.resume(state, line);
				}
			}
		}
		programOut.flush();

		if (event instanceof ExecutionEvent.RuntimeError) {
			ExecutionEvent.RuntimeError error = (ExecutionEvent.RuntimeError) event;
			if (error.getLineNumber() > 0) {
				err.println(programSource.getFilePath() + ":" + error.getLineNumber() + ": " + error.getMessage());
			} else {
				err.println(programSource.getFilePath() + ": " + error.getMessage());
			}
			return EXIT_RUNTIME_ERROR;
		}
		return EXIT_OK;
	}

	/**
	 * Parses the arguments and runs the program.
	 *
	 * @param args command-line arguments
	 * @return the exit code
	 * @throws IOException when the program file or the input cannot be read
	 */
	public int execute(String[] args) throws IOException {
		try {
			parse(args);
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			usage(err);
			return EXIT_SYNTAX_ERROR;
		}
		return run();
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-l basic|pascal|prolog]" +
								" [--check]" +
								" [--graphics]" +
								" [--seed n]" +
								" [--occurs-check]" +
								" [--max-instructions n]" +
								" program-file");
		dest.println();
		dest.println(" -l lang = force the language instead of deriving it from the file name");
		dest.println(" --check = parse only and report syntax errors as file:line:column: message");
		dest.println(" --graphics = print turtle draw primitives as text lines");
		dest.println(" --seed n = seed of the random number generator (default 1)");
		dest.println(" --occurs-check = enable the occurs check in Prolog unification");
		dest.println(" --max-instructions n = stop runaway programs after n steps (default unlimited)");
		dest.println(" -h or -? = this help screen");
	}
}
