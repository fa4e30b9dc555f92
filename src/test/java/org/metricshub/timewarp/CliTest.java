package org.metricshub.timewarp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.metricshub.timewarp.TwTestSupport.cliTest;

import java.io.IOException;
import org.junit.Test;
import org.metricshub.timewarp.TwTestSupport.CliResult;

public class CliTest {

	@Test
	public void testRunsBasicFile() throws IOException {
		cliTest("hello")
				.program("hello.twb", "10 PRINT \"HI\"", "20 PRINT 1 + 2")
				.expect("HI\n3\n")
				.expectExit(Cli.EXIT_OK)
				.runAndAssert();
	}

	@Test
	public void testReadsInputFromStdin() throws IOException {
		cliTest("readln")
				.program("greet.pas", "var s: string;", "begin write('Name? '); readln(s); writeln('Hi ', s) end.")
				.stdin("Ada\n")
				.expect("Name? Hi Ada\n")
				.expectExit(Cli.EXIT_OK)
				.runAndAssert();
	}

	@Test
	public void testEndOfInputAbortsTheRun() throws IOException {
		cliTest("no input left")
				.program("greet.pas", "var s: string;", "begin write('Name? '); readln(s); writeln('Hi ', s) end.")
				.expect("Name? ")
				.expectExit(Cli.EXIT_OK)
				.runAndAssert();
	}

	@Test
	public void testSyntaxErrorIsReportedWithPosition() throws IOException {
		CliResult result = cliTest("unknown identifier")
				.program("bad.pas", "begin x := 1 end.")
				.expect("")
				.expectExit(Cli.EXIT_SYNTAX_ERROR)
				.runAndAssert();
		assertEquals(result.getProgramPath() + ":1:7: Unknown identifier x", result.getErr().trim());
	}

	@Test
	public void testCheckOnlyParses() throws IOException {
		cliTest("valid program")
				.argument("--check")
				.program("ok.twb", "10 PRINT \"never printed\"")
				.expect("")
				.expectExit(Cli.EXIT_OK)
				.runAndAssert();
		cliTest("invalid program")
				.argument("--check")
				.program("bad.twb", "10 FOR I = 1 TO 2")
				.expectExit(Cli.EXIT_SYNTAX_ERROR)
				.runAndAssert();
	}

	@Test
	public void testRuntimeErrorKeepsOutput() throws IOException {
		CliResult result = cliTest("division by zero")
				.program("div.twb", "10 PRINT 1", "20 PRINT 1 / 0")
				.expect("1\n")
				.expectExit(Cli.EXIT_RUNTIME_ERROR)
				.runAndAssert();
		assertEquals(result.getProgramPath() + ":20: Division by zero", result.getErr().trim());
	}

	@Test
	public void testGraphicsTrace() throws IOException {
		cliTest("with trace")
				.argument("--graphics")
				.program("line.logo", "FD 10", "PRINT \"done\"")
				.expect("LINE 0,0 -> 0,10 black\ndone\n")
				.runAndAssert();
		cliTest("without trace")
				.program("line.logo", "FD 10", "PRINT \"done\"")
				.expect("done\n")
				.runAndAssert();
	}

	@Test
	public void testForcedLanguage() throws IOException {
		cliTest("prolog in a text file")
				.argument("-l", "prolog")
				.program("facts.txt", "?- write(hi), nl.")
				.expect("hi\n")
				.expectExit(Cli.EXIT_OK)
				.runAndAssert();
	}

	@Test
	public void testLanguageIsDetectedFromContent() throws IOException {
		cliTest("pascal without extension")
				.program("program", "program Hello;", "begin writeln('hello') end.")
				.expect("hello\n")
				.runAndAssert();
	}

	@Test
	public void testInstructionLimit() throws IOException {
		cliTest("endless loop")
				.argument("--max-instructions", "100")
				.program("loop.twb", "10 GOTO 10")
				.expectExit(Cli.EXIT_RUNTIME_ERROR)
				.runAndAssert();
	}

	@Test
	public void testUsage() throws IOException {
		CliResult result = cliTest("no arguments").expectExit(Cli.EXIT_OK).runAndAssert();
		assertTrue(result.getOut().startsWith("Usage:"));
		result = cliTest("help").argument("-h").expectExit(Cli.EXIT_OK).runAndAssert();
		assertTrue(result.getOut().contains("--occurs-check"));
	}

	@Test
	public void testBadArguments() throws IOException {
		CliResult result = cliTest("unknown option")
				.argument("--bogus")
				.program("x.twb", "10 END")
				.expectExit(Cli.EXIT_SYNTAX_ERROR)
				.runAndAssert();
		assertTrue(result.getErr().startsWith("Unknown parameter: --bogus"));

		result = cliTest("missing file")
				.argument("does-not-exist.twb")
				.expectExit(Cli.EXIT_SYNTAX_ERROR)
				.runAndAssert();
		assertTrue(result.getErr().startsWith("Program file not found"));

		result = cliTest("seed is not a number")
				.argument("--seed", "abc")
				.program("x.twb", "10 END")
				.expectExit(Cli.EXIT_SYNTAX_ERROR)
				.runAndAssert();
		assertTrue(result.getErr().startsWith("--seed expects an integer"));

		result = cliTest("unknown language")
				.argument("-l", "cobol")
				.program("x.twb", "10 END")
				.expectExit(Cli.EXIT_SYNTAX_ERROR)
				.runAndAssert();
		assertTrue(result.getErr().startsWith("Unknown language: cobol"));
	}
}
