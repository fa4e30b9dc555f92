package org.metricshub.timewarp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.timewarp.frontend.ParserException;
import org.metricshub.timewarp.jrt.DrawPrimitive;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.util.ProgramFileSource;
import org.metricshub.timewarp.util.TwSettings;

public class TimeWarpTest {

	private final TimeWarp timeWarp = new TimeWarp();

	private static void assertOutput(String text, boolean lineEnd, ExecutionEvent event) {
		assertTrue("expected output but got " + event, event instanceof ExecutionEvent.Output);
		assertEquals(text, ((ExecutionEvent.Output) event).getText());
		assertEquals(lineEnd, ((ExecutionEvent.Output) event).isLineEnd());
	}

	private static void assertCompleted(ExecutionEvent.CompletionReason reason, ExecutionEvent event) {
		assertTrue("expected completion but got " + event, event instanceof ExecutionEvent.Completed);
		assertEquals(reason, ((ExecutionEvent.Completed) event).getReason());
	}

	@Test
	public void testBasicPrintThenComplete() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "10 PRINT \"HI\""));
		assertOutput("HI", true, timeWarp.step(state));
		assertCompleted(ExecutionEvent.CompletionReason.END_OF_PROGRAM, timeWarp.step(state));
	}

	@Test
	public void testBasicAssignmentAndArithmetic() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "LET X = 2\nPRINT X * 3"));
		assertOutput("6", true, timeWarp.step(state));
		assertCompleted(ExecutionEvent.CompletionReason.END_OF_PROGRAM, timeWarp.step(state));
	}

	@Test
	public void testLogoDrawsTwoSegmentsAtRightAngles() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "FORWARD 100\nRIGHT 90\nFORWARD 50"));
		ExecutionEvent first = timeWarp.step(state);
		ExecutionEvent second = timeWarp.step(state);
		assertCompleted(ExecutionEvent.CompletionReason.END_OF_PROGRAM, timeWarp.step(state));

		DrawPrimitive a = ((ExecutionEvent.Draw) first).getPrimitive();
		DrawPrimitive b = ((ExecutionEvent.Draw) second).getPrimitive();
		assertEquals(DrawPrimitive.Kind.LINE, a.getKind());
		assertEquals(DrawPrimitive.Kind.LINE, b.getKind());
		double dot = (a.getX2() - a.getX1()) * (b.getX2() - b.getX1()) + (a.getY2() - a.getY1()) * (b.getY2() - b.getY1());
		assertEquals(0d, dot, 1e-9);
		assertEquals(100d, Math.hypot(a.getX2() - a.getX1(), a.getY2() - a.getY1()), 1e-9);
		assertEquals(50d, Math.hypot(b.getX2() - b.getX1(), b.getY2() - b.getY1()), 1e-9);
		assertEquals(90d, state.getTurtle().getHeading(), 1e-9);
	}

	@Test
	public void testPascalRecursiveFunction() {
		String source = TwTestSupport
				.lines(
						"program fact;",
						"function factorial(n: integer): integer;",
						"begin",
						"  if n <= 1 then factorial := 1 else factorial := n * factorial(n - 1)",
						"end;",
						"begin",
						"  writeln(factorial(4))",
						"end.");
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.PASCAL, source));
		assertOutput("24", true, timeWarp.step(state));
		assertCompleted(ExecutionEvent.CompletionReason.END_OF_PROGRAM, timeWarp.step(state));
	}

	@Test
	public void testPrologSolutionsInClauseOrder() {
		String source = TwTestSupport.lines("person(john).", "person(mary).", "?- person(X), write(X), nl.");
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.PROLOG, source));
		assertOutput("john", true, timeWarp.step(state));
		assertOutput("mary", true, timeWarp.step(state));
		assertCompleted(ExecutionEvent.CompletionReason.NO_MORE_SOLUTIONS, timeWarp.step(state));
	}

	@Test
	public void testInputRoundTrip() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "INPUT X\nPRINT X"));
		ExecutionEvent request = timeWarp.step(state);
		assertTrue(request instanceof ExecutionEvent.InputRequested);
		assertTrue(state.isAwaitingInput());
		assertOutput("7", true, timeWarp.resume(state, "7"));
		assertFalse(state.isAwaitingInput());
		assertCompleted(ExecutionEvent.CompletionReason.END_OF_PROGRAM, timeWarp.step(state));
	}

	@Test
	public void testStepWhileAwaitingInputIsRejected() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "INPUT X"));
		assertTrue(timeWarp.step(state) instanceof ExecutionEvent.InputRequested);
		assertThrows(IllegalStateException.class, () -> timeWarp.step(state));
	}

	@Test
	public void testResumeWithoutRequestIsRejected() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "PRINT 1"));
		assertThrows(IllegalStateException.class, () -> timeWarp.resume(state, "1"));
		assertOutput("1", true, timeWarp.step(state));
		assertThrows(IllegalStateException.class, () -> timeWarp.resume(state, "1"));
	}

	@Test
	public void testUnconvertibleInputIsRequestedAgain() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "INPUT \"Age\"; A\nPRINT A + 1"));
		ExecutionEvent request = timeWarp.step(state);
		assertEquals("Age", ((ExecutionEvent.InputRequested) request).getPrompt());
		ExecutionEvent again = timeWarp.resume(state, "old");
		assertTrue(again instanceof ExecutionEvent.InputRequested);
		assertEquals("Age", ((ExecutionEvent.InputRequested) again).getPrompt());
		assertOutput("42", true, timeWarp.resume(state, "41"));
	}

	@Test
	public void testRuntimeErrorKeepsEarlierOutput() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "10 PRINT \"A\"\n20 PRINT 1 / 0"));
		assertOutput("A", true, timeWarp.step(state));
		ExecutionEvent error = timeWarp.step(state);
		assertTrue(error instanceof ExecutionEvent.RuntimeError);
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, ((ExecutionEvent.RuntimeError) error).getErrorKind());
		assertEquals(20, ((ExecutionEvent.RuntimeError) error).getLineNumber());
		assertSame(error, timeWarp.step(state));
	}

	@Test
	public void testTerminalEventIsRepeated() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "END\nPRINT 1"));
		ExecutionEvent terminal = timeWarp.step(state);
		assertCompleted(ExecutionEvent.CompletionReason.HALTED, terminal);
		assertTrue(state.isTerminated());
		assertSame(terminal, timeWarp.step(state));
		assertSame(terminal, timeWarp.step(state));
	}

	@Test
	public void testAbortDropsQueuedEvents() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "10 PRINT \"X\"\n20 GOTO 10"));
		assertOutput("X", true, timeWarp.step(state));
		assertOutput("X", true, timeWarp.step(state));
		timeWarp.abort(state);
		assertCompleted(ExecutionEvent.CompletionReason.ABORTED, timeWarp.step(state));
		assertCompleted(ExecutionEvent.CompletionReason.ABORTED, timeWarp.step(state));
	}

	@Test
	public void testAbortWhileAwaitingInput() {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "INPUT X"));
		assertTrue(timeWarp.step(state) instanceof ExecutionEvent.InputRequested);
		timeWarp.abort(state);
		assertCompleted(ExecutionEvent.CompletionReason.ABORTED, timeWarp.step(state));
		assertFalse(state.isAwaitingInput());
	}

	@Test(timeout = 10000)
	public void testAbortFromAnotherThreadStopsASilentLoop() throws Exception {
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "10 GOTO 10"));
		Thread aborter = new Thread(() -> {
			try {
				Thread.sleep(100);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			timeWarp.abort(state);
		});
		aborter.start();
		assertCompleted(ExecutionEvent.CompletionReason.ABORTED, timeWarp.step(state));
		aborter.join();
	}

	@Test
	public void testInstructionLimitStopsRunawayProgram() {
		TwSettings settings = new TwSettings();
		settings.setMaxInstructions(1000);
		TimeWarp limited = new TimeWarp(settings);
		ExecutionEvent event = limited.step(limited.start(limited.load(LanguageKind.BASIC, "10 GOTO 10")));
		assertTrue(event instanceof ExecutionEvent.RuntimeError);
		assertEquals(RuntimeErrorKind.STEP_LIMIT, ((ExecutionEvent.RuntimeError) event).getErrorKind());
	}

	@Test
	public void testRunsAreIndependent() {
		Program program = timeWarp.load(LanguageKind.BASIC, "X = X0 + 1\nPRINT X\nFORWARD 10");
		ExecutionState first = timeWarp.start(program);
		ExecutionState second = timeWarp.start(program);
		assertTrue(timeWarp.step(first) instanceof ExecutionEvent.RuntimeError);
		assertNull(second.getTerminalEvent());
		assertEquals(0d, second.getTurtle().getY(), 0d);
	}

	@Test
	public void testSameProgramAndInputsGiveSameEvents() {
		String source = "FOR I = 1 TO 3\nPRINT RND(1)\nFORWARD RND(1) * 100\nNEXT I";
		List<ExecutionEvent> first = timeWarp.run(LanguageKind.BASIC, source, Collections.<String>emptyList()).getEvents();
		List<ExecutionEvent> second = timeWarp.run(LanguageKind.BASIC, source, Collections.<String>emptyList()).getEvents();
		assertEquals(first.size(), second.size());
		for (int i = 0; i < first.size(); i++) {
			assertEquals(first.get(i).toString(), second.get(i).toString());
		}
	}

	@Test
	public void testRunAbortsWhenInputRunsOut() {
		Transcript transcript = timeWarp.run(LanguageKind.BASIC, "INPUT A\nINPUT B\nPRINT A + B", Arrays.asList("1"));
		assertCompleted(ExecutionEvent.CompletionReason.ABORTED, transcript.getTerminalEvent());
		assertEquals(2, transcript.getInputRequestCount());
		assertEquals("", transcript.getOutput());
	}

	@Test
	public void testSyntaxErrorCarriesPosition() {
		ParserException e = assertThrows(ParserException.class, () -> timeWarp.load(LanguageKind.BASIC, "PRINT 1\nPRINT (2"));
		assertEquals(2, e.getLine());
		assertTrue(e.getColumn() > 1);
	}

	@Test
	public void testLoadDetectsLanguageFromFileName() throws IOException {
		Path dir = Files.createTempDirectory("timewarp");
		Path file = dir.resolve("hello.pas");
		Files.write(file, "begin writeln('hi') end.".getBytes(StandardCharsets.UTF_8));
		try {
			Program program = timeWarp.load(new ProgramFileSource(file.toString()));
			assertEquals(LanguageKind.PASCAL, program.getLanguage());
			assertEquals(file.toString(), program.getSourceDescription());
		} finally {
			Files.delete(file);
			Files.delete(dir);
		}
	}

	@Test
	public void testDetectLanguageFromText() {
		assertEquals(LanguageKind.PASCAL, LanguageKind.detect("program p;\nbegin\nend."));
		assertEquals(LanguageKind.PROLOG, LanguageKind.detect("likes(a, b).\n?- likes(a, X)."));
		assertEquals(LanguageKind.BASIC, LanguageKind.detect("10 PRINT \"HI\""));
		assertEquals(LanguageKind.BASIC, LanguageKind.fromName("twbasic"));
		assertEquals(LanguageKind.PROLOG, LanguageKind.fromName("Prolog"));
	}
}
