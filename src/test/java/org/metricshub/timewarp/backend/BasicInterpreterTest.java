package org.metricshub.timewarp.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.metricshub.timewarp.TwTestSupport.programTest;

import java.util.List;
import org.junit.Test;
import org.metricshub.timewarp.ExecutionEvent;
import org.metricshub.timewarp.ExecutionState;
import org.metricshub.timewarp.LanguageKind;
import org.metricshub.timewarp.TimeWarp;
import org.metricshub.timewarp.Transcript;
import org.metricshub.timewarp.jrt.DrawPrimitive;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;

public class BasicInterpreterTest {

	@Test
	public void testRepeatedLineNumberReplacesOnlyThatLine() {
		programTest("free-form line follows the replaced line")
				.basic("10 PRINT 1", "PRINT 2", "20 PRINT 4", "10 PRINT 3")
				.expectLines("3", "2", "4")
				.runAndAssert();
	}

	@Test
	public void testPrintSeparators() {
		programTest("semicolon joins items")
				.basic("PRINT \"A\"; \"B\"; 1 + 2")
				.expectLines("AB3")
				.runAndAssert();
		programTest("trailing semicolon keeps the line open")
				.basic("PRINT \"A\";", "PRINT \"B\"")
				.expectLines("AB")
				.runAndAssert();
		programTest("comma pads to the next print zone")
				.basic("PRINT \"A\", \"B\"")
				.expectLines("A             B")
				.runAndAssert();
		programTest("question mark is PRINT")
				.basic("? 7 / 2")
				.expectLines("3.5")
				.runAndAssert();
	}

	@Test
	public void testPrintEmitsOneEventPerStatement() {
		Transcript transcript = programTest("print events")
				.basic("PRINT \"A\";", "PRINT \"B\"")
				.runAndAssert();
		assertEquals(2, transcript.getOutputTexts().size());
		ExecutionEvent first = transcript.getEvents().get(0);
		assertFalse(((ExecutionEvent.Output) first).isLineEnd());
	}

	@Test
	public void testNumberFormatting() {
		programTest("integral and fractional numbers")
				.basic("PRINT 10 / 2", "PRINT 1 / 3", "PRINT -2.5", "PRINT 2 ^ 10")
				.expectLines("5", "0.333333333333333", "-2.5", "1024")
				.runAndAssert();
	}

	@Test
	public void testPowerBindsTighterThanUnaryMinus() {
		programTest("minus applies to the power")
				.basic("PRINT -2 ^ 2", "PRINT (-2) ^ 2", "PRINT 2 ^ -1", "PRINT 2 ^ 3 ^ 2")
				.expectLines("-4", "4", "0.5", "512")
				.runAndAssert();
	}

	@Test
	public void testNumberedLinesRunInOrder() {
		programTest("lines sorted by number, later duplicate wins")
				.basic("30 PRINT \"C\"", "10 PRINT \"A\"", "20 PRINT \"X\"", "20 PRINT \"B\"")
				.expectLines("A", "B", "C")
				.runAndAssert();
	}

	@Test
	public void testForNext() {
		programTest("counting up")
				.basic("FOR I = 1 TO 3", "PRINT I", "NEXT I")
				.expectLines("1", "2", "3")
				.runAndAssert();
		programTest("counting down with STEP")
				.basic("FOR I = 6 TO 1 STEP -2 : PRINT I : NEXT")
				.expectLines("6", "4", "2")
				.runAndAssert();
		programTest("loop not entered")
				.basic("FOR I = 5 TO 1", "PRINT I", "NEXT I", "PRINT \"done\"")
				.expectLines("done")
				.runAndAssert();
		programTest("nested loops")
				.basic("FOR I = 1 TO 2", "FOR J = 1 TO 2", "PRINT I * 10 + J", "NEXT J", "NEXT I")
				.expectLines("11", "12", "21", "22")
				.runAndAssert();
	}

	@Test
	public void testNextWithoutFor() {
		programTest("NEXT without FOR").basic("NEXT I").expectError(RuntimeErrorKind.NEXT_WITHOUT_FOR).runAndAssert();
	}

	@Test
	public void testGosubReturn() {
		programTest("subroutine")
				.basic("10 GOSUB 100", "20 PRINT \"back\"", "30 END", "100 PRINT \"sub\"", "110 RETURN")
				.expectLines("sub", "back")
				.expectCompletion(ExecutionEvent.CompletionReason.HALTED)
				.runAndAssert();
		programTest("RETURN without GOSUB")
				.basic("10 RETURN")
				.expectError(RuntimeErrorKind.RETURN_WITHOUT_GOSUB)
				.runAndAssert();
	}

	@Test
	public void testGotoComputedAndUndefinedLine() {
		programTest("computed GOTO")
				.basic("10 X = 3", "20 GOTO X * 10", "25 PRINT \"skipped\"", "30 PRINT \"target\"")
				.expectLines("target")
				.runAndAssert();
		programTest("undefined line")
				.basic("10 GOTO 99")
				.expectError(RuntimeErrorKind.UNDEFINED_LINE)
				.runAndAssert();
	}

	@Test
	public void testIfThenElse() {
		programTest("else branch")
				.basic("X = 2", "IF X > 3 THEN PRINT \"big\" ELSE PRINT \"small\"", "PRINT \"after\"")
				.expectLines("small", "after")
				.runAndAssert();
		programTest("then with line number")
				.basic("10 IF 1 = 1 THEN 30", "20 PRINT \"no\"", "30 PRINT \"yes\"")
				.expectLines("yes")
				.runAndAssert();
		programTest("logical operators")
				.basic("IF NOT (1 > 2) AND (2 > 1 OR 0) THEN PRINT \"ok\"")
				.expectLines("ok")
				.runAndAssert();
	}

	@Test
	public void testWhileWend() {
		programTest("while loop")
				.basic("I = 0", "WHILE I < 3", "I = I + 1", "WEND", "PRINT I")
				.expectLines("3")
				.runAndAssert();
	}

	@Test
	public void testArrays() {
		programTest("DIM then assign")
				.basic("DIM A(5)", "A(2) = 7", "PRINT A(2) + A(0)")
				.expectLines("7")
				.runAndAssert();
		programTest("implicit array of 11 elements")
				.basic("B$(10) = \"x\"", "PRINT B$(10)")
				.expectLines("x")
				.runAndAssert();
		programTest("index past the end")
				.basic("DIM A(5)", "A(6) = 1")
				.expectError(RuntimeErrorKind.INDEX_OUT_OF_RANGE)
				.runAndAssert();
	}

	@Test
	public void testTextVariablesAndFunctions() {
		programTest("text functions")
				.basic(
						"A$ = \"HELLO\" + \" \" + \"WORLD\"",
						"PRINT LEFT$(A$, 5); \"-\"; RIGHT$(A$, 5); \"-\"; MID$(A$, 7, 3)",
						"PRINT LEN(A$); \" \"; LOWER$(\"AbC\"); \" \"; STR$(12) + \"!\"",
						"PRINT VAL(\"3.5\") * 2; ASC(\"A\"); CHR$(66)")
				.expectLines("HELLO-WORLD-WOR", "11 abc 12!", "765B")
				.runAndAssert();
		programTest("number into text variable")
				.basic("A$ = 5")
				.expectError(RuntimeErrorKind.TYPE_MISMATCH)
				.runAndAssert();
		programTest("adding text to a number")
				.basic("PRINT \"A\" + 1")
				.expectError(RuntimeErrorKind.TYPE_MISMATCH)
				.runAndAssert();
	}

	@Test
	public void testUndefinedVariable() {
		programTest("read before assignment")
				.basic("PRINT Y + 1")
				.expectError(RuntimeErrorKind.UNDEFINED_VARIABLE)
				.runAndAssert();
	}

	@Test
	public void testInputIntoTextAndNumber() {
		programTest("two INPUTs")
				.basic("INPUT \"Name\"; N$", "INPUT A", "PRINT N$; \" is \"; A * 2")
				.input("Ada", "21")
				.expectLines("Ada is 42")
				.runAndAssert();
	}

	@Test
	public void testRepeatDrawsSquare() {
		TimeWarp timeWarp = new TimeWarp();
		ExecutionState state = timeWarp.start(timeWarp.load(LanguageKind.BASIC, "REPEAT 4 [FORWARD 10 RIGHT 90]"));
		Transcript transcript = timeWarp.run(state, java.util.Collections.<String>emptyList());
		assertEquals(4, transcript.getDrawPrimitives().size());
		assertEquals(0d, state.getTurtle().getX(), 1e-9);
		assertEquals(0d, state.getTurtle().getY(), 1e-9);
		assertEquals(0d, state.getTurtle().getHeading(), 1e-9);
	}

	@Test
	public void testNestedRepeatOverSeveralLines() {
		Transcript transcript = programTest("nested repeat")
				.basic("REPEAT 2 [", "  REPEAT 3 [FD 5]", "  RT 180", "]")
				.runAndAssert();
		assertEquals(6, transcript.getDrawPrimitives().size());
	}

	@Test
	public void testPenColorAndCircle() {
		Transcript transcript = programTest("pen state")
				.basic("SETCOLOR red", "FD 10", "PENUP", "FD 10", "PENDOWN", "SETCOLOR 2", "CIRCLE 5", "CLS")
				.runAndAssert();
		List<DrawPrimitive> primitives = transcript.getDrawPrimitives();
		assertEquals(3, primitives.size());
		assertEquals("red", primitives.get(0).getColor());
		assertEquals(DrawPrimitive.Kind.CIRCLE, primitives.get(1).getKind());
		assertEquals("green", primitives.get(1).getColor());
		assertEquals(20d, primitives.get(1).getY1(), 1e-9);
		assertEquals(DrawPrimitive.Kind.CLEAR, primitives.get(2).getKind());
	}

	@Test
	public void testSetxyAndHome() {
		Transcript transcript = programTest("absolute moves")
				.basic("SETXY 30, 40", "HOME")
				.runAndAssert();
		List<DrawPrimitive> primitives = transcript.getDrawPrimitives();
		assertEquals(2, primitives.size());
		assertEquals("LINE 0,0 -> 30,40 black", primitives.get(0).toString());
		assertEquals("LINE 30,40 -> 0,0 black", primitives.get(1).toString());
	}

	@Test
	public void testPilotQuestionAndAnswer() {
		Transcript transcript = programTest("T: then A:")
				.basic("T:What is your name?", "A:$NAME", "T:Hello $NAME")
				.input("Bob")
				.expectLines("Hello Bob")
				.runAndAssert();
		ExecutionEvent request = transcript.getEvents().get(0);
		assertEquals("What is your name?", ((ExecutionEvent.InputRequested) request).getPrompt());
	}

	@Test
	public void testPilotMatchAndConditionalType() {
		String[] program = {
				"*ask",
				"T:Capital of France?",
				"A:",
				"M:paris, lutetia",
				"TY:Correct",
				"TN:Try again",
				"JN:*ask",
				"E:" };
		programTest("wrong then right answer")
				.basic(program)
				.input("london", "It is Paris")
				.expectLines("Try again", "Correct")
				.expectCompletion(ExecutionEvent.CompletionReason.HALTED)
				.runAndAssert();
	}

	@Test
	public void testPilotComputeConditionAndSubroutine() {
		programTest("C:, T(cond): and U:")
				.basic("C:X = 5", "T(X > 3):big #X", "T(X < 3):small", "U:*greet", "T:end", "E:", "*greet", "T:hi", "E:")
				.expectLines("big 5", "hi", "end")
				.expectCompletion(ExecutionEvent.CompletionReason.HALTED)
				.runAndAssert();
	}

	@Test
	public void testPilotNumericAccept() {
		programTest("A:#N")
				.basic("A:#N", "T:#N")
				.input("x", "4")
				.expectLines("4")
				.runAndAssert();
	}

	@Test
	public void testMixedBasicPilotLogo() {
		Transcript transcript = programTest("all three in one program")
				.basic("10 PRINT \"start\"", "20 T:pilot", "30 FORWARD 10", "40 PRINT \"end\"")
				.expectLines("start", "pilot", "end")
				.runAndAssert();
		assertEquals(1, transcript.getDrawPrimitives().size());
		assertTrue(transcript.getEvents().get(2) instanceof ExecutionEvent.Draw);
	}
}
