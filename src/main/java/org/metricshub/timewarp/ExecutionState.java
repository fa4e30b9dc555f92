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

import java.util.Random;
import org.metricshub.timewarp.jrt.DrawPrimitive;
import org.metricshub.timewarp.jrt.IOChannel;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TurtleCommand;
import org.metricshub.timewarp.jrt.TurtleEngine;
import org.metricshub.timewarp.jrt.TurtleState;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Everything a run needs between two calls to the engine: the event queue,
 * the turtle, the abort flag and the terminal event, plus the
 * language-specific continuation held by subclasses.
 * <p>
 * The host owns this object between calls and may read the turtle state
 * while the run is suspended. Nothing of a run lives on the Java call stack
 * between two calls.
 */
public abstract class ExecutionState {

	private final Program program;
	private final TwSettings settings;
	private final IOChannel channel = new IOChannel();
	private final Random random;
	private final StringBuilder pendingLine = new StringBuilder();

	private TurtleState turtle = TurtleState.HOME;
	private String inputPrompt;
	private volatile boolean aborted;
	private ExecutionEvent terminalEvent;
	private long instructionCount;

	protected ExecutionState(Program program, TwSettings settings) {
		this.program = program;
		this.settings = settings;
		this.random = new Random(settings.getRandomSeed());
	}

	public Program getProgram() {
		return program;
	}

	public TwSettings getSettings() {
		return settings;
	}

	public IOChannel getChannel() {
		return channel;
	}

	public Random getRandom() {
		return random;
	}

	public TurtleState getTurtle() {
		return turtle;
	}

	public boolean isAborted() {
		return aborted;
	}

	/**
	 * @return {@code true} once the run has completed or failed
	 */
	public boolean isTerminated() {
		return terminalEvent != null;
	}

	/**
	 * @return the {@code Completed} or {@code RuntimeError} event ending the run,
	 *         or {@code null} while it is still running
	 */
	public ExecutionEvent getTerminalEvent() {
		return terminalEvent;
	}

	public boolean isAwaitingInput() {
		return channel.isAwaitingInput();
	}

	public long getInstructionCount() {
		return instructionCount;
	}

	/**
	 * Runs a turtle command and queues the primitives it draws.
	 *
	 * @param command the command
	 */
	public void applyTurtle(TurtleCommand command) {
		TurtleEngine.TurtleResult result = TurtleEngine.apply(turtle, command);
		turtle = result.getState();
		for (DrawPrimitive primitive : result.getPrimitives()) {
			channel.draw(primitive);
		}
	}

	/**
	 * Appends text to the current output line without emitting it.
	 *
	 * @param text the text
	 */
	public void appendOutput(String text) {
		pendingLine.append(text);
	}

	public boolean hasPendingOutput() {
		return pendingLine.length() > 0;
	}

	/**
	 * Emits the current output line.
	 *
	 * @param lineEnd whether a line break follows
	 */
	public void flushOutput(boolean lineEnd) {
		channel.output(pendingLine.toString(), lineEnd);
		pendingLine.setLength(0);
	}

	/**
	 * Emits buffered text, if any, as an unterminated line. Called before an
	 * input request and when the run ends.
	 */
	public void flushPendingOutput() {
		if (pendingLine.length() > 0) {
			flushOutput(false);
		}
	}

	/**
	 * Suspends the run on an input request. Buffered output is emitted first.
	 *
	 * @param prompt optional prompt
	 */
	public void requestInput(String prompt) {
		flushPendingOutput();
		inputPrompt = prompt;
		channel.requestInput(prompt);
	}

	/**
	 * Asks again for input the previous answer could not be converted to.
	 */
	public void repeatInputRequest() {
		channel.requestInput(inputPrompt);
	}

	/**
	 * Counts one instruction or resolution step against the configured limit.
	 */
	public void countInstruction() {
		instructionCount++;
		long max = settings.getMaxInstructions();
		if (max > 0 && instructionCount > max) {
			throw new TwRuntimeException(
					RuntimeErrorKind.STEP_LIMIT,
					"Execution stopped after " + max + " steps");
		}
	}

	/**
	 * Ends the run normally.
	 *
	 * @param reason why the run ended
	 */
	public void complete(ExecutionEvent.CompletionReason reason) {
		if (terminalEvent == null) {
			flushPendingOutput();
			terminalEvent = new ExecutionEvent.Completed(reason);
		}
	}

	/**
	 * Ends the run with a runtime error. Output emitted so far stays queued.
	 *
	 * @param e the error
	 */
	public void fail(TwRuntimeException e) {
		if (terminalEvent == null) {
			if (!channel.isAwaitingInput()) {
				flushPendingOutput();
			}
			terminalEvent = new ExecutionEvent.RuntimeError(e.getKind(), e.getMessage(), e.getLineNumber());
		}
	}

	/**
	 * Raises the abort flag. Interpreters check it before every instruction
	 * or resolution step; it may be raised from another thread.
	 */
	public void abort() {
		aborted = true;
	}

	/**
	 * Drops queued events and ends the run with reason {@code ABORTED},
	 * unless it had already ended. Called by the engine once the abort flag
	 * is seen.
	 */
	public void settleAbort() {
		channel.discard();
		pendingLine.setLength(0);
		if (terminalEvent == null) {
			terminalEvent = new ExecutionEvent.Completed(ExecutionEvent.CompletionReason.ABORTED);
		}
	}
}
