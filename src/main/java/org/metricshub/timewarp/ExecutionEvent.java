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

import org.metricshub.timewarp.jrt.DrawPrimitive;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;

/**
 * One unit of observable progress returned by {@link TimeWarp#step} and
 * {@link TimeWarp#resume}. Events are delivered in the order the program
 * produced them.
 */
public abstract class ExecutionEvent {

	/** Event discriminator, convenient for {@code switch} statements in hosts. */
	public enum Kind {
		OUTPUT,
		DRAW,
		INPUT_REQUESTED,
		COMPLETED,
		RUNTIME_ERROR
	}

	/** Why a run completed. */
	public enum CompletionReason {
		/** Execution went past the last statement. */
		END_OF_PROGRAM,
		/** {@code END}, {@code STOP}, {@code E:}, {@code halt}. */
		HALTED,
		/** A Prolog goal has no more solutions. */
		NO_MORE_SOLUTIONS,
		/** The host called {@link TimeWarp#abort}. */
		ABORTED
	}

	private ExecutionEvent() {}

	public abstract Kind getKind();

	/**
	 * @return {@code true} for events after which the run produces nothing else
	 */
	public boolean isTerminal() {
		return false;
	}

	/**
	 * Text produced by {@code PRINT}, {@code T:}, {@code writeln},
	 * {@code nl}...
	 */
	public static final class Output extends ExecutionEvent {

		private final String text;
		private final boolean lineEnd;

		public Output(String text, boolean lineEnd) {
			this.text = text;
			this.lineEnd = lineEnd;
		}

		@Override
		public Kind getKind() {
			return Kind.OUTPUT;
		}

		public String getText() {
			return text;
		}

		/**
		 * @return whether the host should start a new line after the text
		 */
		public boolean isLineEnd() {
			return lineEnd;
		}

		@Override
		public String toString() {
			return "Output(" + text + (lineEnd ? "" : ", no line end") + ")";
		}
	}

	/** A turtle drawing primitive. */
	public static final class Draw extends ExecutionEvent {

		private final DrawPrimitive primitive;

		public Draw(DrawPrimitive primitive) {
			this.primitive = primitive;
		}

		@Override
		public Kind getKind() {
			return Kind.DRAW;
		}

		public DrawPrimitive getPrimitive() {
			return primitive;
		}

		@Override
		public String toString() {
			return "Draw(" + primitive + ")";
		}
	}

	/**
	 * The program waits for a line of input; answer with
	 * {@link TimeWarp#resume}.
	 */
	public static final class InputRequested extends ExecutionEvent {

		private final String prompt;

		public InputRequested(String prompt) {
			this.prompt = prompt;
		}

		@Override
		public Kind getKind() {
			return Kind.INPUT_REQUESTED;
		}

		/**
		 * @return the prompt, or {@code null} when the program gave none
		 */
		public String getPrompt() {
			return prompt;
		}

		@Override
		public String toString() {
			return "InputRequested(" + (prompt == null ? "" : prompt) + ")";
		}
	}

	/** Normal end of the run. */
	public static final class Completed extends ExecutionEvent {

		private final CompletionReason reason;

		public Completed(CompletionReason reason) {
			this.reason = reason;
		}

		@Override
		public Kind getKind() {
			return Kind.COMPLETED;
		}

		@Override
		public boolean isTerminal() {
			return true;
		}

		public CompletionReason getReason() {
			return reason;
		}

		@Override
		public String toString() {
			return "Completed(" + reason + ")";
		}
	}

	/** Fatal runtime error; output emitted before it stays valid. */
	public static final class RuntimeError extends ExecutionEvent {

		private final RuntimeErrorKind errorKind;
		private final String message;
		private final int lineNumber;

		public RuntimeError(RuntimeErrorKind errorKind, String message, int lineNumber) {
			this.errorKind = errorKind;
			this.message = message;
			this.lineNumber = lineNumber;
		}

		@Override
		public Kind getKind() {
			return Kind.RUNTIME_ERROR;
		}

		@Override
		public boolean isTerminal() {
			return true;
		}

		public RuntimeErrorKind getErrorKind() {
			return errorKind;
		}

		public String getMessage() {
			return message;
		}

		/**
		 * @return source line of the failing statement, or {@code -1}
		 */
		public int getLineNumber() {
			return lineNumber;
		}

		@Override
		public String toString() {
			return "RuntimeError(" + errorKind + ", " + message
					+ (lineNumber >= 0 ? ", line " + lineNumber : "") + ")";
		}
	}
}
