package org.metricshub.timewarp.jrt;

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

/**
 * A runtime exception thrown by the Time Warp interpreters. It is provided
 * to conveniently distinguish between program errors (which end the run
 * with a {@code RuntimeError} event) and other runtime exceptions (which
 * are bugs).
 */
public class TwRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final RuntimeErrorKind kind;

	private final int lineNumber;

	/**
	 * Creates an exception without source location.
	 *
	 * @param kind category of the error
	 * @param msg a {@link java.lang.String} object
	 */
	public TwRuntimeException(RuntimeErrorKind kind, String msg) {
		this(kind, -1, msg);
	}

	/**
	 * <p>
	 * Constructor for TwRuntimeException.
	 * </p>
	 *
	 * @param kind category of the error
	 * @param lineno source line, or {@code -1} when unknown
	 * @param msg a {@link java.lang.String} object
	 */
	public TwRuntimeException(RuntimeErrorKind kind, int lineno, String msg) {
		super(msg);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	public RuntimeErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Returns a copy of this exception located at the given line, unless a
	 * location is already known.
	 *
	 * @param lineno source line of the instruction being executed
	 * @return this exception when already located, a located copy otherwise
	 */
	public TwRuntimeException atLine(int lineno) {
		if (lineNumber >= 0 || lineno < 0) {
			return this;
		}
		TwRuntimeException located = new TwRuntimeException(kind, lineno, getMessage());
		located.setStackTrace(getStackTrace());
		return located;
	}
}
