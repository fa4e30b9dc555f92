package org.metricshub.timewarp.frontend;

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
 * Malformed program text. Carries the position the host needs to mark the
 * error in its editor buffer: line and column (both 1-based) and a message.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String reason;
	private final String sourceDescription;
	private final int line;
	private final int column;

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param reason what is wrong, without position
	 * @param sourceDescription name of the source (file name or editor buffer)
	 * @param line 1-based line
	 * @param column 1-based column
	 */
	public ParserException(String reason, String sourceDescription, int line, int column) {
		super(reason + " (" + sourceDescription + ", line " + line + ", column " + column + ")");
		this.reason = reason;
		this.sourceDescription = sourceDescription;
		this.line = line;
		this.column = column;
	}

	/**
	 * @return the message without position information
	 */
	public String getReason() {
		return reason;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}
}
