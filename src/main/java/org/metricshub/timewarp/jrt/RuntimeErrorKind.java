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
 * Categories of fatal runtime errors. The host receives the kind with
 * every {@code RuntimeError} event so that it can decide how to present it.
 */
public enum RuntimeErrorKind {
	/** A variable was read before anything was assigned to it. */
	UNDEFINED_VARIABLE,
	/** {@code GOTO}/{@code GOSUB}/{@code J:} to a line or label that does not exist. */
	UNDEFINED_LINE,
	/** A Prolog goal refers to a predicate with no clauses and no built-in. */
	UNDEFINED_PREDICATE,
	/** An operation received a value of the wrong tag. */
	TYPE_MISMATCH,
	DIVISION_BY_ZERO,
	INDEX_OUT_OF_RANGE,
	/** A Pascal function returned without assigning its result. */
	MISSING_RESULT,
	RETURN_WITHOUT_GOSUB,
	NEXT_WITHOUT_FOR,
	/** A Prolog built-in needed a bound argument and got a variable. */
	INSTANTIATION,
	STACK_OVERFLOW,
	/** The configured instruction budget was exhausted. */
	STEP_LIMIT,
	ILLEGAL_ARGUMENT
}
