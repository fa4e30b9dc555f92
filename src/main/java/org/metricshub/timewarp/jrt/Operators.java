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
 * Arithmetic, comparison and conversion helpers on {@link Value}s, shared by
 * the BASIC and Pascal instruction interpreters and by the Prolog
 * arithmetic evaluator.
 * <p>
 * All numbers are IEEE-754 doubles. Integer division and modulo operate on
 * the truncated operands.
 */
public final class Operators {

	private Operators() {}

	/**
	 * {@code +}: numeric addition, or concatenation when both sides are text.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @return the sum or the concatenation
	 */
	public static Value add(Value left, Value right) {
		if (left.isText() && right.isText()) {
			return Value.text(left.asText() + right.asText());
		}
		if (left.isText() || right.isText()) {
			throw new TwRuntimeException(
					RuntimeErrorKind.TYPE_MISMATCH,
					"Cannot add " + left.describe() + " and " + right.describe());
		}
		return Value.number(left.asNumber() + right.asNumber());
	}

	public static Value subtract(Value left, Value right) {
		return Value.number(left.asNumber() - right.asNumber());
	}

	public static Value multiply(Value left, Value right) {
		return Value.number(left.asNumber() * right.asNumber());
	}

	public static Value divide(Value left, Value right) {
		double divisor = right.asNumber();
		double dividend = left.asNumber();
		if (divisor == 0d) {
			throw new TwRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Division by zero");
		}
		return Value.number(dividend / divisor);
	}

	/**
	 * Truncating integer division ({@code div}, {@code //}).
	 *
	 * @param left dividend
	 * @param right divisor
	 * @return the truncated quotient
	 */
	public static Value intDivide(Value left, Value right) {
		long divisor = toLong(right);
		long dividend = toLong(left);
		if (divisor == 0L) {
			throw new TwRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Division by zero");
		}
		return Value.number(dividend / divisor);
	}

	/**
	 * Remainder of the truncated operands; the sign follows the dividend.
	 *
	 * @param left dividend
	 * @param right divisor
	 * @return the remainder
	 */
	public static Value modulo(Value left, Value right) {
		long divisor = toLong(right);
		long dividend = toLong(left);
		if (divisor == 0L) {
			throw new TwRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Division by zero");
		}
		return Value.number(dividend % divisor);
	}

	public static Value power(Value left, Value right) {
		return Value.number(Math.pow(left.asNumber(), right.asNumber()));
	}

	public static Value negate(Value operand) {
		return Value.number(-operand.asNumber());
	}

	/**
	 * Logical negation of a boolean, or of a number's truth value.
	 *
	 * @param operand the value
	 * @return the negation
	 */
	public static Value not(Value operand) {
		return Value.bool(!operand.isTrue());
	}

	public static Value and(Value left, Value right) {
		return Value.bool(left.isTrue() && right.isTrue());
	}

	public static Value or(Value left, Value right) {
		return Value.bool(left.isTrue() || right.isTrue());
	}

	/**
	 * Orders two numbers or two texts.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @return negative, zero or positive
	 */
	public static int compare(Value left, Value right) {
		if (left.isNumber() && right.isNumber()) {
			return Double.compare(left.asNumber(), right.asNumber());
		}
		if (left.isText() && right.isText()) {
			return left.asText().compareTo(right.asText());
		}
		if (left.isBoolean() && right.isBoolean()) {
			return Boolean.compare(left.asBoolean(), right.asBoolean());
		}
		throw new TwRuntimeException(
				RuntimeErrorKind.TYPE_MISMATCH,
				"Cannot compare " + left.describe() + " with " + right.describe());
	}

	/**
	 * Equality as seen by {@code =} and {@code <>}; mixing a number with a
	 * text is a type error rather than {@code false}.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @return whether both values are equal
	 */
	public static boolean equal(Value left, Value right) {
		if (left.getType() != right.getType()) {
			throw new TwRuntimeException(
					RuntimeErrorKind.TYPE_MISMATCH,
					"Cannot compare " + left.describe() + " with " + right.describe());
		}
		return left.equals(right);
	}

	/**
	 * Converts a number to a Java index, rejecting fractional values.
	 *
	 * @param value numeric value
	 * @return the integral value
	 */
	public static int toIndex(Value value) {
		double d = value.asNumber();
		if (!Value.isIntegral(d)) {
			throw new TwRuntimeException(
					RuntimeErrorKind.INDEX_OUT_OF_RANGE,
					"Index must be a whole number, got " + Value.formatNumber(d));
		}
		return (int) d;
	}

	public static long toLong(Value value) {
		double d = value.asNumber();
		return (long) d;
	}

	/**
	 * Parses user input as a number.
	 *
	 * @param text raw input
	 * @return the number, or {@code null} when the text is not numeric
	 */
	public static Double parseNumber(String text) {
		String trimmed = text == null ? "" : text.trim();
		if (trimmed.isEmpty()) {
			return null;
		}
		try {
			double d = Double.parseDouble(trimmed);
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return null;
			}
			// reject Java-only forms such as "1d" or "0x1p3"
			for (int i = 0; i < trimmed.length(); i++) {
				char c = trimmed.charAt(i);
				if (!(Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E')) {
					return null;
				}
			}
			return d;
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
