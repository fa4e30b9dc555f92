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

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable tagged runtime value: a number, a text, a boolean or an ordered
 * list of values.
 * <p>
 * Every interpreter stores variables as {@code Value}s and replaces them
 * wholesale on assignment; lists (BASIC {@code DIM} arrays, Pascal arrays)
 * are updated by building a new list through {@link #with(int, Value)}.
 * Accessors check the tag and throw a {@link TwRuntimeException} of kind
 * {@link RuntimeErrorKind#TYPE_MISMATCH} when it does not match.
 */
public final class Value implements Serializable {

	private static final long serialVersionUID = 1L;

	/** Significant digits used when rendering non-integral numbers. */
	private static final MathContext DISPLAY_PRECISION = new MathContext(15);

	public static final Value TRUE = new Value(ValueType.BOOLEAN, 0d, null, true, null);
	public static final Value FALSE = new Value(ValueType.BOOLEAN, 0d, null, false, null);
	public static final Value ZERO = new Value(ValueType.NUMBER, 0d, null, false, null);
	public static final Value ONE = new Value(ValueType.NUMBER, 1d, null, false, null);
	public static final Value EMPTY_TEXT = new Value(ValueType.TEXT, 0d, "", false, null);

	private final ValueType type;
	private final double number;
	private final String text;
	private final boolean bool;
	private final List<Value> items;

	private Value(ValueType type, double number, String text, boolean bool, List<Value> items) {
		this.type = type;
		this.number = number;
		this.text = text;
		this.bool = bool;
		this.items = items;
	}

	public static Value number(double d) {
		if (d == 0d && Double.doubleToRawLongBits(d) == 0L) {
			return ZERO;
		}
		return new Value(ValueType.NUMBER, d, null, false, null);
	}

	public static Value text(String s) {
		if (s == null) {
			throw new IllegalArgumentException("Text value must not be null");
		}
		return s.isEmpty() ? EMPTY_TEXT : new Value(ValueType.TEXT, 0d, s, false, null);
	}

	public static Value bool(boolean b) {
		return b ? TRUE : FALSE;
	}

	/**
	 * Creates a list value holding a copy of the given elements.
	 *
	 * @param elements list elements, none of them {@code null}
	 * @return an immutable list value
	 */
	public static Value list(List<Value> elements) {
		for (Value element : elements) {
			if (element == null) {
				throw new IllegalArgumentException("List elements must not be null");
			}
		}
		return new Value(ValueType.LIST, 0d, null, false,
				Collections.unmodifiableList(new ArrayList<Value>(elements)));
	}

	/**
	 * Creates a list of {@code size} copies of {@code initial}.
	 *
	 * @param size number of elements
	 * @param initial value of every element
	 * @return an immutable list value
	 */
	public static Value filledList(int size, Value initial) {
		return list(Collections.nCopies(size, initial));
	}

	public ValueType getType() {
		return type;
	}

	public boolean isNumber() {
		return type == ValueType.NUMBER;
	}

	public boolean isText() {
		return type == ValueType.TEXT;
	}

	public boolean isBoolean() {
		return type == ValueType.BOOLEAN;
	}

	public boolean isList() {
		return type == ValueType.LIST;
	}

	public double asNumber() {
		if (type != ValueType.NUMBER) {
			throw mismatch(ValueType.NUMBER);
		}
		return number;
	}

	public String asText() {
		if (type != ValueType.TEXT) {
			throw mismatch(ValueType.TEXT);
		}
		return text;
	}

	public boolean asBoolean() {
		if (type != ValueType.BOOLEAN) {
			throw mismatch(ValueType.BOOLEAN);
		}
		return bool;
	}

	public List<Value> asList() {
		if (type != ValueType.LIST) {
			throw mismatch(ValueType.LIST);
		}
		return items;
	}

	/**
	 * Truth value used by conditional statements: booleans as they are,
	 * numbers are true when non-zero.
	 *
	 * @return the condition value
	 */
	public boolean isTrue() {
		switch (type) {
		case BOOLEAN:
			return bool;
		case NUMBER:
			return number != 0d;
		default:
			throw new TwRuntimeException(
					RuntimeErrorKind.TYPE_MISMATCH,
					"Condition must be a boolean or a number, got " + describe());
		}
	}

	public int size() {
		return asList().size();
	}

	/**
	 * Returns the element at {@code index}.
	 *
	 * @param index zero-based position
	 * @return the element
	 */
	public Value get(int index) {
		List<Value> list = asList();
		checkIndex(index, list.size());
		return list.get(index);
	}

	/**
	 * Returns a new list equal to this one except at {@code index}.
	 *
	 * @param index zero-based position
	 * @param element replacement element
	 * @return the updated copy
	 */
	public Value with(int index, Value element) {
		List<Value> list = asList();
		checkIndex(index, list.size());
		List<Value> copy = new ArrayList<Value>(list);
		copy.set(index, element);
		return new Value(ValueType.LIST, 0d, null, false, Collections.unmodifiableList(copy));
	}

	private static void checkIndex(int index, int size) {
		if (index < 0 || index >= size) {
			throw new TwRuntimeException(
					RuntimeErrorKind.INDEX_OUT_OF_RANGE,
					"Index " + index + " out of range 0.." + (size - 1));
		}
	}

	private TwRuntimeException mismatch(ValueType expected) {
		return new TwRuntimeException(
				RuntimeErrorKind.TYPE_MISMATCH,
				"Expected " + expected.name().toLowerCase() + " but got " + describe());
	}

	/**
	 * @return a short description such as {@code number 3} for error messages
	 */
	public String describe() {
		if (type == ValueType.TEXT) {
			return "text \"" + text + "\"";
		}
		return type.name().toLowerCase() + " " + format();
	}

	/**
	 * Renders the value the way {@code PRINT}, {@code writeln} and
	 * {@code write/1} show it.
	 *
	 * @return display text
	 */
	public String format() {
		switch (type) {
		case NUMBER:
			return formatNumber(number);
		case TEXT:
			return text;
		case BOOLEAN:
			return bool ? "TRUE" : "FALSE";
		default:
			StringBuilder sb = new StringBuilder("[");
			for (int i = 0; i < items.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(items.get(i).format());
			}
			return sb.append(']').toString();
		}
	}

	/**
	 * Formats a number: integral values without a fractional part, other
	 * values with up to 15 significant digits and no trailing zeros.
	 *
	 * @param d the number
	 * @return display text
	 */
	public static String formatNumber(double d) {
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			return Double.toString(d);
		}
		if (d == Math.rint(d) && Math.abs(d) < 1e15) {
			return Long.toString((long) d);
		}
		BigDecimal rounded = new BigDecimal(d).round(DISPLAY_PRECISION).stripTrailingZeros();
		if (Math.abs(d) >= 1e15 || Math.abs(d) < 1e-6) {
			return rounded.toString();
		}
		return rounded.toPlainString();
	}

	/**
	 * @return {@code true} when {@code d} holds an integral value
	 */
	public static boolean isIntegral(double d) {
		return !Double.isInfinite(d) && d == Math.rint(d);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Value)) {
			return false;
		}
		Value other = (Value) obj;
		if (type != other.type) {
			return false;
		}
		switch (type) {
		case NUMBER:
			return Double.compare(number, other.number) == 0 || number == other.number;
		case TEXT:
			return text.equals(other.text);
		case BOOLEAN:
			return bool == other.bool;
		default:
			return items.equals(other.items);
		}
	}

	@Override
	public int hashCode() {
		switch (type) {
		case NUMBER:
			return Double.hashCode(number == 0d ? 0d : number);
		case TEXT:
			return text.hashCode();
		case BOOLEAN:
			return Boolean.hashCode(bool);
		default:
			return items.hashCode();
		}
	}

	@Override
	public String toString() {
		return describe();
	}
}
