package org.metricshub.timewarp.frontend.pascal;

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
import java.util.ArrayList;
import java.util.List;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;

/**
 * Declared type of a Pascal variable, parameter or function result.
 * Assignments go through {@link #coerce(Value, String)}, which is where
 * Pascal's static typing is enforced at run time.
 */
public final class PascalType implements Serializable {

	private static final long serialVersionUID = 1L;

	public enum Kind {
		INTEGER,
		REAL,
		STRING,
		CHAR,
		BOOLEAN,
		ARRAY,
		/** Compiler temporaries, which accept any value. */
		ANY
	}

	public static final PascalType INTEGER = new PascalType(Kind.INTEGER, null, 0);
	public static final PascalType REAL = new PascalType(Kind.REAL, null, 0);
	public static final PascalType STRING = new PascalType(Kind.STRING, null, 0);
	public static final PascalType CHAR = new PascalType(Kind.CHAR, null, 0);
	public static final PascalType BOOLEAN = new PascalType(Kind.BOOLEAN, null, 0);
	public static final PascalType ANY = new PascalType(Kind.ANY, null, 0);

	private final Kind kind;
	private final PascalType elementType;
	private final int length;

	private PascalType(Kind kind, PascalType elementType, int length) {
		this.kind = kind;
		this.elementType = elementType;
		this.length = length;
	}

	/**
	 * @param elementType type of the elements
	 * @param upperBound highest index; the lowest one is always 0
	 * @return {@code array[0..upperBound] of elementType}
	 */
	public static PascalType arrayOf(PascalType elementType, int upperBound) {
		return new PascalType(Kind.ARRAY, elementType, upperBound + 1);
	}

	public Kind getKind() {
		return kind;
	}

	public PascalType getElementType() {
		return elementType;
	}

	/**
	 * @return number of elements of an array type
	 */
	public int getLength() {
		return length;
	}

	public boolean isArray() {
		return kind == Kind.ARRAY;
	}

	/**
	 * @return the value of a variable that was never assigned
	 */
	public Value defaultValue() {
		switch (kind) {
		case INTEGER:
		case REAL:
		case ANY:
			return Value.ZERO;
		case STRING:
		case CHAR:
			return Value.EMPTY_TEXT;
		case BOOLEAN:
			return Value.FALSE;
		case ARRAY:
			List<Value> elements = new ArrayList<Value>(length);
			for (int i = 0; i < length; i++) {
				elements.add(elementType.defaultValue());
			}
			return Value.list(elements);
		default:
			throw new IllegalStateException("Unknown type " + kind);
		}
	}

	/**
	 * Checks that a value may be stored in a variable of this type.
	 *
	 * @param value the value
	 * @param target name of the variable, for the error message
	 * @return the value to store
	 * @throws TwRuntimeException of kind {@code TYPE_MISMATCH}
	 */
	public Value coerce(Value value, String target) {
		boolean ok;
		switch (kind) {
		case INTEGER:
			ok = value.isNumber() && Value.isIntegral(value.asNumber());
			break;
		case REAL:
			ok = value.isNumber();
			break;
		case STRING:
			ok = value.isText();
			break;
		case CHAR:
			ok = value.isText() && value.asText().length() == 1;
			break;
		case BOOLEAN:
			ok = value.isBoolean();
			break;
		case ARRAY:
			ok = value.isList() && value.size() == length;
			break;
		default:
			ok = true;
		}
		if (!ok) {
			throw new TwRuntimeException(
					RuntimeErrorKind.TYPE_MISMATCH,
					"Cannot assign " + value.describe() + " to " + this + " " + target);
		}
		return value;
	}

	@Override
	public String toString() {
		if (kind == Kind.ARRAY) {
			return "array[0.." + (length - 1) + "] of " + elementType;
		}
		return kind.name().toLowerCase();
	}
}
