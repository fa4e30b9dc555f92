package org.metricshub.timewarp.intermediate;

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
import java.util.Arrays;
import org.metricshub.timewarp.jrt.Value;

/**
 * Represents a single opcode and its arguments within the tuple stream produced
 * by {@link TupleProgram}. While {@code TupleProgram} manages the list of
 * tuples, this class models one instruction, its operands and the source line
 * it was compiled from.
 *
 * @see TupleProgram
 */
public class Tuple implements Serializable {

	private static final long serialVersionUID = 1L;

	private final Opcode opcode;
	private final Object[] args;
	private final Address address;
	private final int lineno;

	Tuple(Opcode opcode, Address address, int lineno, Object... args) {
		this.opcode = opcode;
		this.address = address;
		this.lineno = lineno;
		this.args = args;
	}

	public Opcode getOpcode() {
		return opcode;
	}

	/**
	 * @return the jump target, or {@code null} for instructions that do not jump
	 */
	public Address getAddress() {
		return address;
	}

	/**
	 * @return the source line (BASIC line number when the line has one)
	 */
	public int getLineNumber() {
		return lineno;
	}

	public int getArgCount() {
		return args.length;
	}

	public Object getArg(int index) {
		return args[index];
	}

	public String getString(int index) {
		return (String) args[index];
	}

	public int getInt(int index) {
		return ((Integer) args[index]).intValue();
	}

	public boolean getBoolean(int index) {
		return ((Boolean) args[index]).booleanValue();
	}

	public Value getValue(int index) {
		return (Value) args[index];
	}

	void touch(int size) {
		if (address != null) {
			if (address.index() == -1) {
				throw new IllegalStateException("address " + address + " is unresolved");
			}
			if (address.index() > size) {
				throw new IllegalStateException("address " + address + " doesn't resolve to an actual list element");
			}
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(opcode.name());
		if (address != null) {
			sb.append(", ").append(address);
		}
		for (Object arg : args) {
			sb.append(", ");
			if (arg instanceof String) {
				sb.append('"').append(arg).append('"');
			} else if (arg instanceof int[]) {
				sb.append(Arrays.toString((int[]) arg));
			} else {
				sb.append(arg);
			}
		}
		return sb.toString();
	}
}
