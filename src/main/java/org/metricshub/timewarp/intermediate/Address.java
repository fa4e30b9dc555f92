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

/**
 * Jump target inside a {@link TupleProgram}: a branch of a conditional, the
 * start or exit of a loop, a skipped PILOT statement, or a Pascal routine
 * entry. BASIC line numbers and labels are looked up by the program
 * instead. The parser creates the address when it first needs to jump to
 * it and resolves it to a tuple index once it reaches the target;
 * {@link TupleProgram#postProcess()} rejects any address left unresolved.
 */
public class Address implements java.io.Serializable {

	private static final long serialVersionUID = 1L;

	private final String label;
	private int index = -1;

	Address(String label) {
		this.label = label;
	}

	/**
	 * @return the unique label, such as {@code endwhile_2}
	 */
	public String label() {
		return label;
	}

	void assignIndex(int tupleIndex) {
		this.index = tupleIndex;
	}

	/**
	 * @return the tuple index to jump to, {@code -1} while unresolved
	 */
	public int index() {
		return index;
	}

	@Override
	public String toString() {
		return index < 0 ? label : label + "@" + index;
	}
}
