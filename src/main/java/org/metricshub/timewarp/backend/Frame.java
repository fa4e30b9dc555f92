package org.metricshub.timewarp.backend;

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

import org.metricshub.timewarp.frontend.pascal.Routine;
import org.metricshub.timewarp.jrt.Value;

/**
 * Activation of a Pascal routine.
 */
final class Frame {

	private final Routine routine;
	private final Reference[] slots;
	private final int returnAddress;
	private Value result;

	Frame(Routine routine, Reference[] slots, int returnAddress) {
		this.routine = routine;
		this.slots = slots;
		this.returnAddress = returnAddress;
	}

	Routine getRoutine() {
		return routine;
	}

	Reference getSlot(int slot) {
		return slots[slot];
	}

	int getReturnAddress() {
		return returnAddress;
	}

	/**
	 * @return the assigned function result, or {@code null}
	 */
	Value getResult() {
		return result;
	}

	void setResult(Value result) {
		this.result = result;
	}
}
