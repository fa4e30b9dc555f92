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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.metricshub.timewarp.frontend.pascal.PascalProgram;
import org.metricshub.timewarp.frontend.pascal.PascalType;
import org.metricshub.timewarp.jrt.Value;
import org.metricshub.timewarp.util.TwSettings;

/**
 * Continuation of a TW Pascal run: global cells, the call stack and the
 * variable a suspended {@code read} stores into.
 */
public class PascalExecutionState extends TupleExecutionState {

	private final Reference[] globals;
	private final Deque<Frame> frames = new ArrayDeque<Frame>();
	private Reference pendingRead;

	PascalExecutionState(PascalProgram program, TwSettings settings) {
		super(program, program.getTuples(), settings);
		List<PascalType> types = program.getGlobalTypes();
		globals = new Reference[types.size()];
		for (int i = 0; i < globals.length; i++) {
			globals[i] = new Cell(program.getGlobalName(i), types.get(i));
		}
	}

	public PascalProgram getPascalProgram() {
		return (PascalProgram) getProgram();
	}

	/**
	 * @param name a global variable name, case-insensitive
	 * @return its current value, or {@code null} when there is no such global
	 */
	public Value getGlobal(String name) {
		for (Reference global : globals) {
			if (global.getName().equalsIgnoreCase(name)) {
				return global.get();
			}
		}
		return null;
	}

	/**
	 * @return number of active routine calls
	 */
	public int getCallDepth() {
		return frames.size();
	}

	Reference slot(int slot, boolean global) {
		return global ? globals[slot] : frames.peek().getSlot(slot);
	}

	Deque<Frame> getFrames() {
		return frames;
	}

	/**
	 * @return the variable the suspended {@code read} stores into, or
	 *         {@code null} for a bare {@code readln}
	 */
	Reference getPendingRead() {
		return pendingRead;
	}

	void setPendingRead(Reference target) {
		this.pendingRead = target;
	}
}
