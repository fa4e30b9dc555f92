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

import java.io.PrintStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.timewarp.jrt.Value;

/**
 * The instruction list produced by the BASIC and Pascal parsers.
 * <p>
 * Parsers append tuples in order, create forward {@link Address}es for jumps
 * and resolve them once the target position is known. The current source
 * line set through {@link #setSourceLineNumber(int)} is stamped on every
 * tuple added afterwards so that runtime errors can be reported against the
 * program text. Once {@link #postProcess()} has run, the list is never
 * modified again.
 */
public class TupleProgram implements Serializable {

	private static final long serialVersionUID = 1L;

	private final AddressManager addressManager = new AddressManager();

	private final List<Tuple> queue = new ArrayList<Tuple>(100);

	/** Reverse index used by {@link #dump(PrintStream)}. */
	private final Map<Integer, Address> addressesByIndex = new HashMap<Integer, Address>();

	private int lineno = -1;

	private boolean postProcessed;

	/**
	 * Sets the source line of the tuples added from now on.
	 *
	 * @param lineno The current source line number.
	 */
	public void setSourceLineNumber(int lineno) {
		this.lineno = lineno;
	}

	public int getSourceLineNumber() {
		return lineno;
	}

	/**
	 * Appends an instruction.
	 *
	 * @param opcode the instruction
	 * @param args its arguments
	 * @return the index of the new tuple
	 */
	public int add(Opcode opcode, Object... args) {
		return append(new Tuple(opcode, null, lineno, args));
	}

	/**
	 * Appends a jumping instruction.
	 *
	 * @param opcode the instruction
	 * @param address where it jumps
	 * @param args other arguments
	 * @return the index of the new tuple
	 */
	public int addJump(Opcode opcode, Address address, Object... args) {
		return append(new Tuple(opcode, address, lineno, args));
	}

	private int append(Tuple tuple) {
		if (postProcessed) {
			throw new IllegalStateException("The program is already complete");
		}
		queue.add(tuple);
		return queue.size() - 1;
	}

	public void push(Value value) {
		add(Opcode.PUSH, value);
	}

	public void gotoAddress(Address address) {
		addJump(Opcode.GOTO, address);
	}

	public void ifFalse(Address address) {
		addJump(Opcode.IFFALSE, address);
	}

	public void ifTrue(Address address) {
		addJump(Opcode.IFTRUE, address);
	}

	/**
	 * Creates an unresolved address.
	 *
	 * @param label name used in dumps
	 * @return the new address
	 */
	public Address createAddress(String label) {
		return addressManager.createAddress(label);
	}

	/**
	 * Resolves an address to the position of the next tuple to be added.
	 *
	 * @param address the address to resolve
	 * @return this program
	 */
	public TupleProgram address(Address address) {
		addressManager.resolveAddress(address, queue.size());
		addressesByIndex.put(queue.size(), address);
		return this;
	}

	/**
	 * @return the index the next tuple will get
	 */
	public int nextIndex() {
		return queue.size();
	}

	public int size() {
		return queue.size();
	}

	public Tuple get(int index) {
		return queue.get(index);
	}

	/**
	 * Executed after all tuples are entered in the queue. Checks that every
	 * address was resolved to a position within the list (or just past its
	 * end), and freezes the program.
	 */
	public void postProcess() {
		if (postProcessed) {
			return;
		}
		if (!addressManager.getUnresolvedAddresses().isEmpty()) {
			throw new IllegalStateException("Unresolved addresses: " + addressManager.getUnresolvedAddresses());
		}
		for (Tuple tuple : queue) {
			tuple.touch(queue.size());
		}
		postProcessed = true;
	}

	/**
	 * Dumps the queued tuples to the provided {@link PrintStream}.
	 *
	 * @param ps destination stream for the tuple listing
	 */
	public void dump(PrintStream ps) {
		for (int i = 0; i < queue.size(); i++) {
			Address address = addressesByIndex.get(i);
			if (address == null) {
				ps.println(i + " : " + queue.get(i));
			} else {
				ps.println(i + " : [" + address + "] : " + queue.get(i));
			}
		}
	}
}
