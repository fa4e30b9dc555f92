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

import org.metricshub.timewarp.frontend.pascal.PascalType;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;

/**
 * One element of an array variable. The index is checked when the
 * reference is created.
 */
final class ElementReference implements Reference {

	private final Reference array;
	private final int index;

	ElementReference(Reference array, int index) {
		checkIndex(array, index);
		this.array = array;
		this.index = index;
	}

	static void checkIndex(Reference array, int index) {
		int length = array.getType().getLength();
		if (index < 0 || index >= length) {
			throw new TwRuntimeException(
					RuntimeErrorKind.INDEX_OUT_OF_RANGE,
					"Index " + index + " out of range 0.." + (length - 1) + " for " + array.getName());
		}
	}

	@Override
	public Value get() {
		return array.get().get(index);
	}

	@Override
	public void set(Value value) {
		Value element = getType().coerce(value, getName());
		array.set(array.get().with(index, element));
	}

	@Override
	public PascalType getType() {
		return array.getType().getElementType();
	}

	@Override
	public String getName() {
		return array.getName() + "[" + index + "]";
	}
}
