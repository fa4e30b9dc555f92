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
import org.metricshub.timewarp.jrt.Value;

/**
 * A variable slot.
 */
final class Cell implements Reference {

	private final String name;
	private final PascalType type;
	private Value value;

	Cell(String name, PascalType type) {
		this.name = name;
		this.type = type;
		this.value = type.defaultValue();
	}

	@Override
	public Value get() {
		return value;
	}

	@Override
	public void set(Value newValue) {
		value = type.coerce(newValue, name);
	}

	@Override
	public PascalType getType() {
		return type;
	}

	@Override
	public String getName() {
		return name;
	}
}
