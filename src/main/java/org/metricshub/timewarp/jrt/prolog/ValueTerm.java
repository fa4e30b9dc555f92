package org.metricshub.timewarp.jrt.prolog;

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

import java.util.Map;
import org.metricshub.timewarp.jrt.Value;

/**
 * A number or a double-quoted string, carried as a runtime {@link Value}.
 */
public final class ValueTerm extends Term {

	private static final long serialVersionUID = 1L;

	private final Value value;

	public ValueTerm(Value value) {
		this.value = value;
	}

	public static ValueTerm number(double d) {
		return new ValueTerm(Value.number(d));
	}

	public static ValueTerm text(String s) {
		return new ValueTerm(Value.text(s));
	}

	public Value getValue() {
		return value;
	}

	public boolean isNumber() {
		return value.isNumber();
	}

	public boolean isInteger() {
		return value.isNumber() && Value.isIntegral(value.asNumber());
	}

	@Override
	public Term copy(Map<Variable, Variable> renaming) {
		return this;
	}

	@Override
	public Term resolve() {
		return this;
	}

	@Override
	public boolean identical(Term other) {
		Term o = other.deref();
		return o instanceof ValueTerm && ((ValueTerm) o).value.equals(value);
	}
}
