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
import java.util.concurrent.atomic.AtomicLong;

/**
 * A logic variable. Its binding is changed only through {@link Bindings},
 * which records it so it can be undone on backtracking.
 */
public final class Variable extends Term {

	private static final long serialVersionUID = 1L;

	private static final AtomicLong COUNTER = new AtomicLong();

	private final String name;
	private final long id;
	private Term binding;

	/**
	 * @param name name in the source text, or {@code null} for a fresh variable
	 */
	public Variable(String name) {
		this.name = name;
		this.id = COUNTER.incrementAndGet();
	}

	public String getName() {
		return name;
	}

	public long getId() {
		return id;
	}

	public boolean isBound() {
		return binding != null;
	}

	void bind(Term term) {
		binding = term;
	}

	void unbind() {
		binding = null;
	}

	@Override
	public Term deref() {
		Term t = this;
		while (t instanceof Variable && ((Variable) t).binding != null) {
			t = ((Variable) t).binding;
		}
		return t;
	}

	@Override
	public Term copy(Map<Variable, Variable> renaming) {
		Term t = deref();
		if (t != this) {
			return t.copy(renaming);
		}
		Variable fresh = renaming.get(this);
		if (fresh == null) {
			fresh = new Variable(name);
			renaming.put(this, fresh);
		}
		return fresh;
	}

	@Override
	public Term resolve() {
		Term t = deref();
		return t == this ? this : t.resolve();
	}

	@Override
	public boolean identical(Term other) {
		Term t = deref();
		if (t != this) {
			return t.identical(other);
		}
		return other.deref() == this;
	}
}
