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

import java.io.Serializable;
import java.util.Map;

/**
 * A Prolog term. Terms are immutable apart from the binding of a
 * {@link Variable}, which only the {@link Bindings} trail changes.
 */
public abstract class Term implements Serializable {

	private static final long serialVersionUID = 1L;

	/**
	 * @return the term this one stands for once variable bindings are followed
	 */
	public Term deref() {
		return this;
	}

	/**
	 * Copies the term with fresh variables. Variables that occur several
	 * times are replaced by the same fresh variable.
	 *
	 * @param renaming variables already replaced, updated by this call
	 * @return the copy
	 */
	public abstract Term copy(Map<Variable, Variable> renaming);

	/**
	 * Copies the term with its current bindings substituted, leaving unbound
	 * variables in place.
	 *
	 * @return the resolved term
	 */
	public abstract Term resolve();

	/**
	 * Structural identity ({@code ==}): variables are only identical to
	 * themselves.
	 *
	 * @param other another term
	 * @return whether both terms are identical
	 */
	public abstract boolean identical(Term other);

	@Override
	public String toString() {
		return TermWriter.format(this);
	}
}
