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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import org.metricshub.timewarp.jrt.prolog.Atom;
import org.metricshub.timewarp.jrt.prolog.Struct;
import org.metricshub.timewarp.jrt.prolog.Term;
import org.metricshub.timewarp.jrt.prolog.Variable;

/**
 * Solutions gathered by a running {@code findall/3}.
 */
final class Findall {

	private final Term template;
	private final Term result;
	private final List<Term> solutions = new ArrayList<Term>();

	Findall(Term template, Term result) {
		this.template = template;
		this.result = result;
	}

	/**
	 * Stores a copy of the template as bound now.
	 */
	void collect() {
		solutions.add(template.resolve().copy(new HashMap<Variable, Variable>()));
	}

	Term getResult() {
		return result;
	}

	Term toList() {
		return Struct.list(solutions, Atom.NIL);
	}
}
