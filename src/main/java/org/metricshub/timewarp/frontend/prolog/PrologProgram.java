package org.metricshub.timewarp.frontend.prolog;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.timewarp.LanguageKind;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.jrt.prolog.Term;

/**
 * A parsed TW Prolog program: the clause database keyed by
 * {@code name/arity}, clauses in source order, and the goals to run.
 */
public class PrologProgram extends Program {

	private static final long serialVersionUID = 1L;

	private final Map<String, List<Clause>> database;
	private final List<Term> goals;

	PrologProgram(String sourceDescription, Map<String, List<Clause>> database, List<Term> goals) {
		super(LanguageKind.PROLOG, sourceDescription);
		Map<String, List<Clause>> copy = new LinkedHashMap<String, List<Clause>>();
		for (Map.Entry<String, List<Clause>> entry : database.entrySet()) {
			copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<Clause>(entry.getValue())));
		}
		this.database = Collections.unmodifiableMap(copy);
		this.goals = Collections.unmodifiableList(goals);
	}

	/**
	 * @param key {@code name/arity}
	 * @return the clauses of the predicate, or {@code null} when it has none
	 */
	public List<Clause> getClauses(String key) {
		return database.get(key);
	}

	public Set<String> getPredicates() {
		return database.keySet();
	}

	/**
	 * @return the {@code ?-} and {@code :-} directives and the {@code goal}
	 *         section, in source order
	 */
	public List<Term> getGoals() {
		return goals;
	}
}
