package org.metricshub.timewarp.frontend.pascal;

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

import java.util.Collections;
import java.util.List;
import org.metricshub.timewarp.LanguageKind;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.intermediate.TupleProgram;

/**
 * A compiled TW Pascal program: instruction tuples, the routine table and
 * the global slots. Execution starts at the first tuple, which jumps over
 * the routine bodies to the main block.
 */
public class PascalProgram extends Program {

	private static final long serialVersionUID = 1L;

	private final String name;
	private final TupleProgram tuples;
	private final List<Routine> routines;
	private final List<PascalType> globalTypes;
	private final List<String> globalNames;

	PascalProgram(
			String sourceDescription,
			String name,
			TupleProgram tuples,
			List<Routine> routines,
			List<PascalType> globalTypes,
			List<String> globalNames) {
		super(LanguageKind.PASCAL, sourceDescription);
		this.name = name;
		this.tuples = tuples;
		this.routines = Collections.unmodifiableList(routines);
		this.globalTypes = Collections.unmodifiableList(globalTypes);
		this.globalNames = Collections.unmodifiableList(globalNames);
	}

	/**
	 * @return the name in the {@code program} header, or {@code null}
	 */
	public String getName() {
		return name;
	}

	public TupleProgram getTuples() {
		return tuples;
	}

	public List<Routine> getRoutines() {
		return routines;
	}

	public List<PascalType> getGlobalTypes() {
		return globalTypes;
	}

	public String getGlobalName(int slot) {
		return globalNames.get(slot);
	}
}
