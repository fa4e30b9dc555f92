package org.metricshub.timewarp.frontend.basic;

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
import java.util.Map;
import java.util.Set;
import org.metricshub.timewarp.LanguageKind;
import org.metricshub.timewarp.Program;
import org.metricshub.timewarp.intermediate.TupleProgram;

/**
 * A compiled TW BASIC program: the instruction tuples in line order, the
 * line number and {@code *label} indexes used by jumps, and the names of
 * the variables the program mentions.
 */
public class BasicProgram extends Program {

	private static final long serialVersionUID = 1L;

	private final TupleProgram tuples;
	private final Map<Long, Integer> lineIndex;
	private final Map<String, Integer> labelIndex;
	private final Set<String> variableNames;

	BasicProgram(
			String sourceDescription,
			TupleProgram tuples,
			Map<Long, Integer> lineIndex,
			Map<String, Integer> labelIndex,
			Set<String> variableNames) {
		super(LanguageKind.BASIC, sourceDescription);
		this.tuples = tuples;
		this.lineIndex = Collections.unmodifiableMap(lineIndex);
		this.labelIndex = Collections.unmodifiableMap(labelIndex);
		this.variableNames = Collections.unmodifiableSet(variableNames);
	}

	public TupleProgram getTuples() {
		return tuples;
	}

	/**
	 * @param lineNumber a BASIC line number
	 * @return the index of the line's first instruction, or {@code null}
	 *         when the program has no such line
	 */
	public Integer getLineAddress(long lineNumber) {
		return lineIndex.get(lineNumber);
	}

	/**
	 * @param label label name, upper case, without the star
	 * @return the index of the instruction following the label, or {@code null}
	 */
	public Integer getLabelAddress(String label) {
		return labelIndex.get(label);
	}

	public Set<Long> getLineNumbers() {
		return lineIndex.keySet();
	}

	public Set<String> getLabels() {
		return labelIndex.keySet();
	}

	/**
	 * @return upper-case variable names, text variables with their {@code $}
	 */
	public Set<String> getVariableNames() {
		return variableNames;
	}

	/**
	 * @param name variable name
	 * @return whether the variable holds text
	 */
	public static boolean isTextVariable(String name) {
		return name.endsWith("$");
	}
}
