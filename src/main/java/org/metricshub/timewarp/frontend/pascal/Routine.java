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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.timewarp.intermediate.Address;

/**
 * A procedure or function: its parameters, the types of all its slots
 * (parameters first, then locals and compiler temporaries), its entry
 * point and, for a function, its result type.
 */
public class Routine implements Serializable {

	private static final long serialVersionUID = 1L;

	/** A formal parameter. */
	public static final class Parameter implements Serializable {

		private static final long serialVersionUID = 1L;

		private final String name;
		private final PascalType type;
		private final boolean byReference;

		Parameter(String name, PascalType type, boolean byReference) {
			this.name = name;
			this.type = type;
			this.byReference = byReference;
		}

		public String getName() {
			return name;
		}

		public PascalType getType() {
			return type;
		}

		/**
		 * @return {@code true} for a {@code var} parameter
		 */
		public boolean isByReference() {
			return byReference;
		}
	}

	private final String name;
	private final int index;
	private final List<Parameter> parameters = new ArrayList<Parameter>();
	private final List<PascalType> slotTypes = new ArrayList<PascalType>();
	private final List<String> slotNames = new ArrayList<String>();
	private final Address entry;
	private PascalType resultType;

	Routine(String name, int index, Address entry) {
		this.name = name;
		this.index = index;
		this.entry = entry;
	}

	public String getName() {
		return name;
	}

	public int getIndex() {
		return index;
	}

	public List<Parameter> getParameters() {
		return Collections.unmodifiableList(parameters);
	}

	public List<PascalType> getSlotTypes() {
		return Collections.unmodifiableList(slotTypes);
	}

	public String getSlotName(int slot) {
		return slotNames.get(slot);
	}

	public Address getEntry() {
		return entry;
	}

	/**
	 * @return the result type, or {@code null} for a procedure
	 */
	public PascalType getResultType() {
		return resultType;
	}

	public boolean isFunction() {
		return resultType != null;
	}

	void setResultType(PascalType resultType) {
		this.resultType = resultType;
	}

	int addParameter(String parameterName, PascalType type, boolean byReference) {
		parameters.add(new Parameter(parameterName, type, byReference));
		return addSlot(parameterName, type);
	}

	int addSlot(String slotName, PascalType type) {
		slotTypes.add(type);
		slotNames.add(slotName);
		return slotTypes.size() - 1;
	}
}
