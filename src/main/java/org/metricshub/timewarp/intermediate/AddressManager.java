package org.metricshub.timewarp.intermediate;

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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Manages creation and resolution of {@link Address} instances for
 * {@link TupleProgram}.
 */
class AddressManager implements Serializable {

	private static final long serialVersionUID = 1L;

	private final Set<Address> unresolvedAddresses = new LinkedHashSet<Address>();
	private final Map<String, Integer> addressLabelCounts = new HashMap<String, Integer>();

	Address createAddress(String label) {
		Integer count = addressLabelCounts.get(label);
		if (count == null) {
			count = 0;
		} else {
			count = count + 1;
		}
		addressLabelCounts.put(label, count);
		Address address = new Address(label + "_" + count);
		unresolvedAddresses.add(address);
		return address;
	}

	void resolveAddress(Address address, int index) {
		if (unresolvedAddresses.remove(address)) {
			address.assignIndex(index);
		} else {
			throw new IllegalStateException(address + " is already resolved, or unresolved from another program.");
		}
	}

	Set<Address> getUnresolvedAddresses() {
		return unresolvedAddresses;
	}
}
