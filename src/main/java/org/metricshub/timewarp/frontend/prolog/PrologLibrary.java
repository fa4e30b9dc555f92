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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * List and enumeration predicates written in Prolog ({@code member/2},
 * {@code append/3}, {@code between/3}, {@code nth0/3}), read once from the
 * {@code library.pl} resource. A program that defines a predicate of the
 * same name and arity hides the library version.
 */
public final class PrologLibrary {

	private static final String RESOURCE = "library.pl";

	private static final PrologProgram LIBRARY = load();

	private PrologLibrary() {}

	private static PrologProgram load() {
		try (InputStream in = PrologLibrary.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				throw new IllegalStateException("Missing resource " + RESOURCE);
			}
			String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			return new PrologParser(RESOURCE).parse(text);
		} catch (IOException e) {
			throw new IllegalStateException("Cannot read " + RESOURCE, e);
		}
	}

	/**
	 * @param key {@code name/arity}
	 * @return the library clauses, or {@code null}
	 */
	public static List<Clause> getClauses(String key) {
		return LIBRARY.getClauses(key);
	}
}
