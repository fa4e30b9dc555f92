package org.metricshub.timewarp;

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

/**
 * A parsed program, ready to be started any number of times.
 * Programs are immutable: running one never changes it.
 */
public abstract class Program implements Serializable {

	private static final long serialVersionUID = 1L;

	private final LanguageKind language;
	private final String sourceDescription;

	protected Program(LanguageKind language, String sourceDescription) {
		this.language = language;
		this.sourceDescription = sourceDescription;
	}

	public LanguageKind getLanguage() {
		return language;
	}

	/**
	 * @return the file name or buffer name the program was loaded from
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}
}
