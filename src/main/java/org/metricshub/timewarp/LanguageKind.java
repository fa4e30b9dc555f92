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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The three languages understood by the engine.
 */
public enum LanguageKind {
	/** Unified BASIC, PILOT and Logo. */
	BASIC("TW BASIC", ".twb", ".bas", ".tw", ".logo", ".pilot"),
	/** Structured Pascal subset. */
	PASCAL("TW Pascal", ".twp", ".pas"),
	/** Prolog subset with Turbo Prolog sections. */
	PROLOG("TW Prolog", ".tpr", ".plg", ".pl");

	private static final Pattern PASCAL_HEADER = Pattern.compile("^\\s*program\\s+\\w+", Pattern.CASE_INSENSITIVE);
	private static final Pattern PASCAL_BLOCK = Pattern
			.compile("(?is)\\bbegin\\b.*\\bend\\s*\\.\\s*$");
	private static final Pattern PROLOG_SECTION = Pattern
			.compile("(?im)^\\s*(clauses|goal|predicates|domains)\\s*$");

	private final String displayName;
	private final String[] extensions;

	LanguageKind(String displayName, String... extensions) {
		this.displayName = displayName;
		this.extensions = extensions;
	}

	public String getDisplayName() {
		return displayName;
	}

	/**
	 * @return the preferred file extension, with its leading dot
	 */
	public String getDefaultExtension() {
		return extensions[0];
	}

	/**
	 * Finds the language associated with a file name.
	 *
	 * @param fileName file name or path
	 * @return the language, or {@code null} when the extension is unknown
	 */
	public static LanguageKind fromFileName(String fileName) {
		String lower = fileName.toLowerCase(Locale.ROOT);
		for (LanguageKind kind : values()) {
			for (String extension : kind.extensions) {
				if (lower.endsWith(extension)) {
					return kind;
				}
			}
		}
		return null;
	}

	/**
	 * Guesses the language of a program text: Pascal when it starts with a
	 * {@code program} header or ends with a {@code begin ... end.} block,
	 * Prolog when it has clause operators or Turbo Prolog section headers,
	 * BASIC otherwise.
	 *
	 * @param source program text
	 * @return the detected language, never {@code null}
	 */
	public static LanguageKind detect(String source) {
		if (PASCAL_HEADER.matcher(source).find() || PASCAL_BLOCK.matcher(source).find()) {
			return PASCAL;
		}
		if (source.contains(":-") || source.contains("?-") || PROLOG_SECTION.matcher(source).find()) {
			return PROLOG;
		}
		return BASIC;
	}

	/**
	 * Parses a language name as typed on the command line or in a script
	 * context attribute.
	 *
	 * @param name {@code basic}, {@code pascal}, {@code prolog}, or one of the
	 *        {@code tw}-prefixed forms
	 * @return the language
	 * @throws IllegalArgumentException when the name is unknown
	 */
	public static LanguageKind fromName(String name) {
		String lower = name.trim().toLowerCase(Locale.ROOT);
		if (lower.startsWith("tw")) {
			lower = lower.substring(2);
		}
		if ("basic".equals(lower) || "pilot".equals(lower) || "logo".equals(lower)) {
			return BASIC;
		}
		if ("pascal".equals(lower)) {
			return PASCAL;
		}
		if ("prolog".equals(lower)) {
			return PROLOG;
		}
		throw new IllegalArgumentException("Unknown language: " + name);
	}
}
