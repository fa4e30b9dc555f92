package org.metricshub.timewarp.frontend;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token table of one language: everything the shared {@link Lexer} needs to
 * know about keywords, operators, comments, literals and line structure.
 * Instances are immutable and built with {@link #builder(String)}.
 */
public final class LexerSpec {

	/** How backslashes inside a quoted literal are treated. */
	public enum EscapeStyle {
		/** No escapes; the literal ends at the first closing quote. */
		NONE,
		/** A doubled quote stands for one quote (Pascal). */
		DOUBLED_QUOTE,
		/** C-style backslash escapes plus doubled quotes (Prolog). */
		BACKSLASH
	}

	private final String languageName;
	private final boolean caseSensitive;
	private final Set<String> keywords;
	private final List<String> operators;
	private final List<String> lineCommentPrefixes;
	private final Set<String> lineCommentKeywords;
	private final Map<String, String> blockComments;
	private final Map<Character, TokenType> quotes;
	private final Map<Character, EscapeStyle> escapes;
	private final String identifierSuffixes;
	private final boolean newlinesSignificant;
	private final boolean lineNumbers;
	private final Pattern rawLinePattern;

	private LexerSpec(Builder builder) {
		this.languageName = builder.languageName;
		this.caseSensitive = builder.caseSensitive;
		this.keywords = Collections.unmodifiableSet(new HashSet<String>(builder.keywords));
		List<String> ops = new ArrayList<String>(builder.operators);
		// longest match first
		Collections.sort(ops, Comparator.comparingInt(String::length).reversed());
		this.operators = Collections.unmodifiableList(ops);
		this.lineCommentPrefixes = Collections.unmodifiableList(new ArrayList<String>(builder.lineCommentPrefixes));
		this.lineCommentKeywords = Collections.unmodifiableSet(new HashSet<String>(builder.lineCommentKeywords));
		this.blockComments = Collections.unmodifiableMap(new HashMap<String, String>(builder.blockComments));
		this.quotes = Collections.unmodifiableMap(new HashMap<Character, TokenType>(builder.quotes));
		this.escapes = Collections.unmodifiableMap(new HashMap<Character, EscapeStyle>(builder.escapes));
		this.identifierSuffixes = builder.identifierSuffixes;
		this.newlinesSignificant = builder.newlinesSignificant;
		this.lineNumbers = builder.lineNumbers;
		this.rawLinePattern = builder.rawLinePattern;
	}

	public static Builder builder(String languageName) {
		return new Builder(languageName);
	}

	public String getLanguageName() {
		return languageName;
	}

	public boolean isCaseSensitive() {
		return caseSensitive;
	}

	/**
	 * Folds a word the way the language compares words.
	 *
	 * @param word identifier or keyword as written
	 * @return the comparison form
	 */
	public String normalize(String word) {
		return caseSensitive ? word : word.toUpperCase(Locale.ROOT);
	}

	public boolean isKeyword(String normalizedWord) {
		return keywords.contains(normalizedWord);
	}

	List<String> getOperators() {
		return operators;
	}

	List<String> getLineCommentPrefixes() {
		return lineCommentPrefixes;
	}

	boolean isLineCommentKeyword(String normalizedWord) {
		return lineCommentKeywords.contains(normalizedWord);
	}

	Map<String, String> getBlockComments() {
		return blockComments;
	}

	TokenType quoteType(char c) {
		return quotes.get(c);
	}

	EscapeStyle escapeStyle(char quote) {
		EscapeStyle style = escapes.get(quote);
		return style == null ? EscapeStyle.NONE : style;
	}

	boolean isIdentifierSuffix(char c) {
		return identifierSuffixes.indexOf(c) >= 0;
	}

	boolean isNewlinesSignificant() {
		return newlinesSignificant;
	}

	boolean isLineNumbers() {
		return lineNumbers;
	}

	Pattern getRawLinePattern() {
		return rawLinePattern;
	}

	/**
	 * Fluent builder of {@link LexerSpec}.
	 */
	public static final class Builder {

		private final String languageName;
		private boolean caseSensitive = true;
		private final Set<String> keywords = new HashSet<String>();
		private final List<String> operators = new ArrayList<String>();
		private final List<String> lineCommentPrefixes = new ArrayList<String>();
		private final Set<String> lineCommentKeywords = new HashSet<String>();
		private final Map<String, String> blockComments = new HashMap<String, String>();
		private final Map<Character, TokenType> quotes = new HashMap<Character, TokenType>();
		private final Map<Character, EscapeStyle> escapes = new HashMap<Character, EscapeStyle>();
		private String identifierSuffixes = "";
		private boolean newlinesSignificant;
		private boolean lineNumbers;
		private Pattern rawLinePattern;

		private Builder(String languageName) {
			this.languageName = languageName;
		}

		public Builder caseSensitive(boolean value) {
			this.caseSensitive = value;
			return this;
		}

		/**
		 * Declares keywords, written as they appear after normalization.
		 *
		 * @param words keywords
		 * @return this builder
		 */
		public Builder keywords(String... words) {
			keywords.addAll(Arrays.asList(words));
			return this;
		}

		public Builder operators(String... symbols) {
			operators.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder lineComment(String prefix) {
			lineCommentPrefixes.add(prefix);
			return this;
		}

		/**
		 * Declares a word that comments out the rest of the line, such as
		 * {@code REM}.
		 *
		 * @param word normalized keyword
		 * @return this builder
		 */
		public Builder lineCommentKeyword(String word) {
			lineCommentKeywords.add(word);
			keywords.add(word);
			return this;
		}

		public Builder blockComment(String open, String close) {
			blockComments.put(open, close);
			return this;
		}

		public Builder quote(char quote, TokenType type, EscapeStyle style) {
			quotes.put(quote, type);
			escapes.put(quote, style);
			return this;
		}

		/**
		 * @param suffixes characters allowed at the end of an identifier,
		 *        such as {@code $} for BASIC text variables
		 * @return this builder
		 */
		public Builder identifierSuffixes(String suffixes) {
			this.identifierSuffixes = suffixes;
			return this;
		}

		public Builder newlinesSignificant(boolean value) {
			this.newlinesSignificant = value;
			return this;
		}

		/**
		 * Enables numeric labels at the start of lines. They are returned as
		 * ordinary number tokens; the flag only lets the raw-line pattern be
		 * checked after them.
		 *
		 * @param value whether lines may start with a number
		 * @return this builder
		 */
		public Builder lineNumbers(boolean value) {
			this.lineNumbers = value;
			return this;
		}

		/**
		 * Lines whose statement part matches this pattern are returned
		 * verbatim as one {@link TokenType#RAW} token.
		 *
		 * @param pattern anchored pattern applied to the statement part of a line
		 * @return this builder
		 */
		public Builder rawLinePattern(Pattern pattern) {
			this.rawLinePattern = pattern;
			return this;
		}

		public LexerSpec build() {
			return new LexerSpec(this);
		}
	}
}
