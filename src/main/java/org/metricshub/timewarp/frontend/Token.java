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

/**
 * A lexer token with its position in the source.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final String normalized;
	private final boolean keyword;
	private final int line;
	private final int column;

	public Token(TokenType type, String text, String normalized, boolean keyword, int line, int column) {
		this.type = type;
		this.text = text;
		this.normalized = normalized;
		this.keyword = keyword;
		this.line = line;
		this.column = column;
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return the token as written; for string literals, the decoded content
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the text folded to upper case in case-insensitive languages
	 */
	public String getNormalized() {
		return normalized;
	}

	public boolean isKeyword() {
		return keyword;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @param type expected category
	 * @param normalizedText expected normalized text
	 * @return whether this token has both
	 */
	public boolean is(TokenType type, String normalizedText) {
		return this.type == type && normalized.equals(normalizedText);
	}

	public boolean isSymbol(String symbol) {
		return is(TokenType.SYMBOL, symbol);
	}

	public boolean isKeyword(String word) {
		return keyword && normalized.equals(word);
	}

	@Override
	public String toString() {
		switch (type) {
		case EOF:
			return "end of input";
		case NEWLINE:
			return "end of line";
		case STRING:
			return "\"" + text + "\"";
		case QUOTED:
			return "'" + text + "'";
		default:
			return "'" + text + "'";
		}
	}
}
