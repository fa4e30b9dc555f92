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

import java.util.List;

/**
 * Cursor over a token list, with the look-ahead and error helpers every
 * recursive-descent parser of the engine uses.
 */
public class TokenStream {

	private final List<Token> tokens;
	private final String sourceDescription;
	private int index;

	/**
	 * @param tokens tokens ending with {@link TokenType#EOF}
	 * @param sourceDescription name reported in errors
	 */
	public TokenStream(List<Token> tokens, String sourceDescription) {
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
			throw new IllegalArgumentException("Token list must end with EOF");
		}
		this.tokens = tokens;
		this.sourceDescription = sourceDescription;
	}

	public Token peek() {
		return tokens.get(index);
	}

	/**
	 * @param ahead 0 for the current token, 1 for the next one...
	 * @return the token, or the final EOF
	 */
	public Token peek(int ahead) {
		return tokens.get(Math.min(index + ahead, tokens.size() - 1));
	}

	public Token next() {
		Token token = tokens.get(index);
		if (token.getType() != TokenType.EOF) {
			index++;
		}
		return token;
	}

	public boolean atEnd() {
		return peek().getType() == TokenType.EOF;
	}

	public boolean isSymbol(String symbol) {
		return peek().isSymbol(symbol);
	}

	public boolean isKeyword(String keyword) {
		return peek().isKeyword(keyword);
	}

	/**
	 * Consumes the current token when it is the given symbol.
	 *
	 * @param symbol operator or punctuation
	 * @return whether it was consumed
	 */
	public boolean acceptSymbol(String symbol) {
		if (isSymbol(symbol)) {
			next();
			return true;
		}
		return false;
	}

	public boolean acceptKeyword(String keyword) {
		if (isKeyword(keyword)) {
			next();
			return true;
		}
		return false;
	}

	public Token expectSymbol(String symbol) {
		if (!isSymbol(symbol)) {
			throw error("Expected '" + symbol + "' but found " + peek());
		}
		return next();
	}

	public Token expectKeyword(String keyword) {
		if (!isKeyword(keyword)) {
			throw error("Expected " + keyword + " but found " + peek());
		}
		return next();
	}

	/**
	 * Consumes an identifier (a non-keyword word).
	 *
	 * @param what description used in the error message
	 * @return the identifier token
	 */
	public Token expectIdentifier(String what) {
		Token token = peek();
		if (token.getType() != TokenType.WORD || token.isKeyword()) {
			throw error("Expected " + what + " but found " + token);
		}
		return next();
	}

	public int position() {
		return index;
	}

	public void reset(int position) {
		index = position;
	}

	/**
	 * Builds an exception located at the current token.
	 *
	 * @param message what is wrong
	 * @return the exception, for the caller to throw
	 */
	public ParserException error(String message) {
		return error(peek(), message);
	}

	public ParserException error(Token at, String message) {
		return new ParserException(message, sourceDescription, at.getLine(), at.getColumn());
	}

	public String getSourceDescription() {
		return sourceDescription;
	}
}
