package org.metricshub.jcae.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jcae
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
import java.io.Reader;
import java.util.HashMap;
import java.util.Map;
import org.metricshub.jcae.util.ScriptSource;

/**
 * Splits the text of one {@link ScriptSource} into {@link Token}s.
 * <p>
 * Whitespace and <code>#</code> comments (up to the end of the line) only
 * separate tokens. Identifiers are made of ASCII letters, digits and
 * <code>_</code>; a run of digits alone is an integer. A <code>"</code>
 * must be followed by exactly two hexadecimal digits, and the literal must
 * not run into an identifier character.
 * <p>
 * The lexer keeps the current token, its text and its position (1-based
 * line and column of its first character).
 */
class CaeLexer {

	/**
	 * Contains a mapping of the reserved words to their token values.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("region", Token.KW_REGION);
		KEYWORDS.put("proc", Token.KW_PROC);
	}

	private static final Map<Character, Token> PUNCTUATION = new HashMap<Character, Token>();

	static {
		PUNCTUATION.put('+', Token.PLUS);
		PUNCTUATION.put('-', Token.MINUS);
		PUNCTUATION.put('>', Token.GT);
		PUNCTUATION.put('<', Token.LT);
		PUNCTUATION.put('~', Token.TILDE);
		PUNCTUATION.put('.', Token.DOT);
		PUNCTUATION.put(',', Token.COMMA);
		PUNCTUATION.put('^', Token.CARET);
		PUNCTUATION.put('&', Token.AMPERSAND);
		PUNCTUATION.put('@', Token.AT);
		PUNCTUATION.put('$', Token.DOLLAR);
		PUNCTUATION.put(':', Token.COLON);
		PUNCTUATION.put(';', Token.SEMICOLON);
		PUNCTUATION.put('[', Token.OPEN_BRACKET);
		PUNCTUATION.put(']', Token.CLOSE_BRACKET);
		PUNCTUATION.put('(', Token.OPEN_PAREN);
		PUNCTUATION.put(')', Token.CLOSE_PAREN);
	}

	private static final int NO_CHAR = -2;

	private final String sourceDescription;
	private final Reader reader;

	private int c;
	// character read ahead after a \r, NO_CHAR when there is none
	private int lookahead = NO_CHAR;
	private int lineNumber = 1;
	private int column = 0;

	private Token token;
	private final StringBuilder text = new StringBuilder();
	private int literal = -1;
	private int tokenLineNumber;
	private int tokenColumn;

	/**
	 * Creates a lexer positioned before the first token; call {@link #lexer()}
	 * to read it.
	 *
	 * @param source the script to tokenize
	 * @throws IOException if the source cannot be read
	 */
	CaeLexer(ScriptSource source) throws IOException {
		this.sourceDescription = source.getDescription();
		this.reader = source.getReader();
		if (reader == null) {
			throw new IOException("No reader for script source " + sourceDescription);
		}
		read();
	}

	private void read() throws IOException {
		if (c == '\n') {
			lineNumber++;
			column = 0;
		}
		c = readChar();
		// \r\n and a lone \r both end a line
		if (c == '\r') {
			int next = readChar();
			if (next != '\n') {
				lookahead = next;
			}
			c = '\n';
		}
		column++;
	}

	private int readChar() throws IOException {
		if (lookahead != NO_CHAR) {
			int ch = lookahead;
			lookahead = NO_CHAR;
			return ch;
		}
		return reader.read();
	}

	/**
	 * Skip all whitespaces and comments
	 *
	 * @throws IOException
	 */
	private void skipWhitespaces() throws IOException {
		while (c >= 0 && (Character.isWhitespace(c) || c == '#')) {
			if (c == '#') {
				while (c >= 0 && c != '\n') {
					read();
				}
			} else {
				read();
			}
		}
	}

	static boolean isIdentifierChar(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9') || ch == '_';
	}

	private static int hexValue(int ch) {
		if (ch >= '0' && ch <= '9') {
			return ch - '0';
		} else if (ch >= 'A' && ch <= 'F') {
			return ch - 'A' + 10;
		} else if (ch >= 'a' && ch <= 'f') {
			return ch - 'a' + 10;
		} else {
			return -1;
		}
	}

	/**
	 * Reads the next token.
	 *
	 * @return the new current token
	 * @throws IOException upon an IO error
	 * @throws LexerException if the text does not form a valid token
	 */
	Token lexer() throws IOException {
		skipWhitespaces();
		text.setLength(0);
		literal = -1;
		tokenLineNumber = lineNumber;
		tokenColumn = column;

		if (c < 0) {
			token = Token.EOF;
			return token;
		}

		if (isIdentifierChar(c)) {
			boolean digitsOnly = true;
			while (isIdentifierChar(c)) {
				if (c < '0' || c > '9') {
					digitsOnly = false;
				}
				text.append((char) c);
				read();
			}
			if (digitsOnly) {
				token = Token.INTEGER;
				return token;
			}
			Token kwToken = KEYWORDS.get(text.toString());
			token = kwToken != null ? kwToken : Token.IDENTIFIER;
			return token;
		}

		if (c == '"') {
			text.append('"');
			read();
			int value = 0;
			for (int i = 0; i < 2; i++) {
				int digit = hexValue(c);
				if (digit < 0) {
					throw lexerException(
							"Byte literal " + text + " must be followed by two hexadecimal digits, found "
									+ describe(c));
				}
				text.append((char) c);
				value = (value << 4) + digit;
				read();
			}
			if (isIdentifierChar(c)) {
				throw lexerException("Unexpected '" + (char) c + "' right after byte literal " + text);
			}
			literal = value;
			token = Token.HEX_LITERAL;
			return token;
		}

		Token punctuation = PUNCTUATION.get((char) c);
		if (punctuation == null) {
			throw lexerException("Invalid character " + describe(c));
		}
		text.append((char) c);
		read();
		token = punctuation;
		return token;
	}

	private static String describe(int ch) {
		if (ch < 0) {
			return "end of input";
		}
		if (Character.isWhitespace(ch) || Character.isISOControl(ch)) {
			return "character " + ch;
		}
		return "'" + (char) ch + "'";
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, lineNumber, column);
	}

	Token getToken() {
		return token;
	}

	/**
	 * @return the source text of the current token
	 */
	String getText() {
		return text.toString();
	}

	/**
	 * @return the byte value of the current HEX_LITERAL token, <code>-1</code> otherwise
	 */
	int getLiteral() {
		return literal;
	}

	int getTokenLineNumber() {
		return tokenLineNumber;
	}

	int getTokenColumn() {
		return tokenColumn;
	}

	String getSourceDescription() {
		return sourceDescription;
	}
}
