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

/**
 * Thrown when loop brackets do not balance within a single procedure body.
 * A <code>[</code> opened inside an anonymous procedure must be closed
 * before its <code>)</code>, and a <code>]</code> cannot close a loop
 * opened in an enclosing body.
 * <p>
 * The exception position is the offending token. When the problem is an
 * unclosed <code>[</code>, its position is available as well.
 */
public class BracketScopeException extends ParserException {

	private static final long serialVersionUID = 1L;

	private final int openLineNumber;
	private final int openColumn;

	/**
	 * Unmatched <code>]</code>.
	 *
	 * @param msg description of the problem
	 * @param sourceDescription name of the script source
	 * @param lineNumber line of the offending token
	 * @param column column of the offending token
	 */
	public BracketScopeException(String msg, String sourceDescription, int lineNumber, int column) {
		this(msg, sourceDescription, lineNumber, column, -1, -1);
	}

	/**
	 * Unclosed <code>[</code>.
	 *
	 * @param msg description of the problem
	 * @param sourceDescription name of the script source
	 * @param lineNumber line of the offending token
	 * @param column column of the offending token
	 * @param openLineNumber line of the unclosed <code>[</code>
	 * @param openColumn column of the unclosed <code>[</code>
	 */
	public BracketScopeException(
			String msg,
			String sourceDescription,
			int lineNumber,
			int column,
			int openLineNumber,
			int openColumn) {
		super(msg, sourceDescription, lineNumber, column);
		this.openLineNumber = openLineNumber;
		this.openColumn = openColumn;
	}

	/**
	 * @return line of the unclosed <code>[</code>, or <code>-1</code>
	 */
	public int getOpenLineNumber() {
		return openLineNumber;
	}

	/**
	 * @return column of the unclosed <code>[</code>, or <code>-1</code>
	 */
	public int getOpenColumn() {
		return openColumn;
	}
}
