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
 * Base class of every error detected while loading a Cae program, before
 * anything is executed. A program that failed to load must not be run.
 * <p>
 * The position is 1-based; <code>-1</code> means the position is unknown
 * (for instance a missing entry point has no position at all).
 */
public abstract class CaeLoadException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	/**
	 * @param msg description of the problem
	 * @param sourceDescription name of the script source, may be <code>null</code>
	 * @param lineNumber 1-based line, or <code>-1</code>
	 * @param column 1-based column, or <code>-1</code>
	 */
	protected CaeLoadException(String msg, String sourceDescription, int lineNumber, int column) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	/**
	 * @return name of the script source the error was found in, or <code>null</code>
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return 1-based line of the error, or <code>-1</code> if unknown
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return 1-based column of the error, or <code>-1</code> if unknown
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * Formats the position as <code>source line L, column C</code>, leaving out
	 * the parts that are unknown.
	 *
	 * @return the formatted position, empty if nothing is known
	 */
	public String getLocation() {
		StringBuilder sb = new StringBuilder();
		if (sourceDescription != null) {
			sb.append(sourceDescription);
		}
		if (lineNumber > 0) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append("line ").append(lineNumber);
			if (column > 0) {
				sb.append(", column ").append(column);
			}
		}
		return sb.toString();
	}
}
