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
 * A call, send or receive names a region or procedure that was never declared.
 */
public class UndefinedReferenceException extends ValidationException {

	private static final long serialVersionUID = 1L;

	private final SymbolKind kind;
	private final String name;

	/**
	 * @param kind namespace the name was looked up in
	 * @param name the missing name
	 * @param sourceDescription name of the script source of the reference
	 * @param lineNumber line of the reference
	 * @param column column of the reference
	 */
	public UndefinedReferenceException(
			SymbolKind kind,
			String name,
			String sourceDescription,
			int lineNumber,
			int column) {
		super("Undefined " + kind.getDisplayName() + " '" + name + "'", sourceDescription, lineNumber, column);
		this.kind = kind;
		this.name = name;
	}

	/**
	 * @return namespace the name was looked up in
	 */
	public SymbolKind getKind() {
		return kind;
	}

	/**
	 * @return the missing name
	 */
	public String getName() {
		return name;
	}
}
