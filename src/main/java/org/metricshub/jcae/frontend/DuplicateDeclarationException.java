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
 * Two regions, or two procedures, were declared with the same name.
 */
public class DuplicateDeclarationException extends ValidationException {

	private static final long serialVersionUID = 1L;

	private final SymbolKind kind;
	private final String name;

	/**
	 * @param kind namespace of the duplicate
	 * @param name the duplicated name
	 * @param sourceDescription name of the script source of the second declaration
	 * @param lineNumber line of the second declaration
	 * @param column column of the second declaration
	 */
	public DuplicateDeclarationException(
			SymbolKind kind,
			String name,
			String sourceDescription,
			int lineNumber,
			int column) {
		super("Duplicate " + kind.getDisplayName() + " '" + name + "'", sourceDescription, lineNumber, column);
		this.kind = kind;
		this.name = name;
	}

	/**
	 * @return namespace of the duplicate
	 */
	public SymbolKind getKind() {
		return kind;
	}

	/**
	 * @return the duplicated name
	 */
	public String getName() {
		return name;
	}
}
