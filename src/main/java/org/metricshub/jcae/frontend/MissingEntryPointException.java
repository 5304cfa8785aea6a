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
 * The program lacks the region or the procedure named <code>main</code>.
 */
public class MissingEntryPointException extends ValidationException {

	private static final long serialVersionUID = 1L;

	private final SymbolKind kind;

	/**
	 * @param kind which of the two <code>main</code> declarations is missing
	 */
	public MissingEntryPointException(SymbolKind kind) {
		super("Missing entry point: no " + kind.getDisplayName() + " named 'main'", null, -1, -1);
		this.kind = kind;
	}

	/**
	 * @return which of the two <code>main</code> declarations is missing
	 */
	public SymbolKind getKind() {
		return kind;
	}
}
