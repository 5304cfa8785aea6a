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
 * A <code>region name[size];</code> declaration as written in the source.
 */
public final class RegionDeclaration {

	/** Largest number of cells a region may be declared with (16 MiB). */
	public static final int MAX_CAPACITY = 16 * 1024 * 1024;

	private final String name;
	private final int capacity;
	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	/**
	 * @param name region name
	 * @param capacity number of cells, from 1 to {@link #MAX_CAPACITY}
	 * @param sourceDescription script source of the declaration
	 * @param lineNumber line of the <code>region</code> keyword
	 * @param column column of the <code>region</code> keyword
	 */
	public RegionDeclaration(String name, int capacity, String sourceDescription, int lineNumber, int column) {
		if (capacity < 1 || capacity > MAX_CAPACITY) {
			throw new IllegalArgumentException("Region capacity out of range: " + capacity);
		}
		this.name = name;
		this.capacity = capacity;
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	public String getName() {
		return name;
	}

	public int getCapacity() {
		return capacity;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public int getColumn() {
		return column;
	}
}
