package org.metricshub.jcae.util;

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
 * What the input instruction (<code>,</code>) does once the input stream
 * is exhausted.
 */
public enum EndOfInputPolicy {
	/** Store 0 at the head of the current region. This is the default. */
	ZERO,
	/** Leave the cell under the head untouched. */
	UNCHANGED,
	/** Abort the run with an {@link org.metricshub.jcae.jrt.EndOfInputException}. */
	ERROR;

	/**
	 * Parses a policy name as given on the command line, ignoring case.
	 *
	 * @param name one of <code>zero</code>, <code>unchanged</code>, <code>error</code>
	 * @return the matching policy
	 * @throws IllegalArgumentException if the name is not a known policy
	 */
	public static EndOfInputPolicy fromName(String name) {
		for (EndOfInputPolicy policy : values()) {
			if (policy.name().equalsIgnoreCase(name)) {
				return policy;
			}
		}
		throw new IllegalArgumentException("Unknown end-of-input policy: " + name);
	}
}
