package org.metricshub.jcae.intermediate;

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

import java.util.Objects;

/**
 * Target of a send, a receive or a call clause: either a region name,
 * resolved against the declared regions, or the back-reference <code>$</code>,
 * resolved at run time to the <code>origin</code> region of the active frame.
 */
public final class RegionReference {

	/** The back-reference <code>$</code>. */
	public static final RegionReference BACK_REFERENCE = new RegionReference(null);

	private final String name;

	private RegionReference(String name) {
		this.name = name;
	}

	/**
	 * @param name name of a declared region
	 * @return a reference to that region
	 */
	public static RegionReference named(String name) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Region name must not be empty");
		}
		return new RegionReference(name);
	}

	/**
	 * @return <code>true</code> for <code>$</code>
	 */
	public boolean isBackReference() {
		return name == null;
	}

	/**
	 * @return the region name, or <code>null</code> for <code>$</code>
	 */
	public String getName() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RegionReference)) {
			return false;
		}
		return Objects.equals(name, ((RegionReference) o).name);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(name);
	}

	@Override
	public String toString() {
		return name == null ? "$" : name;
	}
}
