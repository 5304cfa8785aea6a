package org.metricshub.jcae.jrt;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.jcae.intermediate.CaeProgram;

/**
 * All the memory of one run: one {@link Region} per declared region,
 * keyed by name, allocated once and never resized.
 */
public final class RegionStore {

	private final Map<String, Region> regions = new LinkedHashMap<String, Region>();

	/**
	 * Allocates zeroed regions for every region the program declares.
	 *
	 * @param program validated program
	 */
	public RegionStore(CaeProgram program) {
		this(program.getRegionCapacities());
	}

	/**
	 * @param capacities capacity of each region keyed by name
	 */
	public RegionStore(Map<String, Integer> capacities) {
		for (Map.Entry<String, Integer> entry : capacities.entrySet()) {
			regions.put(entry.getKey(), new Region(entry.getKey(), entry.getValue()));
		}
	}

	/**
	 * @param name name of a declared region
	 * @return the region
	 * @throws IllegalStateException if no such region exists, which the
	 *         validator makes impossible for names used by a program
	 */
	public Region get(String name) {
		Region region = regions.get(name);
		if (region == null) {
			throw new IllegalStateException("Unknown region '" + name + "'");
		}
		return region;
	}

	/**
	 * @param name a region name
	 * @return whether such a region exists
	 */
	public boolean contains(String name) {
		return regions.containsKey(name);
	}

	/**
	 * @return the regions in declaration order
	 */
	public Collection<Region> getRegions() {
		return Collections.unmodifiableCollection(regions.values());
	}

	@Override
	public String toString() {
		return regions.values().toString();
	}
}
