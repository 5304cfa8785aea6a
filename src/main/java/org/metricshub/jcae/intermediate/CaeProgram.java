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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated Cae program: the declared regions with their capacities, the
 * named procedures, and every anonymous procedure found in their bodies.
 * <p>
 * Instances are only built once every reference has been checked, so
 * {@link #getProcedure(String)} and {@link #getRegionCapacity(String)} never
 * fail for a name used by one of the instructions. Both the region named
 * <code>main</code> and the procedure named <code>main</code> exist.
 * <p>
 * The memory itself is not part of the program: every run starts from
 * fresh, zeroed regions.
 */
public final class CaeProgram {

	/** Name of the entry procedure and of the region it initially runs on. */
	public static final String MAIN = "main";

	private final Map<String, Integer> regionCapacities;
	private final Map<String, Procedure> procedures;
	private final List<Procedure> anonymousProcedures;

	/**
	 * @param regionCapacities capacity of each region, in declaration order
	 * @param procedures named procedures, in declaration order
	 * @param anonymousProcedures anonymous procedures, in source order
	 */
	public CaeProgram(
			Map<String, Integer> regionCapacities,
			Map<String, Procedure> procedures,
			List<Procedure> anonymousProcedures) {
		if (!regionCapacities.containsKey(MAIN) || !procedures.containsKey(MAIN)) {
			throw new IllegalArgumentException("A program needs both a region and a procedure named 'main'");
		}
		this.regionCapacities = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(regionCapacities));
		this.procedures = Collections.unmodifiableMap(new LinkedHashMap<String, Procedure>(procedures));
		this.anonymousProcedures = Collections.unmodifiableList(new ArrayList<Procedure>(anonymousProcedures));
	}

	/**
	 * @return capacity of each region keyed by name, in declaration order
	 */
	public Map<String, Integer> getRegionCapacities() {
		return regionCapacities;
	}

	/**
	 * @param name name of a declared region
	 * @return its capacity
	 */
	public int getRegionCapacity(String name) {
		Integer capacity = regionCapacities.get(name);
		if (capacity == null) {
			throw new IllegalStateException("Region '" + name + "' was not validated");
		}
		return capacity;
	}

	/**
	 * @return named procedures keyed by name, in declaration order
	 */
	public Map<String, Procedure> getProcedures() {
		return procedures;
	}

	/**
	 * @param name name of a declared procedure
	 * @return the procedure
	 */
	public Procedure getProcedure(String name) {
		Procedure procedure = procedures.get(name);
		if (procedure == null) {
			throw new IllegalStateException("Procedure '" + name + "' was not validated");
		}
		return procedure;
	}

	/**
	 * @return the procedure named <code>main</code>
	 */
	public Procedure getMainProcedure() {
		return getProcedure(MAIN);
	}

	/**
	 * @return anonymous procedures in the order their opening parenthesis appears
	 */
	public List<Procedure> getAnonymousProcedures() {
		return anonymousProcedures;
	}

	/**
	 * Prints the program in a readable form: one line per region, then one
	 * line per named and anonymous procedure.
	 *
	 * @param ps destination
	 */
	public void dump(PrintStream ps) {
		for (Map.Entry<String, Integer> region : regionCapacities.entrySet()) {
			ps.println("region " + region.getKey() + "[" + region.getValue() + "];");
		}
		for (Procedure procedure : procedures.values()) {
			ps.println("proc " + procedure.getName() + ": " + procedure.bodyToString() + ";");
		}
		for (Procedure procedure : anonymousProcedures) {
			ps.println("# " + procedure.getLabel() + ": (" + procedure.bodyToString() + ")");
		}
	}
}
