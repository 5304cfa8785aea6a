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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jcae.intermediate.Procedure;

/**
 * Declarations collected by the {@link CaeParser}, in source order, before
 * any name is resolved. Duplicates are kept so that the
 * {@link ProgramValidator} can report them.
 * <p>
 * Several script sources may be parsed into the same instance.
 */
public final class ParsedProgram {

	private final List<RegionDeclaration> regions = new ArrayList<RegionDeclaration>();
	private final List<Procedure> procedures = new ArrayList<Procedure>();

	void addRegion(RegionDeclaration region) {
		regions.add(region);
	}

	void addProcedure(Procedure procedure) {
		procedures.add(procedure);
	}

	/**
	 * @return region declarations in source order
	 */
	public List<RegionDeclaration> getRegions() {
		return Collections.unmodifiableList(regions);
	}

	/**
	 * @return named procedure declarations in source order
	 */
	public List<Procedure> getProcedures() {
		return Collections.unmodifiableList(procedures);
	}
}
