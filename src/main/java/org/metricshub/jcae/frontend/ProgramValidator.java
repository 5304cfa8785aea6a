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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jcae.intermediate.CaeProgram;
import org.metricshub.jcae.intermediate.Instruction;
import org.metricshub.jcae.intermediate.Procedure;
import org.metricshub.jcae.intermediate.RegionReference;
import org.metricshub.jcae.util.CaeLogger;
import org.slf4j.Logger;

/**
 * Resolves every name of a {@link ParsedProgram} and turns it into a
 * {@link CaeProgram}.
 * <p>
 * Checks, in this order: no two regions and no two procedures share a
 * name; every procedure called and every region named by a call clause,
 * a send or a receive is declared (loop bodies and anonymous bodies
 * included); a region and a procedure named <code>main</code> exist.
 * The back-reference <code>$</code> needs no checking, it always denotes
 * a region of the running frame.
 */
public class ProgramValidator {

	private static final Logger LOG = CaeLogger.getLogger(ProgramValidator.class);

	/**
	 * @param parsed declarations of all the script sources
	 * @return the validated program
	 * @throws DuplicateDeclarationException if a name is declared twice
	 * @throws UndefinedReferenceException if a reference cannot be resolved
	 * @throws MissingEntryPointException if region or procedure <code>main</code> is missing
	 */
	public CaeProgram validate(ParsedProgram parsed) {
		Map<String, Integer> regions = new LinkedHashMap<String, Integer>();
		for (RegionDeclaration region : parsed.getRegions()) {
			if (regions.putIfAbsent(region.getName(), region.getCapacity()) != null) {
				throw new DuplicateDeclarationException(
						SymbolKind.REGION,
						region.getName(),
						region.getSourceDescription(),
						region.getLineNumber(),
						region.getColumn());
			}
		}
		Map<String, Procedure> procedures = new LinkedHashMap<String, Procedure>();
		for (Procedure procedure : parsed.getProcedures()) {
			if (procedures.putIfAbsent(procedure.getName(), procedure) != null) {
				throw new DuplicateDeclarationException(
						SymbolKind.PROCEDURE,
						procedure.getName(),
						procedure.getSourceDescription(),
						procedure.getLineNumber(),
						procedure.getColumn());
			}
		}

		List<Procedure> anonymousProcedures = new ArrayList<Procedure>();
		for (Procedure procedure : procedures.values()) {
			checkReferences(procedure, procedure.getBody(), regions, procedures, anonymousProcedures);
		}

		if (!regions.containsKey(CaeProgram.MAIN)) {
			throw new MissingEntryPointException(SymbolKind.REGION);
		}
		if (!procedures.containsKey(CaeProgram.MAIN)) {
			throw new MissingEntryPointException(SymbolKind.PROCEDURE);
		}

		LOG
				.debug(
						"Validated program with {} region(s), {} procedure(s) and {} anonymous procedure(s)",
						regions.size(),
						procedures.size(),
						anonymousProcedures.size());
		return new CaeProgram(regions, procedures, anonymousProcedures);
	}

	private void checkReferences(
			Procedure owner,
			List<Instruction> instructions,
			Map<String, Integer> regions,
			Map<String, Procedure> procedures,
			List<Procedure> anonymousProcedures) {
		for (Instruction instruction : instructions) {
			switch (instruction.getOpcode()) {
			case LOOP:
				checkReferences(owner, instruction.getBody(), regions, procedures, anonymousProcedures);
				break;
			case SEND:
			case RECEIVE:
				checkRegion(owner, instruction, regions);
				break;
			case CALL:
				if (instruction.isAnonymousCall()) {
					Procedure anonymous = instruction.getAnonymousProcedure();
					anonymousProcedures.add(anonymous);
					checkReferences(anonymous, anonymous.getBody(), regions, procedures, anonymousProcedures);
				} else if (!procedures.containsKey(instruction.getProcedureName())) {
					throw new UndefinedReferenceException(
							SymbolKind.PROCEDURE,
							instruction.getProcedureName(),
							owner.getSourceDescription(),
							instruction.getLineNumber(),
							instruction.getColumn());
				}
				if (instruction.getRegion() != null) {
					checkRegion(owner, instruction, regions);
				}
				break;
			default:
				break;
			}
		}
	}

	private void checkRegion(Procedure owner, Instruction instruction, Map<String, Integer> regions) {
		RegionReference region = instruction.getRegion();
		if (!region.isBackReference() && !regions.containsKey(region.getName())) {
			throw new UndefinedReferenceException(
					SymbolKind.REGION,
					region.getName(),
					owner.getSourceDescription(),
					instruction.getLineNumber(),
					instruction.getColumn());
		}
	}
}
