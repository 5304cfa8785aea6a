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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named or anonymous sequence of instructions, callable against a region.
 * <p>
 * Anonymous procedures have no name. They carry a label of the form
 * <code>enclosing-anon-N</code> which only serves diagnostics; no call can
 * address them by that label.
 */
public final class Procedure {

	private final String name;
	private final String label;
	private final List<Instruction> body;
	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	private Procedure(
			String name,
			String label,
			List<Instruction> body,
			String sourceDescription,
			int lineNumber,
			int column) {
		this.name = name;
		this.label = label;
		this.body = Collections.unmodifiableList(new ArrayList<Instruction>(body));
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	/**
	 * @param name procedure name
	 * @param body instructions, copied
	 * @param sourceDescription script source the procedure is declared in
	 * @param lineNumber line of the declaration
	 * @param column column of the declaration
	 * @return a named procedure
	 */
	public static Procedure named(
			String name,
			List<Instruction> body,
			String sourceDescription,
			int lineNumber,
			int column) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Procedure name must not be empty");
		}
		return new Procedure(name, name, body, sourceDescription, lineNumber, column);
	}

	/**
	 * @param label diagnostic label
	 * @param body instructions, copied
	 * @param sourceDescription script source the procedure is defined in
	 * @param lineNumber line of the opening parenthesis
	 * @param column column of the opening parenthesis
	 * @return an anonymous procedure
	 */
	public static Procedure anonymous(
			String label,
			List<Instruction> body,
			String sourceDescription,
			int lineNumber,
			int column) {
		return new Procedure(null, label, body, sourceDescription, lineNumber, column);
	}

	/**
	 * @return the name, or <code>null</code> for an anonymous procedure
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the name, or the diagnostic label of an anonymous procedure
	 */
	public String getLabel() {
		return label;
	}

	public boolean isAnonymous() {
		return name == null;
	}

	/**
	 * @return the instructions, unmodifiable
	 */
	public List<Instruction> getBody() {
		return body;
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

	/**
	 * @return the body rendered back in source form
	 */
	public String bodyToString() {
		StringBuilder sb = new StringBuilder();
		Instruction.appendAll(sb, body);
		return sb.toString();
	}

	@Override
	public String toString() {
		return label;
	}
}
