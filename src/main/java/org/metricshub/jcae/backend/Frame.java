package org.metricshub.jcae.backend;

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.metricshub.jcae.intermediate.Instruction;
import org.metricshub.jcae.intermediate.Procedure;
import org.metricshub.jcae.jrt.Region;

/**
 * One active procedure call: the region unqualified instructions act on
 * (<code>here</code>), the region <code>$</code> resolves to
 * (<code>origin</code>), and where execution stands in the body.
 * <p>
 * The position is a stack of cursors. The bottom one walks the procedure
 * body; each loop being executed pushes a cursor over its own body. A
 * cursor stays on the LOOP instruction while its body runs, so that the
 * loop is tested again once the body cursor is exhausted.
 */
final class Frame {

	private final Procedure procedure;
	private final Region here;
	private final Region origin;
	private final Deque<Cursor> cursors = new ArrayDeque<Cursor>();

	Frame(Procedure procedure, Region here, Region origin) {
		this.procedure = procedure;
		this.here = here;
		this.origin = origin;
		cursors.push(new Cursor(procedure.getBody()));
	}

	Region getHere() {
		return here;
	}

	Region getOrigin() {
		return origin;
	}

	/**
	 * @return the instruction to execute next, or <code>null</code> when the
	 *         innermost body (loop or procedure) is exhausted
	 */
	Instruction current() {
		return cursors.peek().current();
	}

	/** Moves past the current instruction of the innermost body. */
	void advance() {
		cursors.peek().index++;
	}

	/**
	 * Starts one iteration of a loop whose LOOP instruction is current.
	 *
	 * @param body the loop body
	 */
	void enterLoop(List<Instruction> body) {
		cursors.push(new Cursor(body));
	}

	/**
	 * @return whether the innermost body is a loop body
	 */
	boolean inLoop() {
		return cursors.size() > 1;
	}

	/** Ends one iteration; the enclosing LOOP instruction becomes current again. */
	void exitLoop() {
		assert inLoop();
		cursors.pop();
	}

	@Override
	public String toString() {
		return procedure.getLabel() + " here=" + here.getName() + " origin=" + origin.getName();
	}

	private static final class Cursor {

		private final List<Instruction> instructions;
		private int index;

		private Cursor(List<Instruction> instructions) {
			this.instructions = instructions;
		}

		private Instruction current() {
			return index < instructions.size() ? instructions.get(index) : null;
		}
	}
}
