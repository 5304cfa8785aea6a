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
import java.util.Locale;

/**
 * Represents a single instruction of a procedure body along with its
 * operands. Only the operands relevant to the {@link Opcode} are set;
 * the others are <code>null</code> (or <code>-1</code> for the literal).
 * <p>
 * Loops own their body and anonymous calls own the called
 * {@link Procedure}, so a procedure body is a tree rather than a flat
 * list with jump targets.
 * <p>
 * Instances are immutable.
 *
 * @see Opcode
 */
public final class Instruction {

	private final Opcode opcode;
	private final int literal;
	private final RegionReference region;
	private final List<Instruction> body;
	private final String procedureName;
	private final Procedure anonymousProcedure;
	private final int lineNumber;
	private final int column;

	private Instruction(
			Opcode opcode,
			int literal,
			RegionReference region,
			List<Instruction> body,
			String procedureName,
			Procedure anonymousProcedure,
			int lineNumber,
			int column) {
		this.opcode = opcode;
		this.literal = literal;
		this.region = region;
		this.body = body;
		this.procedureName = procedureName;
		this.anonymousProcedure = anonymousProcedure;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	/**
	 * Creates an instruction without operands: one of <code>+ - &gt; &lt; ~ . ,</code>.
	 *
	 * @param opcode the operation
	 * @param lineNumber 1-based source line
	 * @param column 1-based source column
	 * @return the new instruction
	 */
	public static Instruction simple(Opcode opcode, int lineNumber, int column) {
		switch (opcode) {
		case INCREMENT:
		case DECREMENT:
		case MOVE_RIGHT:
		case MOVE_LEFT:
		case RESET_HEAD:
		case OUTPUT:
		case INPUT:
			return new Instruction(opcode, -1, null, null, null, null, lineNumber, column);
		default:
			throw new IllegalArgumentException(opcode + " requires operands");
		}
	}

	/**
	 * @param value byte value, 0 to 255
	 * @param lineNumber 1-based source line
	 * @param column 1-based source column
	 * @return a WRITE_LITERAL instruction
	 */
	public static Instruction writeLiteral(int value, int lineNumber, int column) {
		if (value < 0 || value > 255) {
			throw new IllegalArgumentException("Byte literal out of range: " + value);
		}
		return new Instruction(Opcode.WRITE_LITERAL, value, null, null, null, null, lineNumber, column);
	}

	/**
	 * @param body loop body, copied
	 * @param lineNumber line of the opening bracket
	 * @param column column of the opening bracket
	 * @return a LOOP instruction
	 */
	public static Instruction loop(List<Instruction> body, int lineNumber, int column) {
		return new Instruction(
				Opcode.LOOP,
				-1,
				null,
				Collections.unmodifiableList(new ArrayList<Instruction>(body)),
				null,
				null,
				lineNumber,
				column);
	}

	/**
	 * @param target region receiving the head byte
	 * @param lineNumber 1-based source line
	 * @param column 1-based source column
	 * @return a SEND instruction
	 */
	public static Instruction send(RegionReference target, int lineNumber, int column) {
		return new Instruction(Opcode.SEND, -1, requireRegion(target), null, null, null, lineNumber, column);
	}

	/**
	 * @param source region the head byte is copied from
	 * @param lineNumber 1-based source line
	 * @param column 1-based source column
	 * @return a RECEIVE instruction
	 */
	public static Instruction receive(RegionReference source, int lineNumber, int column) {
		return new Instruction(Opcode.RECEIVE, -1, requireRegion(source), null, null, null, lineNumber, column);
	}

	/**
	 * @param procedureName name of the called procedure
	 * @param clause region clause, <code>null</code> when absent
	 * @param lineNumber 1-based source line
	 * @param column 1-based source column
	 * @return a CALL instruction to a named procedure
	 */
	public static Instruction call(String procedureName, RegionReference clause, int lineNumber, int column) {
		if (procedureName == null || procedureName.isEmpty()) {
			throw new IllegalArgumentException("Procedure name must not be empty");
		}
		return new Instruction(Opcode.CALL, -1, clause, null, procedureName, null, lineNumber, column);
	}

	/**
	 * @param procedure the anonymous procedure defined at this call site
	 * @param clause region clause, <code>null</code> when absent
	 * @param lineNumber line of the opening parenthesis
	 * @param column column of the opening parenthesis
	 * @return a CALL instruction to an anonymous procedure
	 */
	public static Instruction callAnonymous(Procedure procedure, RegionReference clause, int lineNumber, int column) {
		if (procedure == null || !procedure.isAnonymous()) {
			throw new IllegalArgumentException("An anonymous procedure is required");
		}
		return new Instruction(Opcode.CALL, -1, clause, null, null, procedure, lineNumber, column);
	}

	private static RegionReference requireRegion(RegionReference region) {
		if (region == null) {
			throw new IllegalArgumentException("Region reference must not be null");
		}
		return region;
	}

	public Opcode getOpcode() {
		return opcode;
	}

	/**
	 * @return the byte of a WRITE_LITERAL, <code>-1</code> otherwise
	 */
	public int getLiteral() {
		return literal;
	}

	/**
	 * @return the target of a SEND or RECEIVE, the clause of a CALL
	 *         (<code>null</code> when the call has none), <code>null</code> otherwise
	 */
	public RegionReference getRegion() {
		return region;
	}

	/**
	 * @return the body of a LOOP, <code>null</code> otherwise
	 */
	public List<Instruction> getBody() {
		return body;
	}

	/**
	 * @return the name called by a named CALL, <code>null</code> otherwise
	 */
	public String getProcedureName() {
		return procedureName;
	}

	/**
	 * @return the procedure called by an anonymous CALL, <code>null</code> otherwise
	 */
	public Procedure getAnonymousProcedure() {
		return anonymousProcedure;
	}

	/**
	 * @return <code>true</code> for a CALL to an anonymous procedure
	 */
	public boolean isAnonymousCall() {
		return anonymousProcedure != null;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * Renders the instruction back in source form, e.g. <code>[-&gt;+&lt;]</code>
	 * or <code>(^$)@io</code>.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return sb.toString();
	}

	void appendTo(StringBuilder sb) {
		switch (opcode) {
		case WRITE_LITERAL:
			sb.append('"').append(String.format(Locale.ROOT, "%02X", literal));
			break;
		case LOOP:
			sb.append('[');
			appendAll(sb, body);
			sb.append(']');
			break;
		case SEND:
		case RECEIVE:
			sb.append(opcode.getSymbol()).append(region);
			break;
		case CALL:
			if (anonymousProcedure != null) {
				sb.append('(');
				appendAll(sb, anonymousProcedure.getBody());
				sb.append(')');
			} else {
				sb.append(procedureName);
			}
			if (region != null) {
				sb.append('@').append(region);
			}
			break;
		default:
			sb.append(opcode.getSymbol());
			break;
		}
	}

	static void appendAll(StringBuilder sb, List<Instruction> instructions) {
		Instruction previous = null;
		for (Instruction instruction : instructions) {
			// names need a separator from whatever follows them
			if (previous != null && previous.getOpcode() != Opcode.LOOP && !isPunctuationOnly(previous)) {
				sb.append(' ');
			}
			instruction.appendTo(sb);
			previous = instruction;
		}
	}

	private static boolean isPunctuationOnly(Instruction instruction) {
		switch (instruction.getOpcode()) {
		case SEND:
		case RECEIVE:
		case CALL:
		case WRITE_LITERAL:
			return false;
		default:
			return true;
		}
	}
}
