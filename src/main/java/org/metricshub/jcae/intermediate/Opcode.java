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

/**
 * The kinds of instruction a Cae procedure body is made of.
 * <p>
 * "Current region" below is the <code>here</code> region of the active call
 * frame, and "head byte" the cell under that region's head.
 */
public enum Opcode {
	/** <code>+</code>: adds 1 to the head byte, modulo 256. */
	INCREMENT('+'),
	/** <code>-</code>: subtracts 1 from the head byte, modulo 256. */
	DECREMENT('-'),
	/** <code>&gt;</code>: moves the head right, wrapping to 0 past the last cell. */
	MOVE_RIGHT('>'),
	/** <code>&lt;</code>: moves the head left, wrapping to the last cell past 0. */
	MOVE_LEFT('<'),
	/** <code>~</code>: moves the head back to cell 0. */
	RESET_HEAD('~'),
	/**
	 * <code>"XX</code>: stores a byte literal at the head.
	 * <p>
	 * Argument: the byte value
	 */
	WRITE_LITERAL('"'),
	/** <code>.</code>: writes the head byte to the output. */
	OUTPUT('.'),
	/** <code>,</code>: reads one byte of input into the head. */
	INPUT(','),
	/**
	 * <code>[...]</code>: runs its body while the head byte, tested before
	 * each iteration, is not 0.
	 * <p>
	 * Argument: the loop body
	 */
	LOOP('['),
	/**
	 * <code>^ref</code>: copies the head byte into the head of the referenced region.
	 * <p>
	 * Argument: region reference
	 */
	SEND('^'),
	/**
	 * <code>&amp;ref</code>: copies the head byte of the referenced region into the head.
	 * <p>
	 * Argument: region reference
	 */
	RECEIVE('&'),
	/**
	 * Calls a named or anonymous procedure, optionally against another region.
	 * <p>
	 * Argument 1: procedure name, or the anonymous procedure itself<br/>
	 * Argument 2: optional region reference
	 */
	CALL('\0');

	private final char symbol;

	Opcode(char symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the source character introducing this instruction,
	 *         <code>'\0'</code> for calls which start with a name or a parenthesis
	 */
	public char getSymbol() {
		return symbol;
	}
}
