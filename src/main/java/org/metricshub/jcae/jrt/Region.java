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

import java.util.Arrays;

/**
 * A named, fixed-size buffer of unsigned bytes with its own head.
 * <p>
 * Every operation wraps: byte values stay in <code>[0, 256)</code> and
 * the head stays in <code>[0, capacity)</code>. Nothing here ever throws
 * for a region built with a positive capacity.
 */
public final class Region {

	private final String name;
	private final byte[] cells;
	private int head;

	/**
	 * @param name region name
	 * @param capacity number of cells, at least 1
	 */
	public Region(String name, int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Capacity of region '" + name + "' must be strictly positive: " + capacity);
		}
		this.name = name;
		this.cells = new byte[capacity];
		this.head = 0;
	}

	public String getName() {
		return name;
	}

	public int capacity() {
		return cells.length;
	}

	/**
	 * @return position of the head, in <code>[0, capacity)</code>
	 */
	public int getHead() {
		return head;
	}

	/**
	 * @return the byte under the head, 0 to 255
	 */
	public int get() {
		return cells[head] & 0xFF;
	}

	/**
	 * @param index cell index, taken modulo the capacity
	 * @return the byte at that cell, 0 to 255
	 */
	public int get(int index) {
		return cells[Math.floorMod(index, cells.length)] & 0xFF;
	}

	/**
	 * Stores a value under the head. Only the low 8 bits are kept.
	 *
	 * @param value the value to store
	 */
	public void set(int value) {
		cells[head] = (byte) value;
	}

	public void increment() {
		cells[head]++;
	}

	public void decrement() {
		cells[head]--;
	}

	public void moveRight() {
		move(1);
	}

	public void moveLeft() {
		move(-1);
	}

	/**
	 * @param delta number of cells to move, negative to the left
	 */
	public void move(int delta) {
		head = (int) Math.floorMod(head + (long) delta, (long) cells.length);
	}

	public void resetHead() {
		head = 0;
	}

	/**
	 * @return a copy of all the cells, as unsigned values
	 */
	public int[] snapshot() {
		int[] copy = new int[cells.length];
		for (int i = 0; i < cells.length; i++) {
			copy[i] = cells[i] & 0xFF;
		}
		return copy;
	}

	@Override
	public String toString() {
		return name + "[" + cells.length + "] head=" + head + " " + Arrays.toString(snapshot());
	}
}
