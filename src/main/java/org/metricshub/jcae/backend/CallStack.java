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

/**
 * Call stack used by the CVM interpreter. Frames live on the heap, so
 * deeply recursive Cae programs are only bounded by available memory
 * (or by the configured maximum depth).
 */
class CallStack {

	private final Deque<Frame> frames = new ArrayDeque<Frame>();

	void push(Frame frame) {
		frames.push(frame);
	}

	Frame pop() {
		return frames.pop();
	}

	/**
	 * @return the active frame, <code>null</code> once the program has returned
	 */
	Frame peek() {
		return frames.peek();
	}

	int depth() {
		return frames.size();
	}

	boolean isEmpty() {
		return frames.isEmpty();
	}

	void clear() {
		frames.clear();
	}
}
