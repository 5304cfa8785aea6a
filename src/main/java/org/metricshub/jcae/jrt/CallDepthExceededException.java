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

/**
 * A call would nest deeper than the configured maximum call depth.
 */
public class CallDepthExceededException extends CaeRuntimeException {

	private static final long serialVersionUID = 1L;

	private final int maxCallDepth;

	/**
	 * @param lineno line of the call instruction
	 * @param procedureLabel procedure that was about to be called
	 * @param maxCallDepth the configured limit
	 */
	public CallDepthExceededException(int lineno, String procedureLabel, int maxCallDepth) {
		super(lineno, "Calling " + procedureLabel + " exceeds the maximum call depth of " + maxCallDepth);
		this.maxCallDepth = maxCallDepth;
	}

	/**
	 * @return the configured limit
	 */
	public int getMaxCallDepth() {
		return maxCallDepth;
	}
}
