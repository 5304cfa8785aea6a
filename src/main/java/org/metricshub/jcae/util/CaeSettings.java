package org.metricshub.jcae.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A simple container for the parameters of a single Cae run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jcae programmatically, from within Java code.
 */
public class CaeSettings {

	/**
	 * Where the input instruction reads bytes from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Where the output instruction writes bytes to;
	 * <code>System.out</code> by default.
	 */
	private OutputStream outputStream = System.out;

	/**
	 * What the input instruction does once the input is exhausted;
	 * {@link EndOfInputPolicy#ZERO} by default.
	 */
	private EndOfInputPolicy endOfInputPolicy = EndOfInputPolicy.ZERO;

	/**
	 * Maximum number of nested call frames, <code>0</code> meaning no limit.
	 */
	private int maxCallDepth = 0;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		final char newLine = '\n';
		desc.append("endOfInputPolicy = ").append(getEndOfInputPolicy()).append(newLine);
		desc.append("maxCallDepth = ").append(getMaxCallDepth() == 0 ? "unlimited" : getMaxCallDepth()).append(newLine);
		return desc.toString();
	}

	/**
	 * Where input is read from.
	 * By default, this is {@link java.lang.System#in}.
	 *
	 * @return the input
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	/**
	 * @param input the input to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public OutputStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the output stream to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(OutputStream outputStream) {
		this.outputStream = outputStream;
	}

	/**
	 * @return the end-of-input policy
	 */
	public EndOfInputPolicy getEndOfInputPolicy() {
		return endOfInputPolicy;
	}

	/**
	 * @param endOfInputPolicy the end-of-input policy to set
	 */
	public void setEndOfInputPolicy(EndOfInputPolicy endOfInputPolicy) {
		if (endOfInputPolicy == null) {
			throw new IllegalArgumentException("End-of-input policy must not be null");
		}
		this.endOfInputPolicy = endOfInputPolicy;
	}

	/**
	 * Maximum number of nested call frames, <code>0</code> meaning no limit.
	 *
	 * @return the maximum call depth
	 */
	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/**
	 * @param maxCallDepth the maximum call depth, <code>0</code> for no limit
	 */
	public void setMaxCallDepth(int maxCallDepth) {
		if (maxCallDepth < 0) {
			throw new IllegalArgumentException("Maximum call depth must not be negative: " + maxCallDepth);
		}
		this.maxCallDepth = maxCallDepth;
	}
}
