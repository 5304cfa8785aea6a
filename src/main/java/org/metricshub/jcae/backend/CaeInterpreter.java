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

import java.io.IOException;
import org.metricshub.jcae.intermediate.CaeProgram;

/**
 * Interpret a Cae program within this JVM.
 */
public interface CaeInterpreter {
	/**
	 * Runs the <code>main</code> procedure of the program on the
	 * <code>main</code> region until it returns.
	 *
	 * @param program The validated program to run.
	 * @throws IOException in case of I/O problems with the input or output streams
	 * @throws org.metricshub.jcae.jrt.CaeRuntimeException when an environmental
	 *         limit is hit (input exhausted under the ERROR policy, call depth)
	 */
	void interpret(CaeProgram program) throws IOException;
}
