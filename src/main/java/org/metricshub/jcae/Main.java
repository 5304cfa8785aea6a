package org.metricshub.jcae;

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
import java.io.PrintStream;
import org.metricshub.jcae.frontend.CaeLoadException;
import org.metricshub.jcae.jrt.CaeRuntimeException;

/**
 * Entry point into the parsing, validation and execution of a Cae program
 * when Jcae is executed as a stand-alone application.
 * If you want to use Jcae as a library, please use {@link Cae}.
 */
public final class Main {

	private Main() {}

	/**
	 * The entry point to Jcae for the VM.
	 * <p>
	 * The main method is a simple call to the execute method:
	 * <blockquote>
	 *
	 * <pre>
	 * System.exit(execute(args, System.in, System.out, System.err));
	 * </pre>
	 *
	 * </blockquote>
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.in, System.out, System.err));
	}

	/**
	 * Runs the command line and reports failures on the error stream.
	 *
	 * @param args command-line arguments
	 * @param in stream the program reads from
	 * @param out stream the program writes to
	 * @param err stream for diagnostics
	 * @return the process exit code, 0 on success and 1 on any failure
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, InputStream in, PrintStream out, PrintStream err) {
		Cli cli = new Cli(in, out);
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			err.println(e.getMessage());
			return 1;
		}
		try {
			cli.run();
			return 0;
		} catch (CaeLoadException e) {
			String location = e.getLocation();
			if (location.isEmpty()) {
				err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			} else {
				err.printf("%s (%s): %s\n", e.getClass().getSimpleName(), location, e.getMessage());
			}
			return 1;
		} catch (CaeRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return 1;
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		} finally {
			out.flush();
		}
	}
}
