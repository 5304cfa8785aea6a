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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.jcae.backend.CVM;
import org.metricshub.jcae.frontend.CaeParser;
import org.metricshub.jcae.frontend.ParsedProgram;
import org.metricshub.jcae.frontend.ProgramValidator;
import org.metricshub.jcae.intermediate.CaeProgram;
import org.metricshub.jcae.jrt.RegionStore;
import org.metricshub.jcae.util.CaeLogger;
import org.metricshub.jcae.util.CaeSettings;
import org.metricshub.jcae.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, validation and execution of a Cae program.
 * This entry point is used both when Jcae is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute a Cae program is as follows:
 * <ul>
 * <li>Tokenize and parse each script source, collecting region and
 * procedure declarations.
 * <li>Validate the declarations: no duplicates, no dangling reference,
 * a region and a procedure named <code>main</code>.
 * <li>Run procedure <code>main</code> on region <code>main</code> with the
 * {@link CVM}.
 * </ul>
 * Any error of the first two steps is reported before anything runs.
 *
 * @see org.metricshub.jcae.backend.CVM
 */
public class Cae {

	private static final Logger LOG = CaeLogger.getLogger(Cae.class);

	/**
	 * Compiles a program given as text.
	 *
	 * @param script program text
	 * @return the validated program
	 * @throws IOException upon an IO error
	 * @throws org.metricshub.jcae.frontend.CaeLoadException if the program is not valid
	 */
	public CaeProgram compile(String script) throws IOException {
		return compile(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(script)));
	}

	/**
	 * Compiles the specified script sources into one program.
	 *
	 * @param scripts script sources, parsed in this order
	 * @return the validated program
	 * @throws IOException upon an IO error
	 * @throws org.metricshub.jcae.frontend.CaeLoadException if the program is not valid
	 */
	public CaeProgram compile(ScriptSource... scripts) throws IOException {
		return compile(Arrays.asList(scripts));
	}

	/**
	 * Compiles the specified script sources into one program. Declarations
	 * may be spread over several sources, but each declaration must be
	 * complete within its source.
	 *
	 * @param scripts script sources, parsed in this order
	 * @return the validated program
	 * @throws IOException upon an IO error
	 * @throws org.metricshub.jcae.frontend.CaeLoadException if the program is not valid
	 */
	public CaeProgram compile(List<ScriptSource> scripts) throws IOException {
		if (scripts == null || scripts.isEmpty()) {
			throw new IOException("No script sources supplied");
		}
		CaeParser parser = new CaeParser();
		ParsedProgram parsed = new ParsedProgram();
		for (ScriptSource script : scripts) {
			parser.parse(script, parsed);
		}
		return new ProgramValidator().validate(parsed);
	}

	/**
	 * Runs a compiled program with the provided {@link CaeSettings}.
	 *
	 * @param program validated program
	 * @param settings input and output streams and limits of the run
	 * @return the memory as the program left it
	 * @throws IOException upon an IO error of the streams
	 * @throws org.metricshub.jcae.jrt.CaeRuntimeException if an environmental limit is hit
	 */
	public RegionStore invoke(CaeProgram program, CaeSettings settings) throws IOException {
		if (LOG.isDebugEnabled()) {
			LOG.debug("Running with settings:\n{}", settings.toDescriptionString());
		}
		CVM cvm = new CVM(settings);
		cvm.interpret(program);
		return cvm.getRegions();
	}

	/**
	 * Compiles and runs a single {@link ScriptSource}.
	 *
	 * @param script script source to compile and run
	 * @param settings runtime settings such as input and output streams
	 * @return the memory as the program left it
	 * @throws IOException upon an IO error
	 */
	public RegionStore invoke(ScriptSource script, CaeSettings settings) throws IOException {
		return invoke(Collections.singletonList(script), settings);
	}

	/**
	 * Compiles and runs the specified list of {@link ScriptSource}s.
	 *
	 * @param scripts list of script sources to compile and run
	 * @param settings runtime settings such as input and output streams
	 * @return the memory as the program left it
	 * @throws IOException upon an IO error
	 */
	public RegionStore invoke(List<ScriptSource> scripts, CaeSettings settings) throws IOException {
		return invoke(compile(scripts), settings);
	}

	/**
	 * Executes the specified program against the given input and returns the
	 * bytes it printed.
	 *
	 * @param script program text
	 * @param input bytes available to the input instruction
	 * @return the printed bytes
	 * @throws IOException if an I/O error occurs
	 */
	public byte[] run(String script, byte[] input) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		run(new StringReader(script), new ByteArrayInputStream(input), out);
		return out.toByteArray();
	}

	/**
	 * Executes the specified program against the given input and returns the
	 * printed bytes as a String. Both sides use ISO-8859-1 so that every
	 * byte maps to exactly one character.
	 *
	 * @param script program text
	 * @param input characters available to the input instruction
	 * @return result of the execution as a String
	 * @throws IOException if an I/O error occurs
	 */
	public String run(String script, String input) throws IOException {
		byte[] output = run(script, input.getBytes(StandardCharsets.ISO_8859_1));
		return new String(output, StandardCharsets.ISO_8859_1);
	}

	/**
	 * Executes the specified program against the given input and writes the
	 * result to the provided {@link OutputStream}.
	 *
	 * @param script program text (as a {@link Reader})
	 * @param input bytes available to the input instruction
	 * @param output destination for the printed bytes
	 * @throws IOException if an I/O error occurs
	 */
	public void run(Reader script, InputStream input, OutputStream output) throws IOException {
		CaeSettings settings = new CaeSettings();
		settings.setInput(input);
		settings.setOutputStream(output);
		invoke(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, script), settings);
	}
}
