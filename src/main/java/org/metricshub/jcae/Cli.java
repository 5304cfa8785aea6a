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
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jcae.intermediate.CaeProgram;
import org.metricshub.jcae.util.CaeSettings;
import org.metricshub.jcae.util.EndOfInputPolicy;
import org.metricshub.jcae.util.ScriptFileSource;
import org.metricshub.jcae.util.ScriptSource;

/**
 * Command-line interface for Jcae.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jcae.jar";
		}
		JAR_NAME = myName;
	}

	private final CaeSettings settings = new CaeSettings();
	private final PrintStream out;

	private final List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();

	private boolean dumpProgram;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream the input instruction reads from
	 * @param out stream the output instruction, the usage and the dump write to
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link CaeSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CaeSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the list of script sources specified on the command line.
	 *
	 * @return a copy of the script sources list
	 */
	public List<ScriptSource> getScriptSources() {
		return new ArrayList<ScriptSource>(scriptSources);
	}

	public boolean isDumpProgram() {
		return dumpProgram;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments are not valid
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the script itself
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				scriptSources.add(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("--eof")) {
				// --eof policy : what ',' does once the input is exhausted
				checkParameterHasArgument(args, argIdx);
				settings.setEndOfInputPolicy(EndOfInputPolicy.fromName(args[++argIdx]));
			} else if (arg.equals("--max-depth")) {
				// --max-depth n : limit the number of nested calls
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setMaxCallDepth(Integer.parseInt(value));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid maximum call depth: " + value, e);
				}
			} else if (arg.equals("--dump")) {
				dumpProgram = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSources.isEmpty()) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Cae script not provided.");
			}
			scriptSources
					.add(
							new ScriptSource(
									ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT,
									new StringReader(args[argIdx++])));
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws Exception if compilation or execution fails
	 */
	public void run() throws Exception {
		if (printUsage) {
			usage(out);
			return;
		}
		Cae cae = new Cae();
		CaeProgram program = cae.compile(scriptSources);
		if (dumpProgram) {
			// only dumping, no need to run the program
			program.dump(out);
			return;
		}
		cae.invoke(program, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]..." +
								" [--eof zero|unchanged|error]" +
								" [--max-depth n]" +
								" [--dump]" +
								" [script]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for script (may be repeated).");
		dest.println(" --eof policy = What ',' stores once the input is exhausted:");
		dest.println("                zero (default), unchanged, or error to abort the run.");
		dest.println(" --max-depth n = Abort when calls nest deeper than n frames (0 = unlimited, default).");
		dest.println(" --dump = Print the validated program instead of running it.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for program input
	 * @param os output stream for program output
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os) throws Exception {
		Cli cli = new Cli(is, os);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
