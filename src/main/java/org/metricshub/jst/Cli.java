package org.metricshub.jst;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jst
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
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jst.ast.AstPrinter;
import org.metricshub.jst.ast.CompileResult;
import org.metricshub.jst.backend.ProgramSession;
import org.metricshub.jst.frontend.ParseResult;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.ladder.TransformOptions;
import org.metricshub.jst.ladder.TransformResult;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstSettings;
import org.metricshub.jst.util.ScriptFileSource;
import org.metricshub.jst.util.ScriptSource;

/**
 * Command-line interface for Jst.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jst.jar";
		}
		JAR_NAME = myName;
	}

	private final JstSettings settings = new JstSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean dumpSyntaxTree;
	private boolean dumpAst;
	private boolean ladder;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where the results are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link JstSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JstSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given with <code>-f</code> or inline, or
	 *         {@code null} when only usage was requested
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isLadder() {
		return ladder;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
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
				// end of options: the inline program follows
				break;
			} else if (arg.equals("-v")) {
				// -v name=val : assign a variable after initialization
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-n")) {
				// -n count : number of scans to run
				checkParameterHasArgument(args, argIdx);
				settings.setScanCount(parseNumber(arg, args[++argIdx]));
			} else if (arg.equals("-t")) {
				// -t ms : scan time
				checkParameterHasArgument(args, argIdx);
				settings.setScanTimeMs(parseNumber(arg, args[++argIdx]));
			} else if (arg.equals("--max-loop")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxLoopIterations(parseNumber(arg, args[++argIdx]));
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--dump-ast")) {
				dumpAst = true;
			} else if (arg.equals("--ladder")) {
				ladder = true;
			} else if (arg.equals("--intermediates")) {
				settings.setIncludeIntermediates(true);
			} else if (arg.equals("--no-warn-unsupported")) {
				settings.setWarnOnUnsupported(false);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
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

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Structured Text program not provided.");
			}
			scriptSource = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[argIdx++]));
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

	private static int parseNumber(String option, String value) {
		try {
			int number = Integer.parseInt(value);
			if (number < 0) {
				throw new IllegalArgumentException(option + " expects a non-negative number, got " + value);
			}
			return number;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects a number, got '" + value + "'", e);
		}
	}

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)");

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}, the value being
	 *        an ST literal
	 */
	private static void addVariable(JstSettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException("keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		settings.putVariable(m.group(1), m.group(2));
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException when the program file cannot be read
	 * @throws StRuntimeException when the program does not compile or a
	 *         <code>-v</code> assignment does not apply
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		Jst jst = new Jst(settings);
		String source = scriptSource.readContent();

		if (dumpSyntaxTree) {
			ParseResult parsed = jst.parse(source);
			if (parsed.getTree() != null) {
				parsed.getTree().dump(out);
			}
		}
		CompileResult compiled = jst.compile(source);
		if (dumpAst) {
			new AstPrinter(out).dump(compiled.getProgram());
		}
		if (ladder) {
			TransformResult result = compiled.hasErrors()
					? jst.transform(source, TransformOptions.from(settings))
					: jst.transform(compiled.getProgram());
			out.println(result.getGraph().toJson());
			printDiagnostics(result.getWarnings());
			return;
		}
		if (dumpSyntaxTree || dumpAst) {
			// If only dumping information, no need to run the program
			printDiagnostics(compiled.getDiagnostics());
			return;
		}
		if (compiled.hasErrors()) {
			printDiagnostics(compiled.getDiagnostics());
			Diagnostic first = firstError(compiled.getDiagnostics());
			throw new StRuntimeException(first.getSpan(), first.getMessage());
		}

		ProgramSession session = new ProgramSession(settings);
		printDiagnostics(compiled.getDiagnostics());
		printDiagnostics(session.load(compiled.getProgram()));
		for (Entry<String, String> variable : settings.getVariables().entrySet()) {
			Value value = ExpressionEvaluator.eval(variable.getValue());
			session.assign(variable.getKey(), value);
		}
		for (int i = 0; i < settings.getScanCount(); i++) {
			printDiagnostics(session.scan());
		}
		printVariables(session.getStore().snapshot());
	}

	private static Diagnostic firstError(List<Diagnostic> diagnostics) {
		for (Diagnostic diagnostic : diagnostics) {
			if (diagnostic.isError()) {
				return diagnostic;
			}
		}
		throw new IllegalStateException("No error among " + diagnostics.size() + " diagnostic(s)");
	}

	private void printDiagnostics(List<Diagnostic> diagnostics) {
		for (Diagnostic diagnostic : diagnostics) {
			out.println(diagnostic);
		}
	}

	private void printVariables(Map<String, Value> variables) {
		for (Entry<String, Value> entry : variables.entrySet()) {
			out.println(entry.getKey() + " = " + entry.getValue());
		}
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
								" [-f program-filename]" +
								" [-n scans]" +
								" [-t scan-ms]" +
								" [--max-loop iterations]" +
								" [-v name=val]..." +
								" [--dump-syntax]" +
								" [--dump-ast]" +
								" [--ladder [--intermediates] [--no-warn-unsupported]]" +
								" [program]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for the program.");
		dest.println(" -n scans = Number of scan cycles to run (default 1).");
		dest.println(" -t ms = Elapsed time of each scan in milliseconds (default 100).");
		dest.println(" --max-loop n = Iterations allowed per loop before a runtime fault (default 100000).");
		dest.println(" -v name=val = Variable assignment applied after initialization; val is an ST literal.");
		dest.println();
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --dump-ast = Print the AST with its node ids.");
		dest.println(" --ladder = Print the ladder diagram as JSON instead of running the program.");
		dest.println(" --intermediates = Also lower assignments nested in IF and CASE bodies.");
		dest.println(" --no-warn-unsupported = Render unsupported statements as marker nodes.");
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
	 * @param os output stream for the results
	 * @return configured and executed CLI instance
	 * @throws IOException if the program cannot be read
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
