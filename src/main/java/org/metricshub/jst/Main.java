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
import java.io.IOException;
import java.io.PrintStream;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.util.SourceSpan;

/**
 * Entry point of Jst when executed as a stand-alone application.
 * If you want to use Jst as a library, please use {@link Jst}.
 * <p>
 * Exit status: 0 on success, 1 when the program does not compile or a
 * <code>-v</code> assignment is rejected, 2 on bad arguments, 3 when the
 * program file cannot be read.
 */
public final class Main {

	static final int EXIT_PROGRAM_ERROR = 1;
	static final int EXIT_USAGE = 2;
	static final int EXIT_IO = 3;

	@SuppressWarnings("unused")
	private Main() {}

	/**
	 * The entry point to Jst for the VM.
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		int status = run(args, System.out, System.err);
		if (status != 0) {
			System.exit(status);
		}
	}

	/**
	 * Runs the CLI and turns its failures into messages and exit codes.
	 *
	 * @param args command line arguments
	 * @param out destination of the results
	 * @param err destination of the error messages
	 * @return the exit status
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	static int run(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (StRuntimeException e) {
			SourceSpan span = e.getSpan();
			if (span.isKnown()) {
				err.printf("%s (line %d, column %d): %s\n", e.getClass().getSimpleName(), span.getLine(), span.getColumn(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return EXIT_PROGRAM_ERROR;
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println("Please see the help/usage output (cmd line switch '-h').");
			return EXIT_USAGE;
		} catch (IOException e) {
			err.printf("Cannot read the program: %s\n", e.getMessage());
			return EXIT_IO;
		}
	}
}
