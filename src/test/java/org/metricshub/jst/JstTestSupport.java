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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import org.metricshub.jst.backend.ProgramSession;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.DiagnosticKind;
import org.metricshub.jst.util.JstSettings;

/**
 * Reusable helpers for building and executing Jst tests. The class exposes
 * fluent builders ({@link #scanTest(String)} and {@link #cliTest(String)})
 * that let tests describe their programs, inputs, and expectations
 * declaratively before executing or asserting the results.
 */
public final class JstTestSupport {

	private JstTestSupport() {}

	/**
	 * Creates a builder for a test that loads a program in a
	 * {@link ProgramSession} and runs scans against it.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static ScanTestBuilder scanTest(String description) {
		return new ScanTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that exercises the {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Reads a test resource from the classpath.
	 *
	 * @param name resource name, relative to the classpath root
	 * @return its content as UTF-8 text
	 */
	public static String resource(String name) {
		InputStream in = JstTestSupport.class.getResourceAsStream("/" + name);
		if (in == null) {
			throw new IllegalArgumentException("No such test resource: " + name);
		}
		try {
			try (InputStream stream = in) {
				ByteArrayOutputStream buffer = new ByteArrayOutputStream();
				byte[] chunk = new byte[4096];
				int read;
				while ((read = stream.read(chunk)) != -1) {
					buffer.write(chunk, 0, read);
				}
				return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Outcome of a scan test: the session, so that tests can inspect the store
	 * further, and every diagnostic seen while loading and scanning.
	 */
	public static final class ScanResult {
		private final String description;
		private final ProgramSession session;
		private final List<Diagnostic> diagnostics;
		private final Map<String, Value> expectedValues;
		private final List<DiagnosticKind> expectedKinds;
		private final boolean expectNoFault;

		ScanResult(
				String description,
				ProgramSession session,
				List<Diagnostic> diagnostics,
				Map<String, Value> expectedValues,
				List<DiagnosticKind> expectedKinds,
				boolean expectNoFault) {
			this.description = description;
			this.session = session;
			this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
			this.expectedValues = expectedValues;
			this.expectedKinds = expectedKinds;
			this.expectNoFault = expectNoFault;
		}

		public ProgramSession session() {
			return session;
		}

		public List<Diagnostic> diagnostics() {
			return diagnostics;
		}

		/**
		 * @param name variable name, or {@code instance.MEMBER}
		 * @return its current value
		 */
		public Value value(String name) {
			Value value = session.getStore().snapshot().get(name);
			assertNotNull(description + ": no variable '" + name + "'", value);
			return value;
		}

		/**
		 * Asserts the recorded expectations against the store and the diagnostics.
		 */
		public void assertExpected() {
			Map<String, Value> snapshot = session.getStore().snapshot();
			for (Entry<String, Value> expected : expectedValues.entrySet()) {
				assertEquals(description + " [" + expected.getKey() + "]", expected.getValue(), snapshot.get(expected.getKey()));
			}
			for (DiagnosticKind kind : expectedKinds) {
				assertTrue(description + ": expected a " + kind + " among " + diagnostics, Diagnostic.hasKind(diagnostics, kind));
			}
			if (expectNoFault) {
				assertFalse(
						description + ": unexpected fault among " + diagnostics,
						Diagnostic.hasKind(diagnostics, DiagnosticKind.RUNTIME_FAULT));
			}
		}
	}

	/**
	 * Builder for {@link ProgramSession} based tests.
	 */
	public static final class ScanTestBuilder {
		private final String description;
		private final JstSettings settings = new JstSettings();
		private final Map<String, Value> inputs = new LinkedHashMap<String, Value>();
		private final Map<String, Value> expectedValues = new LinkedHashMap<String, Value>();
		private final List<DiagnosticKind> expectedKinds = new ArrayList<DiagnosticKind>();
		private String program;
		private int scanCount = 1;
		private long deltaMs = 100;
		private boolean expectNoFault;

		ScanTestBuilder(String description) {
			this.description = description;
		}

		public ScanTestBuilder program(String source) {
			this.program = source;
			return this;
		}

		public ScanTestBuilder maxLoopIterations(int max) {
			settings.setMaxLoopIterations(max);
			return this;
		}

		public ScanTestBuilder input(String name, boolean value) {
			return input(name, Value.ofBool(value));
		}

		public ScanTestBuilder input(String name, long value) {
			return input(name, Value.ofInt(value));
		}

		public ScanTestBuilder input(String name, Value value) {
			inputs.put(name, value);
			return this;
		}

		/**
		 * @param count number of scans to run
		 * @param elapsedMs elapsed time of each scan
		 * @return this builder
		 */
		public ScanTestBuilder scans(int count, long elapsedMs) {
			this.scanCount = count;
			this.deltaMs = elapsedMs;
			return this;
		}

		public ScanTestBuilder expect(String name, boolean value) {
			return expect(name, Value.ofBool(value));
		}

		public ScanTestBuilder expect(String name, long value) {
			return expect(name, Value.ofInt(value));
		}

		public ScanTestBuilder expect(String name, Value value) {
			expectedValues.put(name, value);
			return this;
		}

		public ScanTestBuilder expectDiagnostic(DiagnosticKind kind) {
			expectedKinds.add(kind);
			return this;
		}

		public ScanTestBuilder expectNoFault() {
			this.expectNoFault = true;
			return this;
		}

		/**
		 * Loads the program, applies the inputs and runs the scans.
		 *
		 * @return the outcome, not asserted yet
		 */
		public ScanResult run() {
			if (program == null) {
				fail(description + ": no program");
			}
			ProgramSession session = new ProgramSession(settings);
			List<Diagnostic> diagnostics = new ArrayList<Diagnostic>(session.reload(program));
			for (Entry<String, Value> input : inputs.entrySet()) {
				session.assign(input.getKey(), input.getValue());
			}
			for (int i = 0; i < scanCount; i++) {
				diagnostics.addAll(session.scan(deltaMs));
			}
			return new ScanResult(description, session, diagnostics, expectedValues, expectedKinds, expectNoFault);
		}

		public ScanResult runAndAssert() {
			ScanResult result = run();
			result.assertExpected();
			return result;
		}
	}

	/**
	 * Outcome of a CLI test.
	 */
	public static final class CliResult {
		private final String output;
		private final Throwable thrown;

		CliResult(String output, Throwable thrown) {
			this.output = output;
			this.thrown = thrown;
		}

		public String output() {
			return output;
		}

		public List<String> lines() {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			return Arrays.asList(output.replace("\r\n", "\n").split("\n"));
		}

		public Throwable thrown() {
			return thrown;
		}
	}

	/**
	 * Builder for {@link Cli} based tests.
	 */
	public static final class CliTestBuilder {
		private final String description;
		private final List<String> args = new ArrayList<String>();
		private final List<String> expectedLines = new ArrayList<String>();
		private Class<? extends Throwable> expectedException;

		CliTestBuilder(String description) {
			this.description = description;
		}

		public CliTestBuilder args(String... values) {
			args.addAll(Arrays.asList(values));
			return this;
		}

		/**
		 * Expects the output to contain this exact line.
		 *
		 * @param line expected line
		 * @return this builder
		 */
		public CliTestBuilder expectLine(String line) {
			expectedLines.add(line);
			return this;
		}

		public CliTestBuilder expectThrown(Class<? extends Throwable> type) {
			this.expectedException = type;
			return this;
		}

		public CliResult run() {
			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			Throwable thrown = null;
			try (PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
				try {
					Cli.create(args.toArray(new String[0]), out);
				} catch (IOException | RuntimeException e) {
					thrown = e;
				}
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
			return new CliResult(new String(bytes.toByteArray(), StandardCharsets.UTF_8), thrown);
		}

		public CliResult runAndAssert() {
			CliResult result = run();
			if (expectedException != null) {
				assertNotNull(description + ": expected " + expectedException.getSimpleName(), result.thrown());
				assertTrue(
						description + ": expected " + expectedException.getSimpleName() + " but got " + result.thrown(),
						expectedException.isInstance(result.thrown()));
			} else if (result.thrown() != null) {
				throw new AssertionError(description + ": unexpected exception", result.thrown());
			}
			for (String line : expectedLines) {
				assertTrue(
						description + ": missing line '" + line + "' in:\n" + result.output(),
						result.lines().contains(line));
			}
			return result;
		}
	}
}
