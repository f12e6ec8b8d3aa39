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
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class MainTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args) throws Exception {
		try (PrintStream o = new PrintStream(out, true, "UTF-8"); PrintStream e = new PrintStream(err, true, "UTF-8")) {
			return Main.run(args, o, e);
		}
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testSuccess() throws Exception {
		assertEquals(0, run("VAR x : INT; END_VAR\nx := 2;"));
		assertTrue(new String(out.toByteArray(), StandardCharsets.UTF_8).contains("x = 2"));
	}

	@Test
	public void testCompileErrorReportsLocation() throws Exception {
		assertEquals(Main.EXIT_PROGRAM_ERROR, run("VAR x : INT; END_VAR\nx := ;"));
		assertTrue(err(), err().startsWith("StRuntimeException (line 2, column"));
	}

	@Test
	public void testBadArguments() throws Exception {
		assertEquals(Main.EXIT_USAGE, run("--bogus", "x := 1;"));
		assertTrue(err(), err().contains("Unknown parameter: --bogus"));
	}

	@Test
	public void testMissingFile() throws Exception {
		assertEquals(Main.EXIT_IO, run("-f", "does/not/exist.st"));
		assertTrue(err(), err().startsWith("Cannot read the program"));
	}
}
