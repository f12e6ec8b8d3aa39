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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Test;
import org.metricshub.jst.JstTestSupport.CliResult;
import org.metricshub.jst.jrt.StRuntimeException;

public class CliTest {

	private static String medianVotingPath() throws Exception {
		Path path = Paths.get(CliTest.class.getResource("/median-voting.st").toURI());
		return path.toString();
	}

	@Test
	public void testInlineProgram() {
		JstTestSupport
				.cliTest("inline program")
				.args("VAR x : INT := 3; y : BOOL; END_VAR\nx := x + 5;\ny := x > 7;")
				.expectLine("x = 8")
				.expectLine("y = TRUE")
				.runAndAssert();
	}

	@Test
	public void testScansAndVariables() {
		JstTestSupport
				.cliTest("-n and -v")
				.args("-n", "4", "-v", "step=2", "-v", "r=1.5", "VAR count, step : INT; r : REAL; END_VAR\ncount := count + step;")
				.expectLine("count = 8")
				.expectLine("step = 2")
				.expectLine("r = 1.5")
				.runAndAssert();
	}

	@Test
	public void testTimerAcrossScans() {
		String program = "VAR T1 : TON := (PT := T#250ms); END_VAR\nT1(IN := TRUE);";
		JstTestSupport.cliTest("not elapsed").args("-n", "2", "-t", "100", program).expectLine("T1.Q = FALSE").runAndAssert();
		JstTestSupport
				.cliTest("elapsed")
				.args("-n", "3", "-t", "100", program)
				.expectLine("T1.Q = TRUE")
				.expectLine("T1.ET = T#250ms")
				.runAndAssert();
	}

	@Test
	public void testProgramFile() throws Exception {
		JstTestSupport
				.cliTest("median voting file")
				.args("-f", medianVotingPath(), "-v", "LEVEL_1=30", "-v", "LEVEL_2=50", "-v", "LEVEL_3=70")
				.expectLine("EFFECTIVE_LEVEL = 50")
				.expectLine("ALM_SENSOR_DISAGREE = TRUE")
				.expectLine("SPREAD = 40")
				.runAndAssert();
	}

	@Test
	public void testLadder() {
		CliResult result = JstTestSupport
				.cliTest("ladder")
				.args("--ladder", "VAR a, b, y : BOOL; END_VAR\ny := a AND NOT b;")
				.runAndAssert();
		JsonObject graph = JsonParser.parseString(result.output()).getAsJsonObject();
		assertEquals(5, graph.getAsJsonArray("nodes").size());
		assertEquals(4, graph.getAsJsonArray("edges").size());
	}

	@Test
	public void testLadderWarnings() {
		CliResult result = JstTestSupport
				.cliTest("ladder warnings")
				.args("--ladder", "VAR i : INT; END_VAR\nWHILE i < 3 DO i := i + 1; END_WHILE;")
				.runAndAssert();
		assertTrue(result.output(), result.output().contains("Skipped: "));
	}

	@Test
	public void testDumpAst() {
		CliResult result = JstTestSupport
				.cliTest("dump AST")
				.args("--dump-ast", "PROGRAM Demo\nVAR x : INT; END_VAR\nx := 1;\nEND_PROGRAM")
				.expectLine("PROGRAM Demo")
				.runAndAssert();
		assertTrue(result.output(), result.output().contains("assignment-"));
		assertTrue("the program is not run", !result.lines().contains("x = 1"));
	}

	@Test
	public void testSyntaxError() {
		CliResult result = JstTestSupport
				.cliTest("syntax error")
				.args("x := ;")
				.expectThrown(StRuntimeException.class)
				.runAndAssert();
		assertTrue(result.output(), result.output().contains("SYNTAX_ERROR"));
	}

	@Test
	public void testUsage() {
		JstTestSupport.cliTest("no arguments").expectLine("Usage:").runAndAssert();
		JstTestSupport.cliTest("-h").args("-h").expectLine("Usage:").runAndAssert();
	}

	@Test
	public void testBadArguments() {
		JstTestSupport.cliTest("bad count").args("-n", "many", "x := 1;").expectThrown(IllegalArgumentException.class).runAndAssert();
		JstTestSupport.cliTest("unknown option").args("--bogus", "x := 1;").expectThrown(IllegalArgumentException.class).runAndAssert();
		JstTestSupport.cliTest("missing program").args("-n", "1").expectThrown(IllegalArgumentException.class).runAndAssert();
		JstTestSupport.cliTest("bad -v").args("-v", "novalue", "x := 1;").expectThrown(IllegalArgumentException.class).runAndAssert();
	}
}
