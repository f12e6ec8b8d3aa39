package org.metricshub.jst.backend;

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
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.jst.ast.AstBuilder;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.jrt.FunctionBlockType;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.util.Diagnostic;

public class VariableInitializerTest {

	private static Program program(String source) {
		return new AstBuilder().build(new StParser().parse(source)).getProgram();
	}

	@Test
	public void testZeroDefaults() {
		Store store = new Store();
		List<Diagnostic> diagnostics = new VariableInitializer()
				.initializeVariables(program("VAR b : BOOL; i : INT; r : REAL; t : TIME; END_VAR"), store);
		assertTrue(diagnostics.isEmpty());
		assertEquals(Value.FALSE, store.getValue("b"));
		assertEquals(Value.ZERO_INT, store.getValue("i"));
		assertEquals(Value.ZERO_REAL, store.getValue("r"));
		assertEquals(Value.ZERO_TIME, store.getValue("t"));
	}

	@Test
	public void testInitialValues() {
		Store store = new Store();
		List<Diagnostic> diagnostics = new VariableInitializer().initializeVariables(
				program("VAR a : INT := 2 * 21; r : REAL := 3; d : TIME := T#1s + T#500ms; on : BOOL := a > 40; END_VAR"),
				store);
		assertTrue(diagnostics.toString(), diagnostics.isEmpty());
		assertEquals(Value.ofInt(42), store.getValue("a"));
		assertEquals("INT is widened to REAL", Value.ofReal(3.0), store.getValue("r"));
		assertEquals(Value.ofTime(1500), store.getValue("d"));
		assertEquals("Earlier declarations are readable", Value.TRUE, store.getValue("on"));
	}

	@Test
	public void testForwardReferenceFallsBackToZero() {
		Store store = new Store();
		List<Diagnostic> diagnostics = new VariableInitializer()
				.initializeVariables(program("VAR a : INT := b + 1; b : INT := 5; END_VAR"), store);
		assertEquals(1, diagnostics.size());
		assertTrue(diagnostics.get(0).getMessage().contains("references 'b'"));
		assertFalse(diagnostics.get(0).isError());
		assertEquals(Value.ZERO_INT, store.getValue("a"));
		assertEquals(Value.ofInt(5), store.getValue("b"));
	}

	@Test
	public void testFunctionBlockPresets() {
		Store store = new Store();
		new VariableInitializer().initializeVariables(
				program("VAR T1 : TON := (PT := T#5s); C1 : CTU := (PV := 3); E1 : R_TRIG; END_VAR"),
				store);
		assertEquals(5000L, store.getTimer("T1").getPresetTime());
		assertEquals(3L, store.getCounter("C1").getPresetValue());
		assertEquals(FunctionBlockType.R_TRIG, store.getInstance("E1").getType());
	}

	@Test
	public void testTypeMismatchFallsBackToZero() {
		Store store = new Store();
		List<Diagnostic> diagnostics = new VariableInitializer().initializeVariables(program("VAR i : INT := 2.5; END_VAR"), store);
		assertEquals(1, diagnostics.size());
		assertTrue(diagnostics.get(0).getMessage().startsWith("Cannot initialize i"));
		assertEquals(Value.ZERO_INT, store.getValue("i"));
	}

	@Test
	public void testClearAndInitialize() {
		Store store = new Store();
		store.setInt("stale", 7);
		new VariableInitializer().clearAndInitialize(program("VAR fresh : INT := 1; END_VAR"), store);
		assertFalse(store.containsVariable("stale"));
		assertEquals(1, store.getInt("fresh"));
	}

	@Test
	public void testPresetOnOutputIsIgnored() {
		Store store = new Store();
		List<Diagnostic> diagnostics = new VariableInitializer().initializeVariables(
				program("VAR T1 : TON := (PT := T#1s, Q := TRUE); x : BOOL; END_VAR\nx := T1.Q;"),
				store);
		assertEquals(diagnostics.toString(), 1, diagnostics.size());
		assertTrue(diagnostics.get(0).getMessage().contains("T1.Q: only inputs can be preset"));
		assertFalse(diagnostics.get(0).isError());
		assertEquals(1000L, store.getTimer("T1").getPresetTime());
		assertFalse(store.getTimer("T1").getQ());
	}

	@Test
	public void testCounterOutputsMatchInitialValues() {
		Store store = new Store();
		new VariableInitializer().initializeVariables(program("VAR C1 : CTD; C2 : CTU; C3 : CTU := (PV := 2); END_VAR"), store);
		assertEquals(Value.TRUE, store.getInstance("C1").getMember("QD"));
		assertEquals(Value.TRUE, store.getInstance("C2").getMember("QU"));
		assertEquals(Value.FALSE, store.getInstance("C3").getMember("QU"));
	}
}
