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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.util.List;
import org.junit.Test;
import org.metricshub.jst.ast.CompileResult;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.backend.ProgramSession;
import org.metricshub.jst.backend.RuntimeState;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.ladder.LadderNodeType;
import org.metricshub.jst.ladder.TransformOptions;
import org.metricshub.jst.ladder.TransformResult;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.DiagnosticKind;
import org.metricshub.jst.util.JstSettings;
import org.metricshub.jst.util.ScriptSource;

public class JstTest {

	private static final String BLINKER = "PROGRAM Blinker\n" +
			"VAR\n  T_ON : TON := (PT := T#500ms);\n  lamp : BOOL;\nEND_VAR\n" +
			"T_ON(IN := NOT lamp);\n" +
			"IF T_ON.Q THEN lamp := TRUE; END_IF;\n" +
			"END_PROGRAM\n";

	@Test
	public void testPipeline() {
		Jst jst = new Jst();
		CompileResult compiled = jst.compile(BLINKER);
		assertFalse(compiled.hasErrors());
		assertNotNull(jst.getLastSyntaxTree());
		Program program = compiled.getProgram();
		assertEquals("Blinker", program.getName());

		Store store = new Store();
		assertTrue(jst.initializeVariables(program, store).isEmpty());
		RuntimeState state = jst.createRuntimeState(program);
		for (int i = 0; i < 5; i++) {
			List<Diagnostic> diagnostics = jst.runScanCycle(program, store, state, 100);
			assertTrue(diagnostics.isEmpty());
		}
		assertTrue(store.getTimer("T_ON").getQ());
		assertFalse("lamp is set on the next scan", store.getBool("lamp"));
		jst.runScanCycle(program, store, state, 100);
		assertTrue(store.getBool("lamp"));
		assertEquals(6, state.getScanCount());
	}

	@Test
	public void testTransform() {
		Jst jst = new Jst();
		TransformResult result = jst.transform(jst.compile(BLINKER).getProgram());
		assertTrue(result.getWarnings().isEmpty());
		assertEquals(1, result.getGraph().getNodes(LadderNodeType.TIMER).size());
		assertEquals("set", result.getGraph().getNodes(LadderNodeType.COIL).get(0).get("coilType"));
	}

	@Test
	public void testTransformUsesSettings() {
		JstSettings settings = new JstSettings();
		settings.setWarnOnUnsupported(false);
		Jst jst = new Jst(settings);
		TransformResult result = jst.transform(jst.compile("VAR i : INT; END_VAR\nWHILE i < 3 DO i := i + 1; END_WHILE;").getProgram());
		assertTrue(result.getWarnings().isEmpty());
		assertEquals(1, result.getGraph().getNodes(LadderNodeType.UNSUPPORTED).size());
	}

	@Test
	public void testTransformSourceWithSyntaxError() {
		TransformResult result = new Jst().transform("IF THEN", new TransformOptions());
		assertTrue(result.getGraph().isEmpty());
		assertFalse(result.getWarnings().isEmpty());
	}

	@Test
	public void testParseScriptSource() throws Exception {
		Jst jst = new Jst();
		CompileResult compiled = jst.compile(new ScriptSource("reader", new StringReader("VAR x : INT; END_VAR\nx := 1;")));
		assertFalse(compiled.hasErrors());
		assertTrue(jst.parse(ScriptSource.of("x := ;")).getDiagnostics().size() > 0);
		assertNull(jst.getLastSyntaxTree());
	}

	@Test
	public void testLoad() {
		ProgramSession session = new Jst().load("VAR x : INT := 41; END_VAR\nx := x + 1;");
		assertTrue(session.getLoadDiagnostics().isEmpty());
		session.scan();
		assertEquals(42, session.getStore().getInt("x"));
	}

	@Test
	public void testLoopCapFromSettings() {
		JstSettings settings = new JstSettings();
		settings.setMaxLoopIterations(5);
		ProgramSession session = new Jst(settings).load("VAR x : INT; END_VAR\nREPEAT x := x + 1; UNTIL FALSE END_REPEAT;");
		assertTrue(Diagnostic.hasKind(session.scan(), DiagnosticKind.RUNTIME_FAULT));
		assertEquals(5, session.getStore().getInt("x"));
	}
}
