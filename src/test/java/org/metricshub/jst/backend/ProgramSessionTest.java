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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstSettings;

public class ProgramSessionTest {

	@Test
	public void testReloadReinitializesStore() {
		ProgramSession session = new ProgramSession();
		session.reload("VAR x : INT := 1; END_VAR\nx := x + 1;");
		session.scan();
		session.scan();
		assertEquals(3, session.getStore().getInt("x"));

		List<Diagnostic> diagnostics = session.reload("VAR y : BOOL := TRUE; END_VAR");
		assertTrue(diagnostics.isEmpty());
		assertFalse(session.getStore().containsVariable("x"));
		assertTrue(session.getStore().getBool("y"));
		assertEquals(0, session.getScanCount());
	}

	@Test
	public void testSyntaxErrorLoadsEmptyProgram() {
		ProgramSession session = new ProgramSession();
		List<Diagnostic> diagnostics = session.reload("x := ;");
		assertTrue(Diagnostic.hasErrors(diagnostics));
		assertTrue(session.getProgram().isEmpty());
		assertEquals(diagnostics, session.getLoadDiagnostics());
		assertTrue(session.scan().isEmpty());
	}

	@Test
	public void testAssignConvertsAndChecks() {
		ProgramSession session = new ProgramSession();
		session.reload("VAR r : REAL; b : BOOL; END_VAR");
		session.assign("r", Value.ofInt(4));
		assertEquals(Value.ofReal(4.0), session.getStore().getValue("r"));
		assertThrows(StRuntimeException.class, () -> session.assign("b", Value.ofInt(1)));
		assertThrows(StRuntimeException.class, () -> session.assign("missing", Value.TRUE));
	}

	@Test
	public void testScanUsesConfiguredScanTime() {
		JstSettings settings = new JstSettings();
		settings.setScanTimeMs(40);
		ProgramSession session = new ProgramSession(settings);
		session.reload("VAR T1 : TON := (PT := T#100ms); END_VAR\nT1(IN := TRUE);");
		session.scan();
		session.scan();
		assertFalse(session.getStore().getTimer("T1").getQ());
		session.scan();
		assertTrue(session.getStore().getTimer("T1").getQ());
		assertEquals(120, session.getElapsedMs());
	}
}
