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
import org.metricshub.jst.JstTestSupport;
import org.metricshub.jst.JstTestSupport.ScanResult;
import org.metricshub.jst.ast.AstBuilder;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.DiagnosticKind;

public class ScanCycleInterpreterTest {

	private static final String MOTOR = "VAR_INPUT start, stop : BOOL; END_VAR\n" +
			"VAR_OUTPUT motor : BOOL; END_VAR\n" +
			"motor := (start OR motor) AND NOT stop;";

	@Test
	public void testSealIn() {
		ScanResult result = JstTestSupport
				.scanTest("seal-in circuit")
				.program(MOTOR)
				.input("start", true)
				.expect("motor", true)
				.expectNoFault()
				.runAndAssert();
		ProgramSession session = result.session();
		session.assign("start", Value.FALSE);
		session.scan();
		assertTrue("motor stays latched", session.getStore().getBool("motor"));
		session.assign("stop", Value.TRUE);
		session.scan();
		assertFalse(session.getStore().getBool("motor"));
	}

	@Test
	public void testStatementsSeeEarlierWrites() {
		JstTestSupport
				.scanTest("source order")
				.program("VAR a, b : INT; END_VAR\na := 1;\nb := a + 1;\na := b * 10;")
				.expect("a", 20)
				.expect("b", 2)
				.runAndAssert();
	}

	@Test
	public void testOnDelayTimerCall() {
		String program = "VAR_INPUT go : BOOL; END_VAR\nVAR T1 : TON; done : BOOL; END_VAR\n" +
				"T1(IN := go, PT := T#300ms, Q => done);";
		JstTestSupport
				.scanTest("TON after two scans")
				.program(program)
				.input("go", true)
				.scans(2, 100)
				.expect("T1.Q", false)
				.expect("T1.ET", Value.ofTime(200))
				.runAndAssert();
		JstTestSupport
				.scanTest("TON after three scans, output copied before time advance")
				.program(program)
				.input("go", true)
				.scans(3, 100)
				.expect("T1.Q", true)
				.expect("done", false)
				.runAndAssert();
		JstTestSupport
				.scanTest("TON output seen on the next call")
				.program(program)
				.input("go", true)
				.scans(4, 100)
				.expect("done", true)
				.runAndAssert();
	}

	@Test
	public void testCounterCall() {
		JstTestSupport
				.scanTest("CTU counts the rising edges of a toggling input")
				.program("VAR C1 : CTU; pulse, full : BOOL; END_VAR\npulse := NOT pulse;\nC1(CU := pulse, PV := 2, Q => full);")
				.scans(3, 100)
				.expect("C1.CV", 2)
				.expect("full", true)
				.expectNoFault()
				.runAndAssert();
	}

	@Test
	public void testMemberAssignment() {
		JstTestSupport
				.scanTest("inputs written through member access")
				.program("VAR T1 : TON; END_VAR\nT1.PT := T#1s;\nT1.IN := TRUE;")
				.scans(1, 400)
				.expect("T1.ET", Value.ofTime(400))
				.expectNoFault()
				.runAndAssert();
	}

	@Test
	public void testLoops() {
		JstTestSupport
				.scanTest("FOR, WHILE with EXIT, REPEAT")
				.program(
						"VAR i, sum, down, w, r : INT; END_VAR\n" +
								"FOR i := 1 TO 10 DO sum := sum + i; END_FOR;\n" +
								"FOR i := 10 TO 1 BY -3 DO down := down + 1; END_FOR;\n" +
								"WHILE TRUE DO w := w + 1; IF w = 4 THEN EXIT; END_IF; END_WHILE;\n" +
								"REPEAT r := r + 2; UNTIL r >= 5 END_REPEAT;")
				.expect("sum", 55)
				.expect("down", 4)
				.expect("w", 4)
				.expect("r", 6)
				.expectNoFault()
				.runAndAssert();
	}

	@Test
	public void testCase() {
		String program = "VAR_INPUT n : INT; END_VAR\nVAR x : INT; END_VAR\n" +
				"CASE n OF\n 1, 2: x := 10;\n 3..5: x := 20;\nELSE x := -1;\nEND_CASE;";
		JstTestSupport.scanTest("CASE list").program(program).input("n", 2).expect("x", 10).runAndAssert();
		JstTestSupport.scanTest("CASE range").program(program).input("n", 5).expect("x", 20).runAndAssert();
		JstTestSupport.scanTest("CASE else").program(program).input("n", 9).expect("x", -1).runAndAssert();
	}

	@Test
	public void testReturnSkipsRemainingStatements() {
		JstTestSupport
				.scanTest("RETURN")
				.program("VAR a, b : INT; END_VAR\na := 1;\nIF a = 1 THEN RETURN; END_IF;\nb := 1;")
				.expect("a", 1)
				.expect("b", 0)
				.runAndAssert();
	}

	@Test
	public void testConstantWriteFaultKeepsEarlierWrites() {
		ScanResult result = JstTestSupport
				.scanTest("CONSTANT write")
				.program("VAR a, b : INT; END_VAR\nVAR CONSTANT K : INT := 5; END_VAR\na := 1;\nK := 2;\nb := 3;")
				.expect("a", 1)
				.expect("b", 0)
				.expect("K", 5)
				.expectDiagnostic(DiagnosticKind.RUNTIME_FAULT)
				.runAndAssert();
		assertEquals(1, result.session().getScanCount());
	}

	@Test
	public void testRealToIntIsAFault() {
		JstTestSupport
				.scanTest("REAL to INT")
				.program("VAR i : INT; r : REAL := 1.5; END_VAR\ni := r;")
				.expect("i", 0)
				.expectDiagnostic(DiagnosticKind.RUNTIME_FAULT)
				.runAndAssert();
	}

	@Test
	public void testIntToRealIsWidened() {
		JstTestSupport
				.scanTest("INT to REAL")
				.program("VAR i : INT := 7; r : REAL; END_VAR\nr := i;")
				.expect("r", Value.ofReal(7.0))
				.expectNoFault()
				.runAndAssert();
	}

	@Test
	public void testForStepZero() {
		ScanResult result = JstTestSupport
				.scanTest("FOR BY 0")
				.program("VAR i : INT; END_VAR\nFOR i := 1 TO 3 BY 0 DO END_FOR;")
				.expectDiagnostic(DiagnosticKind.RUNTIME_FAULT)
				.runAndAssert();
		assertTrue(result.diagnostics().toString().contains("FOR loop step must not be 0"));
	}

	@Test
	public void testLoopCap() {
		ScanResult result = JstTestSupport
				.scanTest("endless WHILE")
				.program("VAR x : INT; END_VAR\nWHILE TRUE DO x := x + 1; END_WHILE;")
				.maxLoopIterations(10)
				.expect("x", 10)
				.expectDiagnostic(DiagnosticKind.RUNTIME_FAULT)
				.runAndAssert();
		assertTrue(result.diagnostics().toString().contains("Loop exceeded 10 iterations"));
	}

	@Test
	public void testDivisionByZero() {
		ScanResult result = JstTestSupport
				.scanTest("INT division by zero")
				.program("VAR a, b, m : INT; END_VAR\na := 10 / b;\nm := 10 MOD b;")
				.expect("a", 0)
				.expect("m", 0)
				.expectDiagnostic(DiagnosticKind.SEMANTIC_WARNING)
				.expectNoFault()
				.runAndAssert();
		assertTrue(result.diagnostics().toString().contains("Division by zero, result forced to 0"));
	}

	@Test
	public void testTimeAdvancesAfterFault() {
		JstTestSupport
				.scanTest("timers run even when the scan faults")
				.program("VAR T1 : TON; END_VAR\nVAR CONSTANT K : INT := 1; END_VAR\nT1(IN := TRUE, PT := T#200ms);\nK := 2;")
				.scans(2, 100)
				.expect("T1.Q", true)
				.expectDiagnostic(DiagnosticKind.RUNTIME_FAULT)
				.runAndAssert();
	}

	@Test
	public void testTemporariesResetEveryScan() {
		JstTestSupport
				.scanTest("VAR_TEMP")
				.program("VAR_TEMP t : INT; END_VAR\nVAR total : INT; END_VAR\nt := t + 1;\ntotal := total + t;")
				.scans(3, 100)
				.expect("total", 3)
				.runAndAssert();
	}

	@Test
	public void testReentrantScanIsRejected() {
		Program program = new AstBuilder().build(new StParser().parse("VAR x : INT; END_VAR\nx := x + 1;")).getProgram();
		Store store = new Store();
		new VariableInitializer().initializeVariables(program, store);
		ScanCycleInterpreter interpreter = new ScanCycleInterpreter();
		RuntimeState state = interpreter.createRuntimeState(program);
		assertTrue(state.enterScan());
		List<Diagnostic> diagnostics = interpreter.runScanCycle(program, store, state, 100);
		assertTrue(Diagnostic.hasKind(diagnostics, DiagnosticKind.RUNTIME_FAULT));
		assertEquals(0, store.getInt("x"));
		assertTrue(state.isInScan());
	}

	@Test
	public void testNegativeDelta() {
		Program program = Program.empty();
		ScanCycleInterpreter interpreter = new ScanCycleInterpreter();
		RuntimeState state = interpreter.createRuntimeState(program);
		assertThrows(IllegalArgumentException.class, () -> interpreter.runScanCycle(program, new Store(), state, -1));
	}

	@Test
	public void testCounters() {
		ScanResult result = JstTestSupport
				.scanTest("scan counters")
				.program("VAR x : INT; END_VAR\nx := x + 1;")
				.scans(4, 250)
				.expect("x", 4)
				.runAndAssert();
		assertEquals(4, result.session().getScanCount());
		assertEquals(1000, result.session().getElapsedMs());
		assertFalse(result.session().getRuntimeState().isInScan());
	}

	@Test
	public void testUndeclaredVariableFault() {
		ProgramSession session = new ProgramSession();
		session.reload("VAR a : INT; END_VAR\na := a + 1;\nb := 2;\na := a + 100;");
		for (int scan = 1; scan <= 2; scan++) {
			List<Diagnostic> diagnostics = session.scan();
			assertEquals(diagnostics.toString(), 1, diagnostics.size());
			Diagnostic fault = diagnostics.get(0);
			assertEquals(DiagnosticKind.RUNTIME_FAULT, fault.getKind());
			assertTrue(fault.getMessage().contains("Undeclared variable 'b'"));
			assertEquals(3, fault.getSpan().getLine());
			assertEquals(1, fault.getSpan().getColumn());
			assertEquals("statements after the fault are skipped", scan, session.getStore().getInt("a"));
		}
		assertEquals(2, session.getScanCount());
	}

	@Test
	public void testTimerInputEdgesFollowWrites() {
		ScanResult result = JstTestSupport
				.scanTest("TON restarted within one scan")
				.program(
						"VAR T1 : TON := (PT := T#1s); restart : BOOL; END_VAR\n" +
								"T1.IN := TRUE;\n" +
								"IF restart THEN T1.IN := FALSE; T1.IN := TRUE; END_IF;")
				.scans(3, 100)
				.expect("T1.ET", Value.ofTime(300))
				.expectNoFault()
				.runAndAssert();
		ProgramSession session = result.session();
		session.assign("restart", Value.TRUE);
		session.scan(100);
		assertEquals("the FALSE then TRUE writes restart the delay", 100, session.getStore().getTimer("T1").getElapsedTime());
		assertTrue(session.getStore().getTimer("T1").isRunning());

		session.assign("restart", Value.FALSE);
		session.scan(100);
		assertEquals("holding IN keeps the delay running", 200, session.getStore().getTimer("T1").getElapsedTime());
	}
}
