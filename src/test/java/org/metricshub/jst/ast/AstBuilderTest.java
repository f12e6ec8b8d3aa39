package org.metricshub.jst.ast;

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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.DiagnosticKind;

public class AstBuilderTest {

	private static CompileResult compile(String source) {
		return new AstBuilder().build(new StParser().parse(source));
	}

	private static boolean hasMessage(List<Diagnostic> diagnostics, String part) {
		for (Diagnostic diagnostic : diagnostics) {
			if (diagnostic.getMessage().contains(part)) {
				return true;
			}
		}
		return false;
	}

	private static void assertWarning(String source, String part) {
		CompileResult result = compile(source);
		assertFalse(result.getDiagnostics().toString(), result.hasErrors());
		assertTrue("No warning containing '" + part + "' in " + result.getDiagnostics(), hasMessage(result.getDiagnostics(), part));
	}

	@Test
	public void testDeclarations() {
		CompileResult result = compile(
				"PROGRAM P\nVAR_INPUT start : BOOL; END_VAR\nVAR_OUTPUT level : INT; END_VAR\n" +
						"VAR CONSTANT LIMIT_HI : REAL := 9.5; END_VAR\nVAR T1 : TON := (PT := T#5s); END_VAR\nEND_PROGRAM");
		assertTrue(result.getDiagnostics().toString(), result.getDiagnostics().isEmpty());
		Program program = result.getProgram();
		assertEquals("P", program.getName());
		assertEquals(4, program.getDeclarations().size());

		Declaration start = program.findDeclaration("start");
		assertEquals(StorageClass.VAR_INPUT, start.getStorageClass());
		assertEquals(DataType.BOOL, start.getDataType());
		assertEquals("decl-start", start.getId().getValue());

		Declaration limit = program.findDeclaration("LIMIT_HI");
		assertTrue(limit.isConstant());
		assertEquals("decl-LIMIT_HI/init", limit.getInitialValue().getId().getValue());

		Declaration timer = program.findDeclaration("T1");
		assertTrue(timer.isFunctionBlock());
		assertEquals(1, timer.getPresets().size());
		assertEquals("PT", timer.getPresets().get(0).getParameter());
	}

	@Test
	public void testIdentifiersAreCaseSensitive() {
		CompileResult result = compile("VAR x : INT; END_VAR\nX := 1;");
		assertTrue(hasMessage(result.getDiagnostics(), "Undeclared variable 'X'"));
		assertNull(result.getProgram().findDeclaration("X"));
	}

	@Test
	public void testStatementIdsSurviveLayoutEdits() {
		Program a = compile("VAR a, b : BOOL; END_VAR\na := b;\nb := NOT a;").getProgram();
		Program b = compile("VAR a, b : BOOL; c : INT; END_VAR\n(* comment *)\n\n  a   :=   b ;\nc := 1;\nb := NOT a;").getProgram();
		assertEquals(a.getStatements().get(0).getId(), b.getStatements().get(0).getId());
		assertEquals(a.getStatements().get(1).getId(), b.getStatements().get(2).getId());
		assertTrue(a.getStatements().get(0).getId().getValue().startsWith("assignment-"));
	}

	@Test
	public void testChangedStatementGetsNewId() {
		Program a = compile("VAR x : INT; END_VAR\nx := 1;").getProgram();
		Program b = compile("VAR x : INT; END_VAR\nx := 2;").getProgram();
		assertNotEquals(a.getStatements().get(0).getId(), b.getStatements().get(0).getId());
	}

	@Test
	public void testDuplicateStatementsGetOrdinal() {
		Program program = compile("VAR x : INT; END_VAR\nx := x + 1;\nx := x + 1;\nx := x + 1;").getProgram();
		String first = program.getStatements().get(0).getId().getValue();
		assertEquals(first + "#2", program.getStatements().get(1).getId().getValue());
		assertEquals(first + "#3", program.getStatements().get(2).getId().getValue());
	}

	@Test
	public void testChildIds() {
		Program program = compile("VAR x : INT; y : BOOL; END_VAR\ny := x + 1 > 3;").getProgram();
		Assignment assignment = (Assignment) program.getStatements().get(0);
		String id = assignment.getId().getValue();
		assertEquals(id + "/target", assignment.getTarget().getId().getValue());
		BinaryOp comparison = (BinaryOp) assignment.getValue();
		assertEquals(id + "/value", comparison.getId().getValue());
		assertEquals(BinaryOperator.GT, comparison.getOperator());
		assertEquals(id + "/value/l", comparison.getLeft().getId().getValue());
		assertEquals(id + "/value/l/r", ((BinaryOp) comparison.getLeft()).getRight().getId().getValue());
	}

	@Test
	public void testIntegerLiterals() {
		Program program = compile("VAR x : INT; END_VAR\nx := 16#FF;\nx := 2#1010;\nx := 1_000;").getProgram();
		assertEquals(Value.ofInt(255), ((Literal) ((Assignment) program.getStatements().get(0)).getValue()).getValue());
		assertEquals(Value.ofInt(10), ((Literal) ((Assignment) program.getStatements().get(1)).getValue()).getValue());
		assertEquals(Value.ofInt(1000), ((Literal) ((Assignment) program.getStatements().get(2)).getValue()).getValue());
	}

	@Test
	public void testTimeLiteral() {
		Program program = compile("VAR t : TIME; END_VAR\nt := T#1h30m;").getProgram();
		assertEquals(Value.ofTime(5400000), ((Literal) ((Assignment) program.getStatements().get(0)).getValue()).getValue());
	}

	@Test
	public void testNamedArgumentsAreReordered() {
		Program program = compile("VAR x, y : INT; END_VAR\ny := LIMIT(MX := 10, IN := x, MN := 0);").getProgram();
		FunctionCall call = (FunctionCall) ((Assignment) program.getStatements().get(0)).getValue();
		assertEquals(StandardFunction.LIMIT, call.getFunction());
		assertEquals(Value.ofInt(0), ((Literal) call.getArguments().get(0)).getValue());
		assertEquals("x", ((VariableRef) call.getArguments().get(1)).getName());
		assertEquals(Value.ofInt(10), ((Literal) call.getArguments().get(2)).getValue());
	}

	@Test
	public void testFunctionBlockCall() {
		Program program = compile("VAR T1 : TON; go, done : BOOL; END_VAR\nT1(in := go, PT := T#2s, q => done);").getProgram();
		FunctionBlockCall call = (FunctionBlockCall) program.getStatements().get(0);
		assertEquals("T1", call.getInstanceName());
		assertNotNull(call.findInput("IN"));
		assertEquals(call.getId().getValue() + "/IN", call.findInput("IN").getId().getValue());
		assertEquals("Q", call.getOutputs().get(0).getParameter());
		assertEquals(call.getId().getValue() + "/out-Q", call.getOutputs().get(0).getTarget().getId().getValue());
	}

	@Test
	public void testMemberAccessIsUpperCased() {
		Program program = compile("VAR C1 : CTU; n : INT; END_VAR\nn := C1.cv;").getProgram();
		MemberRef member = (MemberRef) ((Assignment) program.getStatements().get(0)).getValue();
		assertEquals("CV", member.getMember());
		assertEquals("C1.CV", member.toString());
	}

	@Test
	public void testWarnings() {
		assertWarning("VAR x : FOO; END_VAR", "Unknown data type 'FOO'");
		assertWarning("VAR x : INT; x : BOOL; END_VAR", "Duplicate declaration of 'x'");
		assertWarning("y := 1;", "Undeclared variable 'y'");
		assertWarning("VAR b : BOOL; END_VAR\nb := 1;", "Type mismatch");
		assertWarning("VAR CONSTANT K : INT := 1; END_VAR\nK := 2;", "Assignment to CONSTANT 'K'");
		assertWarning("EXIT;", "EXIT outside a loop");
		assertWarning("VAR r : REAL; END_VAR\nFOR r := 1 TO 2 DO END_FOR;", "should be an INT");
		assertWarning("VAR x : INT; END_VAR\nx := FOO(1);", "Unknown function 'FOO'");
		assertWarning("VAR x : INT; END_VAR\nx := ABS(1, 2);", "called with 2 argument(s)");
		assertWarning("VAR T1 : TON; END_VAR\nT1.Q := TRUE;", "only inputs can be written");
	}

	@Test
	public void testUnknownTypeDropsDeclaration() {
		CompileResult result = compile("VAR x : FOO; y : INT; END_VAR");
		assertNull(result.getProgram().findDeclaration("x"));
		assertNotNull(result.getProgram().findDeclaration("y"));
	}

	@Test
	public void testSyntaxErrorGivesEmptyProgram() {
		CompileResult result = compile("VAR x : INT; END_VAR\nx := ;");
		assertTrue(result.hasErrors());
		assertTrue(result.getProgram().isEmpty());
		assertEquals(DiagnosticKind.SYNTAX_ERROR, result.getDiagnostics().get(0).getKind());
	}

	@Test
	public void testNullTree() {
		CompileResult result = new AstBuilder().build((org.metricshub.jst.frontend.SyntaxNode) null);
		assertTrue(result.getProgram().isEmpty());
		assertTrue(result.getDiagnostics().isEmpty());
	}

	@Test
	public void testBuildExpressionSkipsReferenceChecks() {
		AstBuilder builder = new AstBuilder();
		Expression expression = builder.buildExpression(new StParser().parseExpression("a AND NOT b").getTree());
		assertEquals(ExpressionKind.BINARY, expression.getKind());
		assertEquals("a AND NOT b", expression.toString());
		assertTrue(builder.getDiagnostics().isEmpty());
	}

	@Test
	public void testExpressionToStringKeepsParentheses() {
		Expression expression = new AstBuilder().buildExpression(new StParser().parseExpression("(a - b) - (c - d)").getTree());
		assertEquals("a - b - (c - d)", expression.toString());
	}
}
