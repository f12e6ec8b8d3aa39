package org.metricshub.jst.frontend;

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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.DiagnosticKind;
import org.metricshub.jst.util.ScriptSource;

public class StParserTest {

	private static ParseResult parse(String source) {
		return new StParser().parse(source);
	}

	private static void assertSyntaxError(String source, String messagePart) {
		ParseResult result = parse(source);
		assertFalse("Expected a syntax error for: " + source, result.isSuccess());
		assertNull(result.getTree());
		assertTrue(Diagnostic.hasKind(result.getDiagnostics(), DiagnosticKind.SYNTAX_ERROR));
		boolean found = false;
		for (Diagnostic diagnostic : result.getDiagnostics()) {
			found |= diagnostic.getMessage().contains(messagePart);
		}
		assertTrue("No diagnostic containing '" + messagePart + "' in " + result.getDiagnostics(), found);
	}

	@Test
	public void testWrappedProgram() {
		ParseResult result = parse(
				"PROGRAM Main\nVAR\n  A, B : BOOL;\n  C : INT := 3;\nEND_VAR\nA := B AND TRUE;\nEND_PROGRAM\n");
		assertTrue(result.getDiagnostics().toString(), result.isSuccess());
		SyntaxNode tree = result.getTree();
		assertEquals(SyntaxKind.PROGRAM, tree.getKind());
		assertEquals("Main", tree.getText());
		SyntaxNode block = tree.findChild(SyntaxKind.VAR_BLOCK);
		assertNotNull(block);
		assertEquals(2, block.getChildCount());
		SyntaxNode statements = tree.findChild(SyntaxKind.STATEMENT_LIST);
		assertEquals(1, statements.getChildCount());
		assertEquals(SyntaxKind.ASSIGNMENT, statements.getChild(0).getKind());
	}

	@Test
	public void testBareStatements() {
		ParseResult result = parse("x := 1; ; y := x + 2;");
		assertTrue(result.isSuccess());
		assertEquals("", result.getTree().getText());
		assertEquals(2, result.getTree().findChild(SyntaxKind.STATEMENT_LIST).getChildCount());
	}

	@Test
	public void testKeywordsAreCaseInsensitive() {
		ParseResult result = parse("if a then b := true; elsif c then b := false; end_if;");
		assertTrue(result.getDiagnostics().toString(), result.isSuccess());
		SyntaxNode ifNode = result.getTree().findChild(SyntaxKind.STATEMENT_LIST).getChild(0);
		assertEquals(SyntaxKind.IF, ifNode.getKind());
		assertEquals(2, ifNode.getChildCount());
	}

	@Test
	public void testOperatorPrecedence() {
		ParseResult result = new StParser().parseExpression("a OR b AND NOT c");
		assertTrue(result.isSuccess());
		SyntaxNode or = result.getTree();
		assertEquals(SyntaxKind.BINARY, or.getKind());
		assertEquals("OR", or.getText());
		SyntaxNode and = or.getChild(1);
		assertEquals("AND", and.getText());
		assertEquals(SyntaxKind.UNARY, and.getChild(1).getKind());
	}

	@Test
	public void testAmpersandIsAnd() {
		ParseResult result = new StParser().parseExpression("a & b");
		assertTrue(result.isSuccess());
		assertEquals("AND", result.getTree().getText());
	}

	@Test
	public void testLiterals() {
		assertEquals(SyntaxKind.INT_LITERAL, new StParser().parseExpression("16#FF").getTree().getKind());
		assertEquals(SyntaxKind.INT_LITERAL, new StParser().parseExpression("1_000").getTree().getKind());
		assertEquals(SyntaxKind.REAL_LITERAL, new StParser().parseExpression("3.25").getTree().getKind());
		assertEquals(SyntaxKind.TIME_LITERAL, new StParser().parseExpression("T#1h30m").getTree().getKind());
		assertEquals(SyntaxKind.TIME_LITERAL, new StParser().parseExpression("TIME#5s").getTree().getKind());
		assertEquals(SyntaxKind.BOOL_LITERAL, new StParser().parseExpression("false").getTree().getKind());
	}

	@Test
	public void testInvalidBasedDigit() {
		assertSyntaxError("x := 2#102;", "Invalid digit");
	}

	@Test
	public void testComments() {
		ParseResult result = parse("(* block\n comment *) x := 1; // line comment\ny := 2;");
		assertTrue(result.isSuccess());
		assertEquals(2, result.getTree().findChild(SyntaxKind.STATEMENT_LIST).getChildCount());
	}

	@Test
	public void testUnterminatedComment() {
		assertSyntaxError("x := 1; (* never closed", "Unterminated comment");
	}

	@Test
	public void testEqualsInsteadOfAssignment() {
		assertSyntaxError("x = 1;", "Expecting ':=' for an assignment, got '='");
	}

	@Test
	public void testMissingEndVar() {
		ParseResult result = parse("VAR\n  x : INT;\nx := 1;");
		assertFalse(result.isSuccess());
		assertNull(result.getTree());
	}

	@Test
	public void testRecoveryReportsSeveralErrors() {
		ParseResult result = parse("x := ;\ny := 1;\nz := * 2;\n");
		assertFalse(result.isSuccess());
		int errors = 0;
		for (Diagnostic diagnostic : result.getDiagnostics()) {
			if (diagnostic.getKind() == DiagnosticKind.SYNTAX_ERROR) {
				errors++;
			}
		}
		assertEquals(2, errors);
	}

	@Test
	public void testErrorPosition() {
		ParseResult result = parse("x := 1;\ny := ;");
		assertFalse(result.isSuccess());
		assertEquals(2, result.getDiagnostics().get(0).getSpan().getLine());
	}

	@Test
	public void testFunctionBlockCall() {
		ParseResult result = parse(
				"VAR T1 : TON := (PT := T#5s); done : BOOL; END_VAR\nT1(IN := start, PT := T#2s, Q => done);");
		assertTrue(result.getDiagnostics().toString(), result.isSuccess());
		SyntaxNode block = result.getTree().findChild(SyntaxKind.VAR_BLOCK);
		assertNotNull(block.getChild(0).findChild(SyntaxKind.INIT_LIST));
		SyntaxNode call = result.getTree().findChild(SyntaxKind.STATEMENT_LIST).getChild(0);
		assertEquals(SyntaxKind.FB_CALL, call.getKind());
		assertEquals("T1", call.getText());
		assertEquals(3, call.getChildCount());
		assertEquals(SyntaxKind.OUTPUT_ARGUMENT, call.getChild(2).getKind());
	}

	@Test
	public void testNamedFunctionArguments() {
		ParseResult result = new StParser().parseExpression("LIMIT(MN := 0, IN := x, MX := 10)");
		assertTrue(result.isSuccess());
		SyntaxNode call = result.getTree();
		assertEquals(SyntaxKind.FUNCTION_CALL, call.getKind());
		assertEquals("MN", call.getChild(0).getText());
	}

	@Test
	public void testCaseAndLoops() {
		String source = "CASE n OF\n 1, 2: x := 1;\n 3..5: x := 2;\nELSE x := 0;\nEND_CASE;\n" +
				"FOR i := 1 TO 10 BY 2 DO x := x + i; END_FOR;\n" +
				"WHILE x > 0 DO x := x - 1; IF x = 3 THEN EXIT; END_IF; END_WHILE;\n" +
				"REPEAT x := x + 1; UNTIL x >= 5 END_REPEAT;\nRETURN;";
		ParseResult result = parse(source);
		assertTrue(result.getDiagnostics().toString(), result.isSuccess());
		SyntaxNode statements = result.getTree().findChild(SyntaxKind.STATEMENT_LIST);
		assertEquals(SyntaxKind.CASE, statements.getChild(0).getKind());
		assertEquals(SyntaxKind.FOR, statements.getChild(1).getKind());
		assertEquals(SyntaxKind.WHILE, statements.getChild(2).getKind());
		assertEquals(SyntaxKind.REPEAT, statements.getChild(3).getKind());
		assertEquals(SyntaxKind.RETURN, statements.getChild(4).getKind());
	}

	@Test
	public void testCanonicalStringIgnoresLayout() {
		SyntaxNode a = parse("x := a+1;").getTree();
		SyntaxNode b = parse("(* edited *)\n  x   :=\n a + 1 ;").getTree();
		assertEquals(a.toCanonicalString(), b.toCanonicalString());
	}

	@Test
	public void testParseScriptSource() throws Exception {
		ScriptSource source = new ScriptSource("test", new StringReader("x := 1;"));
		assertTrue(new StParser().parse(source).isSuccess());
	}

	@Test
	public void testDump() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		parse("x := 1;").getTree().dump(new PrintStream(out, true));
		String dump = new String(out.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(dump, dump.contains("ASSIGNMENT"));
		assertTrue(dump, dump.contains("INT_LITERAL"));
	}
}
