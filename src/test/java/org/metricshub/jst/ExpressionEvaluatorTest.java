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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.metricshub.jst.jrt.FunctionBlockType;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;

public class ExpressionEvaluatorTest {

	@Test
	public void testArithmetic() {
		assertEquals(Value.ofInt(7), ExpressionEvaluator.eval("1 + 2 * 3"));
		assertEquals(Value.ofInt(3), ExpressionEvaluator.eval("7 / 2"));
		assertEquals(Value.ofInt(1), ExpressionEvaluator.eval("7 MOD 2"));
		assertEquals(Value.ofReal(3.5), ExpressionEvaluator.eval("7 / 2.0"));
		assertEquals(Value.ofReal(8.0), ExpressionEvaluator.eval("2 ** 3"));
		assertEquals(Value.ofInt(-4), ExpressionEvaluator.eval("-(1 + 3)"));
	}

	@Test
	public void testLogic() {
		assertEquals(Value.TRUE, ExpressionEvaluator.eval("TRUE AND NOT FALSE"));
		assertEquals(Value.FALSE, ExpressionEvaluator.eval("TRUE XOR TRUE"));
		assertEquals(Value.TRUE, ExpressionEvaluator.eval("3 > 2 & 2 >= 2"));
		assertEquals(Value.TRUE, ExpressionEvaluator.eval("1 <> 2"));
		assertEquals(Value.ofInt(2), ExpressionEvaluator.eval("6 AND 3"));
	}

	@Test
	public void testTime() {
		assertEquals(Value.ofTime(1500), ExpressionEvaluator.eval("T#1s + T#500ms"));
		assertEquals(Value.ofTime(3000), ExpressionEvaluator.eval("T#1s * 3"));
		assertEquals(Value.TRUE, ExpressionEvaluator.eval("T#1m > T#59s"));
		assertEquals("T#1h30m", ExpressionEvaluator.eval("TIME#90m").toString());
	}

	@Test
	public void testStandardFunctions() {
		assertEquals(Value.ofInt(5), ExpressionEvaluator.eval("ABS(-5)"));
		assertEquals(Value.ofInt(1), ExpressionEvaluator.eval("MIN(3, 1, 2)"));
		assertEquals(Value.ofReal(3.0), ExpressionEvaluator.eval("MAX(3, 1, 2.5)"));
		assertEquals(Value.ofInt(10), ExpressionEvaluator.eval("LIMIT(0, 42, 10)"));
		assertEquals(Value.ofInt(0), ExpressionEvaluator.eval("LIMIT(MX := 10, IN := -3, MN := 0)"));
		assertEquals(Value.ofInt(20), ExpressionEvaluator.eval("SEL(TRUE, 10, 20)"));
		assertEquals(Value.ofInt(30), ExpressionEvaluator.eval("MUX(2, 10, 20, 30)"));
		assertEquals(Value.ofInt(3), ExpressionEvaluator.eval("TO_INT(2.5)"));
		assertEquals(Value.ofReal(2.0), ExpressionEvaluator.eval("SQRT(4)"));
		assertEquals(Value.ofInt(-3), ExpressionEvaluator.eval("REAL_TO_INT(-2.5)"));
		assertEquals(Value.ofReal(7.0), ExpressionEvaluator.eval("DINT_TO_LREAL(7)"));
	}

	@Test
	public void testReadsStore() {
		Store store = new Store();
		store.setInt("level", 42);
		store.initTimer("T1", FunctionBlockType.TON, 2000);
		assertEquals(Value.TRUE, ExpressionEvaluator.eval("level > 40 AND NOT T1.Q", store));
		assertEquals(Value.ofTime(2000), ExpressionEvaluator.eval("T1.pt", store));
	}

	@Test
	public void testDivisionByZeroIsZero() {
		assertEquals(Value.ofInt(0), ExpressionEvaluator.eval("1 / 0"));
	}

	@Test
	public void testErrors() {
		assertThrows(StRuntimeException.class, () -> ExpressionEvaluator.eval("1 +"));
		assertThrows(StRuntimeException.class, () -> ExpressionEvaluator.eval("TRUE + 1"));
		assertThrows(StRuntimeException.class, () -> ExpressionEvaluator.eval("unknown"));
	}
}
