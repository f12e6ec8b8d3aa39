package org.metricshub.jst.jrt;

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

import org.junit.Test;

public class EdgeAndBistableTest {

	private static boolean clock(FunctionBlockInstance trigger, boolean clk) {
		trigger.setMember("CLK", Value.ofBool(clk));
		trigger.execute();
		return trigger.getMember("Q").asBool();
	}

	@Test
	public void testRisingEdge() {
		FunctionBlockInstance rTrig = FunctionBlockInstance.create("R1", FunctionBlockType.R_TRIG);
		assertTrue(clock(rTrig, true));
		assertFalse(clock(rTrig, true));
		assertFalse(clock(rTrig, false));
		assertTrue(clock(rTrig, true));
		assertEquals(Value.TRUE, rTrig.getMember("M"));
	}

	@Test
	public void testFallingEdge() {
		FunctionBlockInstance fTrig = FunctionBlockInstance.create("F1", FunctionBlockType.F_TRIG);
		assertFalse("M starts FALSE", clock(fTrig, false));
		assertFalse(clock(fTrig, true));
		assertTrue(clock(fTrig, false));
		assertFalse(clock(fTrig, false));
	}

	@Test
	public void testEdgeOutputsAreReadOnly() {
		FunctionBlockInstance rTrig = FunctionBlockInstance.create("R1", FunctionBlockType.R_TRIG);
		assertThrows(StRuntimeException.class, () -> rTrig.setMember("Q", Value.TRUE));
	}

	@Test
	public void testSetDominant() {
		BistableInstance sr = (BistableInstance) FunctionBlockInstance.create("B1", FunctionBlockType.SR);
		sr.setMember("S1", Value.TRUE);
		sr.setMember("R", Value.TRUE);
		sr.execute();
		assertTrue(sr.getQ1());
		sr.setMember("S1", Value.FALSE);
		sr.execute();
		assertFalse(sr.getQ1());
	}

	@Test
	public void testResetDominant() {
		BistableInstance rs = (BistableInstance) FunctionBlockInstance.create("B1", FunctionBlockType.RS);
		rs.setMember("S", Value.TRUE);
		rs.execute();
		assertTrue(rs.getQ1());
		rs.setMember("S", Value.FALSE);
		rs.execute();
		assertTrue("Latched", rs.getQ1());
		rs.setMember("S", Value.TRUE);
		rs.setMember("R1", Value.TRUE);
		rs.execute();
		assertFalse(rs.getQ1());
		assertThrows(StRuntimeException.class, () -> rs.setMember("S1", Value.TRUE));
	}
}
