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

public class TimerInstanceTest {

	private static TimerInstance timer(FunctionBlockType type, long presetMs) {
		TimerInstance timer = new TimerInstance("T1", type);
		timer.setPresetTime(presetMs);
		return timer;
	}

	@Test
	public void testOnDelay() {
		TimerInstance ton = timer(FunctionBlockType.TON, 300);
		ton.setInput(true);
		assertTrue(ton.isRunning());
		assertFalse(ton.getQ());
		ton.advance(100);
		ton.advance(100);
		assertEquals(200, ton.getElapsedTime());
		assertFalse(ton.getQ());
		ton.advance(100);
		assertTrue(ton.getQ());
		assertFalse(ton.isRunning());
		ton.advance(500);
		assertEquals("ET is clamped to PT", 300, ton.getElapsedTime());
	}

	@Test
	public void testOnDelayResetOnFallingEdge() {
		TimerInstance ton = timer(FunctionBlockType.TON, 300);
		ton.setInput(true);
		ton.advance(300);
		assertTrue(ton.getQ());
		ton.setInput(false);
		assertFalse(ton.getQ());
		assertEquals(0, ton.getElapsedTime());
	}

	@Test
	public void testOnDelayHoldingInputDoesNotRestart() {
		TimerInstance ton = timer(FunctionBlockType.TON, 300);
		ton.setInput(true);
		ton.advance(200);
		ton.setInput(true);
		assertEquals(200, ton.getElapsedTime());
	}

	@Test
	public void testOnDelayZeroPreset() {
		TimerInstance ton = timer(FunctionBlockType.TON, 0);
		ton.setInput(true);
		assertTrue(ton.getQ());
		assertFalse(ton.isRunning());
	}

	@Test
	public void testOffDelay() {
		TimerInstance tof = timer(FunctionBlockType.TOF, 200);
		tof.setInput(true);
		assertTrue(tof.getQ());
		tof.setInput(false);
		assertTrue(tof.getQ());
		assertTrue(tof.isRunning());
		tof.advance(100);
		assertTrue(tof.getQ());
		tof.advance(100);
		assertFalse(tof.getQ());
	}

	@Test
	public void testOffDelayCancelledByInput() {
		TimerInstance tof = timer(FunctionBlockType.TOF, 200);
		tof.setInput(true);
		tof.setInput(false);
		tof.advance(150);
		tof.setInput(true);
		assertTrue(tof.getQ());
		assertEquals(0, tof.getElapsedTime());
		assertFalse(tof.isRunning());
	}

	@Test
	public void testPulse() {
		TimerInstance tp = timer(FunctionBlockType.TP, 200);
		tp.setInput(true);
		assertTrue(tp.getQ());
		tp.setInput(false);
		assertTrue("The pulse ignores the input while running", tp.getQ());
		tp.advance(200);
		assertFalse(tp.getQ());
		assertEquals(0, tp.getElapsedTime());
	}

	@Test
	public void testPulseHeldInputKeepsElapsedTime() {
		TimerInstance tp = timer(FunctionBlockType.TP, 200);
		tp.setInput(true);
		tp.advance(250);
		assertFalse(tp.getQ());
		assertEquals(200, tp.getElapsedTime());
		tp.setInput(false);
		assertEquals(0, tp.getElapsedTime());
	}

	@Test
	public void testMembers() {
		TimerInstance ton = timer(FunctionBlockType.TON, 0);
		ton.setMember("PT", Value.ofTime(1500));
		ton.setMember("IN", Value.TRUE);
		assertEquals(Value.ofTime(1500), ton.getMember("PT"));
		assertEquals(Value.TRUE, ton.getMember("IN"));
		assertEquals(Value.ZERO_TIME, ton.getMember("ET"));
		assertThrows(StRuntimeException.class, () -> ton.setMember("Q", Value.TRUE));
		assertThrows(StRuntimeException.class, () -> ton.getMember("CV"));
	}

	@Test
	public void testNotATimer() {
		assertThrows(IllegalArgumentException.class, () -> new TimerInstance("C1", FunctionBlockType.CTU));
	}

	@Test
	public void testOnDelayRestartsOnWritePair() {
		TimerInstance ton = new TimerInstance("T1", FunctionBlockType.TON);
		ton.setPresetTime(1000);
		ton.setInput(true);
		ton.advance(400);
		ton.setInput(false);
		ton.setInput(true);
		assertEquals(0, ton.getElapsedTime());
		assertTrue(ton.isRunning());
		ton.advance(100);
		assertEquals(100, ton.getElapsedTime());
	}
}
