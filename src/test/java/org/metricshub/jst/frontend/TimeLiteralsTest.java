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
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class TimeLiteralsTest {

	@Test
	public void testParseUnits() {
		assertEquals(5000L, TimeLiterals.parse("T#5s"));
		assertEquals(250L, TimeLiterals.parse("T#250ms"));
		assertEquals(5400000L, TimeLiterals.parse("T#1h30m"));
		assertEquals(2L * 86400000L + 4L * 3600000L, TimeLiterals.parse("TIME#2d_4h"));
	}

	@Test
	public void testParseIsCaseInsensitive() {
		assertEquals(1500L, TimeLiterals.parse("t#1s500MS"));
		assertEquals(60000L, TimeLiterals.parse("time#1M"));
	}

	@Test
	public void testParseFractionAndSign() {
		assertEquals(1500L, TimeLiterals.parse("T#1.5s"));
		assertEquals(-200L, TimeLiterals.parse("T#-200ms"));
	}

	@Test
	public void testParseRejectsUnknownUnit() {
		assertThrows(IllegalArgumentException.class, () -> TimeLiterals.parse("T#5x"));
		assertThrows(IllegalArgumentException.class, () -> TimeLiterals.parse("T#"));
		assertThrows(IllegalArgumentException.class, () -> TimeLiterals.parse("T#s"));
	}

	@Test
	public void testFormat() {
		assertEquals("T#0ms", TimeLiterals.format(0));
		assertEquals("T#1h30m", TimeLiterals.format(5400000));
		assertEquals("T#1s500ms", TimeLiterals.format(1500));
		assertEquals("T#-2s", TimeLiterals.format(-2000));
	}

	@Test
	public void testFormatThenParse() {
		long ms = 90061001L;
		assertEquals("T#1d1h1m1s1ms", TimeLiterals.format(ms));
		assertEquals(ms, TimeLiterals.parse(TimeLiterals.format(ms)));
	}
}
