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

import java.util.Locale;

/**
 * Conversion between IEC 61131-3 duration literals and milliseconds.
 * <p>
 * Accepted forms: an optional <code>T#</code> or <code>TIME#</code> prefix
 * (any case), an optional sign, then one or more <code>number unit</code>
 * pairs where unit is <code>d</code>, <code>h</code>, <code>m</code>,
 * <code>s</code> or <code>ms</code>. Numbers may hold underscores and a
 * decimal part: <code>T#1h30m</code>, <code>t#1.5s</code>,
 * <code>TIME#2d_4h</code>.
 */
public final class TimeLiterals {

	private static final long MS_PER_SECOND = 1000L;
	private static final long MS_PER_MINUTE = 60L * MS_PER_SECOND;
	private static final long MS_PER_HOUR = 60L * MS_PER_MINUTE;
	private static final long MS_PER_DAY = 24L * MS_PER_HOUR;

	private TimeLiterals() {}

	/**
	 * @param literal the duration literal
	 * @return the duration in milliseconds, rounded to the nearest millisecond
	 * @throws IllegalArgumentException when the literal is malformed
	 */
	public static long parse(String literal) {
		String body = literal.trim().toLowerCase(Locale.ROOT);
		if (body.startsWith("time#")) {
			body = body.substring(5);
		} else if (body.startsWith("t#")) {
			body = body.substring(2);
		}
		boolean negative = false;
		if (body.startsWith("-")) {
			negative = true;
			body = body.substring(1);
		}
		body = body.replace("_", "");
		if (body.isEmpty()) {
			throw new IllegalArgumentException("Empty duration literal: " + literal);
		}

		double total = 0;
		int i = 0;
		while (i < body.length()) {
			int numberStart = i;
			while (i < body.length() && (Character.isDigit(body.charAt(i)) || body.charAt(i) == '.')) {
				i++;
			}
			if (i == numberStart) {
				throw new IllegalArgumentException("Expecting a number in duration literal: " + literal);
			}
			double amount;
			try {
				amount = Double.parseDouble(body.substring(numberStart, i));
			} catch (NumberFormatException ex) {
				throw new IllegalArgumentException("Invalid number in duration literal: " + literal, ex);
			}
			long unit;
			if (body.startsWith("ms", i)) {
				unit = 1;
				i += 2;
			} else if (body.startsWith("d", i)) {
				unit = MS_PER_DAY;
				i++;
			} else if (body.startsWith("h", i)) {
				unit = MS_PER_HOUR;
				i++;
			} else if (body.startsWith("m", i)) {
				unit = MS_PER_MINUTE;
				i++;
			} else if (body.startsWith("s", i)) {
				unit = MS_PER_SECOND;
				i++;
			} else {
				throw new IllegalArgumentException("Missing or unknown unit in duration literal: " + literal);
			}
			total += amount * unit;
		}
		long ms = Math.round(total);
		return negative ? -ms : ms;
	}

	/**
	 * Formats a duration the way it would be written in source,
	 * e.g. <code>T#1h30m</code> or <code>T#0ms</code>.
	 *
	 * @param ms duration in milliseconds
	 * @return the duration literal
	 */
	public static String format(long ms) {
		if (ms == 0) {
			return "T#0ms";
		}
		StringBuilder sb = new StringBuilder("T#");
		long rest = ms;
		if (rest < 0) {
			sb.append('-');
			rest = -rest;
		}
		rest = append(sb, rest, MS_PER_DAY, "d");
		rest = append(sb, rest, MS_PER_HOUR, "h");
		rest = append(sb, rest, MS_PER_MINUTE, "m");
		rest = append(sb, rest, MS_PER_SECOND, "s");
		append(sb, rest, 1, "ms");
		return sb.toString();
	}

	private static long append(StringBuilder sb, long ms, long unit, String suffix) {
		long count = ms / unit;
		if (count > 0) {
			sb.append(count).append(suffix);
		}
		return ms % unit;
	}
}
