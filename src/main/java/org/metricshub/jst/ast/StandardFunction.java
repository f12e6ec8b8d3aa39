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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.metricshub.jst.jrt.ValueKind;

/**
 * The standard functions that may be called in expressions. Conversion
 * functions written <code>SOURCE_TO_TARGET</code> (<code>REAL_TO_INT</code>,
 * <code>DINT_TO_LREAL</code>, ...) resolve to one of the <code>TO_*</code>
 * constants.
 */
public enum StandardFunction {
	ABS(1, 1, "IN"),
	SQRT(1, 1, "IN"),
	LN(1, 1, "IN"),
	LOG(1, 1, "IN"),
	EXP(1, 1, "IN"),
	SIN(1, 1, "IN"),
	COS(1, 1, "IN"),
	TAN(1, 1, "IN"),
	ASIN(1, 1, "IN"),
	ACOS(1, 1, "IN"),
	ATAN(1, 1, "IN"),
	ATAN2(2, 2, "Y", "X"),
	EXPT(2, 2, "IN1", "IN2"),
	TRUNC(1, 1, "IN"),
	MIN(1, Integer.MAX_VALUE),
	MAX(1, Integer.MAX_VALUE),
	LIMIT(3, 3, "MN", "IN", "MX"),
	SEL(3, 3, "G", "IN0", "IN1"),
	MUX(2, Integer.MAX_VALUE),
	TO_BOOL(1, 1, "IN"),
	TO_INT(1, 1, "IN"),
	TO_REAL(1, 1, "IN"),
	TO_TIME(1, 1, "IN");

	private final int minArguments;
	private final int maxArguments;
	private final List<String> parameterNames;

	StandardFunction(int minArguments, int maxArguments, String... parameterNames) {
		this.minArguments = minArguments;
		this.maxArguments = maxArguments;
		this.parameterNames = Collections.unmodifiableList(Arrays.asList(parameterNames));
	}

	public int getMinArguments() {
		return minArguments;
	}

	public int getMaxArguments() {
		return maxArguments;
	}

	/**
	 * @return formal parameter names, empty for variadic functions
	 */
	public List<String> getParameterNames() {
		return parameterNames;
	}

	/**
	 * @return the target kind of a conversion function, {@code null} otherwise
	 */
	public ValueKind getConversionTarget() {
		switch (this) {
		case TO_BOOL:
			return ValueKind.BOOL;
		case TO_INT:
			return ValueKind.INT;
		case TO_REAL:
			return ValueKind.REAL;
		case TO_TIME:
			return ValueKind.TIME;
		default:
			return null;
		}
	}

	/**
	 * @param name function name as written in the source, case-insensitive
	 * @return the function, or {@code null} when it is unknown
	 */
	public static StandardFunction resolve(String name) {
		String upper = name.toUpperCase(Locale.ROOT);
		for (StandardFunction function : values()) {
			if (function.name().equals(upper)) {
				return function;
			}
		}
		int separator = upper.indexOf("_TO_");
		if (separator > 0) {
			DataType from = DataType.fromName(upper.substring(0, separator));
			DataType to = DataType.fromName(upper.substring(separator + 4));
			if (from != null && to != null && !from.isFunctionBlock() && !to.isFunctionBlock()) {
				return resolve("TO_" + to.name());
			}
		}
		return null;
	}
}
