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

/**
 * The elementary data kinds held by a {@link Value}.
 */
public enum ValueKind {
	BOOL,
	INT,
	REAL,
	TIME;

	/**
	 * @return whether values of this kind take part in arithmetic
	 */
	public boolean isNumeric() {
		return this == INT || this == REAL;
	}

	/**
	 * Implicit conversions allowed without a conversion function: identity and
	 * the widening of INT to REAL.
	 *
	 * @param target kind of the destination
	 * @return whether a value of this kind may be stored into target silently
	 */
	public boolean isImplicitlyConvertibleTo(ValueKind target) {
		return this == target || (this == INT && target == REAL);
	}
}
