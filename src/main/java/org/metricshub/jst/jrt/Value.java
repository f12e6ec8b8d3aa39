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

import java.util.Locale;
import java.util.Objects;
import org.metricshub.jst.frontend.TimeLiterals;

/**
 * Immutable typed value: the tagged union stored for every variable.
 * <p>
 * INT and TIME are held as {@code long} (TIME in milliseconds), REAL as
 * {@code double}.
 */
public final class Value {

	public static final Value TRUE = new Value(ValueKind.BOOL, true, 0, 0.0);
	public static final Value FALSE = new Value(ValueKind.BOOL, false, 0, 0.0);
	public static final Value ZERO_INT = new Value(ValueKind.INT, false, 0, 0.0);
	public static final Value ZERO_REAL = new Value(ValueKind.REAL, false, 0, 0.0);
	public static final Value ZERO_TIME = new Value(ValueKind.TIME, false, 0, 0.0);

	private final ValueKind kind;
	private final boolean boolValue;
	private final long longValue;
	private final double doubleValue;

	private Value(ValueKind kind, boolean boolValue, long longValue, double doubleValue) {
		this.kind = kind;
		this.boolValue = boolValue;
		this.longValue = longValue;
		this.doubleValue = doubleValue;
	}

	public static Value ofBool(boolean b) {
		return b ? TRUE : FALSE;
	}

	public static Value ofInt(long i) {
		return i == 0 ? ZERO_INT : new Value(ValueKind.INT, false, i, 0.0);
	}

	public static Value ofReal(double d) {
		return new Value(ValueKind.REAL, false, 0, d);
	}

	public static Value ofTime(long ms) {
		return ms == 0 ? ZERO_TIME : new Value(ValueKind.TIME, false, ms, 0.0);
	}

	/**
	 * @param kind a value kind
	 * @return FALSE, 0, 0.0 or T#0ms
	 */
	public static Value zero(ValueKind kind) {
		switch (kind) {
		case BOOL:
			return FALSE;
		case INT:
			return ZERO_INT;
		case REAL:
			return ZERO_REAL;
		case TIME:
			return ZERO_TIME;
		default:
			throw new IllegalArgumentException("Unknown kind " + kind);
		}
	}

	public ValueKind getKind() {
		return kind;
	}

	public boolean isNumeric() {
		return kind.isNumeric();
	}

	/**
	 * @return the boolean payload
	 * @throws StRuntimeException when this value is not a BOOL
	 */
	public boolean asBool() {
		if (kind != ValueKind.BOOL) {
			throw new StRuntimeException("Expected a BOOL value, got " + kind + " " + this);
		}
		return boolValue;
	}

	/**
	 * @return the integer payload of an INT, or the milliseconds of a TIME
	 * @throws StRuntimeException for BOOL and REAL values
	 */
	public long asLong() {
		if (kind != ValueKind.INT && kind != ValueKind.TIME) {
			throw new StRuntimeException("Expected an INT value, got " + kind + " " + this);
		}
		return longValue;
	}

	/**
	 * @return the numeric payload, widened to double
	 * @throws StRuntimeException for BOOL values
	 */
	public double asDouble() {
		if (kind == ValueKind.REAL) {
			return doubleValue;
		}
		if (kind == ValueKind.BOOL) {
			throw new StRuntimeException("Expected a numeric value, got BOOL " + this);
		}
		return longValue;
	}

	/**
	 * Loose conversion used by the {@link Store} seam, where external code may
	 * write any kind into any slot. Non-zero numbers are TRUE, TRUE is 1, REAL
	 * values are floored when stored as INT or TIME.
	 *
	 * @param target kind of the result
	 * @return this value expressed as target
	 */
	public Value convertTo(ValueKind target) {
		if (target == kind) {
			return this;
		}
		switch (target) {
		case BOOL:
			if (kind == ValueKind.REAL) {
				return ofBool(doubleValue != 0.0);
			}
			return ofBool(longValue != 0);
		case INT:
			if (kind == ValueKind.BOOL) {
				return ofInt(boolValue ? 1 : 0);
			}
			if (kind == ValueKind.REAL) {
				return ofInt((long) Math.floor(doubleValue));
			}
			return ofInt(longValue);
		case REAL:
			if (kind == ValueKind.BOOL) {
				return ofReal(boolValue ? 1.0 : 0.0);
			}
			return ofReal(longValue);
		case TIME:
			if (kind == ValueKind.BOOL) {
				return ofTime(boolValue ? 1 : 0);
			}
			if (kind == ValueKind.REAL) {
				return ofTime((long) Math.floor(doubleValue));
			}
			return ofTime(longValue);
		default:
			throw new IllegalArgumentException("Unknown kind " + target);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Value)) {
			return false;
		}
		Value that = (Value) o;
		return kind == that.kind
				&& boolValue == that.boolValue
				&& longValue == that.longValue
				&& Double.compare(doubleValue, that.doubleValue) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, boolValue, longValue, doubleValue);
	}

	/**
	 * @return the value in Structured Text literal syntax
	 */
	@Override
	public String toString() {
		switch (kind) {
		case BOOL:
			return boolValue ? "TRUE" : "FALSE";
		case INT:
			return Long.toString(longValue);
		case REAL:
			if (doubleValue == Math.rint(doubleValue) && !Double.isInfinite(doubleValue) && Math.abs(doubleValue) < 1e15) {
				return String.format(Locale.ROOT, "%.1f", doubleValue);
			}
			return Double.toString(doubleValue);
		case TIME:
			return TimeLiterals.format(longValue);
		default:
			return "?";
		}
	}
}
