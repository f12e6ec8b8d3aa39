package org.metricshub.jst.backend;

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

import java.util.List;
import org.metricshub.jst.ast.StandardFunction;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.jrt.ValueKind;
import org.metricshub.jst.util.SourceSpan;

/**
 * Implementation of the standard functions callable from expressions.
 */
final class StandardFunctions {

	private StandardFunctions() {}

	static Value invoke(StandardFunction function, List<Value> args, SourceSpan span) {
		if (args.size() < function.getMinArguments() || args.size() > function.getMaxArguments()) {
			throw new StRuntimeException(span, function + " called with " + args.size() + " argument(s)");
		}
		switch (function) {
		case ABS:
			return abs(args.get(0), span);
		case SQRT:
			return Value.ofReal(Math.sqrt(real(args.get(0), function, span)));
		case LN:
			return Value.ofReal(Math.log(real(args.get(0), function, span)));
		case LOG:
			return Value.ofReal(Math.log10(real(args.get(0), function, span)));
		case EXP:
			return Value.ofReal(Math.exp(real(args.get(0), function, span)));
		case SIN:
			return Value.ofReal(Math.sin(real(args.get(0), function, span)));
		case COS:
			return Value.ofReal(Math.cos(real(args.get(0), function, span)));
		case TAN:
			return Value.ofReal(Math.tan(real(args.get(0), function, span)));
		case ASIN:
			return Value.ofReal(Math.asin(real(args.get(0), function, span)));
		case ACOS:
			return Value.ofReal(Math.acos(real(args.get(0), function, span)));
		case ATAN:
			return Value.ofReal(Math.atan(real(args.get(0), function, span)));
		case ATAN2:
			return Value.ofReal(Math.atan2(real(args.get(0), function, span), real(args.get(1), function, span)));
		case EXPT:
			return Value.ofReal(Math.pow(real(args.get(0), function, span), real(args.get(1), function, span)));
		case TRUNC:
			return Value.ofInt(toLong(real(args.get(0), function, span), span));
		case MIN:
			return extreme(args, -1, span);
		case MAX:
			return extreme(args, 1, span);
		case LIMIT:
			return limit(args.get(0), args.get(1), args.get(2), span);
		case SEL:
			return bool(args.get(0), function, span) ? args.get(2) : args.get(1);
		case MUX:
			return mux(args, span);
		case TO_BOOL:
			return toBool(args.get(0));
		case TO_INT:
			return toInt(args.get(0), span);
		case TO_REAL:
			return args.get(0).convertTo(ValueKind.REAL);
		case TO_TIME:
			return toTime(args.get(0), span);
		default:
			throw new StRuntimeException(span, "Function " + function + " is not implemented");
		}
	}

	private static double real(Value value, StandardFunction function, SourceSpan span) {
		if (!value.isNumeric() || value.getKind() == ValueKind.TIME) {
			throw new StRuntimeException(span, function + " expects a number, got " + value.getKind() + " " + value);
		}
		return value.asDouble();
	}

	private static boolean bool(Value value, StandardFunction function, SourceSpan span) {
		if (value.getKind() != ValueKind.BOOL) {
			throw new StRuntimeException(span, function + " expects a BOOL selector, got " + value.getKind() + " " + value);
		}
		return value.asBool();
	}

	private static Value abs(Value value, SourceSpan span) {
		switch (value.getKind()) {
		case INT:
			return Value.ofInt(Math.abs(value.asLong()));
		case REAL:
			return Value.ofReal(Math.abs(value.asDouble()));
		case TIME:
			return Value.ofTime(Math.abs(value.asLong()));
		default:
			throw new StRuntimeException(span, "ABS expects a number, got BOOL");
		}
	}

	/**
	 * MIN or MAX. The result is REAL as soon as one argument is REAL.
	 */
	private static Value extreme(List<Value> args, int sign, SourceSpan span) {
		Value best = args.get(0);
		boolean real = best.getKind() == ValueKind.REAL;
		for (int i = 1; i < args.size(); i++) {
			Value candidate = args.get(i);
			real |= candidate.getKind() == ValueKind.REAL;
			if (Integer.signum(ExpressionInterpreter.compare(candidate, best, span)) == sign) {
				best = candidate;
			}
		}
		return real ? best.convertTo(ValueKind.REAL) : best;
	}

	private static Value limit(Value min, Value in, Value max, SourceSpan span) {
		Value result = in;
		if (ExpressionInterpreter.compare(result, min, span) < 0) {
			result = min;
		}
		if (ExpressionInterpreter.compare(result, max, span) > 0) {
			result = max;
		}
		boolean real = min.getKind() == ValueKind.REAL || in.getKind() == ValueKind.REAL || max.getKind() == ValueKind.REAL;
		return real ? result.convertTo(ValueKind.REAL) : result;
	}

	/**
	 * <code>MUX(K, IN0, IN1, ...)</code>: an out of range K selects IN0.
	 */
	private static Value mux(List<Value> args, SourceSpan span) {
		Value selector = args.get(0);
		if (selector.getKind() != ValueKind.INT) {
			throw new StRuntimeException(span, "MUX expects an INT selector, got " + selector.getKind() + " " + selector);
		}
		long k = selector.asLong();
		if (k < 0 || k >= args.size() - 1) {
			return args.get(1);
		}
		return args.get((int) k + 1);
	}

	private static Value toBool(Value value) {
		return value.convertTo(ValueKind.BOOL);
	}

	/**
	 * REAL values are rounded half away from zero.
	 */
	private static Value toInt(Value value, SourceSpan span) {
		if (value.getKind() == ValueKind.REAL) {
			return Value.ofInt(round(value.asDouble(), span));
		}
		return value.convertTo(ValueKind.INT);
	}

	private static Value toTime(Value value, SourceSpan span) {
		if (value.getKind() == ValueKind.REAL) {
			return Value.ofTime(round(value.asDouble(), span));
		}
		return value.convertTo(ValueKind.TIME);
	}

	private static long round(double d, SourceSpan span) {
		double rounded = d < 0 ? -Math.floor(-d + 0.5) : Math.floor(d + 0.5);
		return toLong(rounded, span);
	}

	private static long toLong(double d, SourceSpan span) {
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			throw new StRuntimeException(span, "Cannot convert " + d + " to an integer");
		}
		return (long) d;
	}
}
