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

/**
 * Binary operators with their precedence (higher binds tighter).
 */
public enum BinaryOperator {
	OR("OR", 1),
	XOR("XOR", 2),
	AND("AND", 3),
	EQ("=", 4),
	NE("<>", 4),
	LT("<", 5),
	LE("<=", 5),
	GT(">", 5),
	GE(">=", 5),
	ADD("+", 6),
	SUB("-", 6),
	MUL("*", 7),
	DIV("/", 7),
	MOD("MOD", 7),
	POW("**", 8);

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public boolean isLogical() {
		return this == OR || this == XOR || this == AND;
	}

	public boolean isComparison() {
		return precedence == 4 || precedence == 5;
	}

	public boolean isArithmetic() {
		return precedence >= 6;
	}

	/**
	 * @return the comparison giving the opposite result, e.g. GE for LT
	 * @throws IllegalStateException when this is not a comparison
	 */
	public BinaryOperator negate() {
		switch (this) {
		case EQ:
			return NE;
		case NE:
			return EQ;
		case LT:
			return GE;
		case GE:
			return LT;
		case GT:
			return LE;
		case LE:
			return GT;
		default:
			throw new IllegalStateException(this + " is not a comparison");
		}
	}

	public static BinaryOperator fromSymbol(String symbol) {
		for (BinaryOperator op : values()) {
			if (op.symbol.equals(symbol)) {
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown binary operator " + symbol);
	}
}
