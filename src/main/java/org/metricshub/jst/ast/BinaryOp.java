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

import org.metricshub.jst.util.SourceSpan;

public final class BinaryOp extends Expression {

	private final BinaryOperator operator;
	private final Expression left;
	private final Expression right;

	public BinaryOp(NodeId id, SourceSpan span, BinaryOperator operator, Expression left, Expression right) {
		super(id, span);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.BINARY;
	}

	@Override
	int getPrecedence() {
		return operator.getPrecedence();
	}

	@Override
	public String toString() {
		// operators are left-associative: a right operand of equal precedence needs parentheses
		String l = left.getPrecedence() < getPrecedence() ? "(" + left + ")" : left.toString();
		String r = right.getPrecedence() <= getPrecedence() ? "(" + right + ")" : right.toString();
		return l + " " + operator.getSymbol() + " " + r;
	}
}
