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

/**
 * <code>target := value;</code> where target is a {@link VariableRef} or a
 * {@link MemberRef} to a function block input.
 */
public final class Assignment extends Statement {

	private final Expression target;
	private final Expression value;

	public Assignment(NodeId id, SourceSpan span, Expression target, Expression value) {
		super(id, span);
		this.target = target;
		this.value = value;
	}

	public Expression getTarget() {
		return target;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public StatementKind getKind() {
		return StatementKind.ASSIGNMENT;
	}

	@Override
	public String toString() {
		return target + " := " + value + ";";
	}
}
