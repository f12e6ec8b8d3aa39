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

import java.util.List;
import org.metricshub.jst.util.SourceSpan;

public final class ForStatement extends Statement {

	private final String variable;
	private final Expression from;
	private final Expression to;
	private final Expression step;
	private final List<Statement> body;

	/**
	 * @param id node id
	 * @param span source location
	 * @param variable loop variable name
	 * @param from initial value
	 * @param to final value, inclusive
	 * @param step increment, {@code null} for the default of 1
	 * @param body loop body
	 */
	public ForStatement(NodeId id, SourceSpan span, String variable, Expression from, Expression to, Expression step, List<Statement> body) {
		super(id, span);
		this.variable = variable;
		this.from = from;
		this.to = to;
		this.step = step;
		this.body = freeze(body);
	}

	public String getVariable() {
		return variable;
	}

	public Expression getFrom() {
		return from;
	}

	public Expression getTo() {
		return to;
	}

	/**
	 * @return the BY expression, or {@code null}
	 */
	public Expression getStep() {
		return step;
	}

	public List<Statement> getBody() {
		return body;
	}

	@Override
	public StatementKind getKind() {
		return StatementKind.FOR;
	}

	@Override
	public String toString() {
		return "FOR " + variable + " := " + from + " TO " + to + (step == null ? "" : " BY " + step) + " DO ...";
	}
}
