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

public final class RepeatStatement extends Statement {

	private final List<Statement> body;
	private final Expression condition;

	public RepeatStatement(NodeId id, SourceSpan span, List<Statement> body, Expression condition) {
		super(id, span);
		this.body = freeze(body);
		this.condition = condition;
	}

	public List<Statement> getBody() {
		return body;
	}

	/**
	 * @return the UNTIL condition
	 */
	public Expression getCondition() {
		return condition;
	}

	@Override
	public StatementKind getKind() {
		return StatementKind.REPEAT;
	}

	@Override
	public String toString() {
		return "REPEAT ... UNTIL " + condition;
	}
}
