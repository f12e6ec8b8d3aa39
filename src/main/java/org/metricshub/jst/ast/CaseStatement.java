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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jst.util.SourceSpan;

public final class CaseStatement extends Statement {

	private final Expression selector;
	private final List<CaseClause> clauses;
	private final List<Statement> elseBody;

	public CaseStatement(NodeId id, SourceSpan span, Expression selector, List<CaseClause> clauses, List<Statement> elseBody) {
		super(id, span);
		this.selector = selector;
		this.clauses = Collections.unmodifiableList(new ArrayList<CaseClause>(clauses));
		this.elseBody = elseBody == null ? null : freeze(elseBody);
	}

	public Expression getSelector() {
		return selector;
	}

	public List<CaseClause> getClauses() {
		return clauses;
	}

	public boolean hasElse() {
		return elseBody != null;
	}

	public List<Statement> getElseBody() {
		return elseBody == null ? Collections.<Statement>emptyList() : elseBody;
	}

	@Override
	public StatementKind getKind() {
		return StatementKind.CASE;
	}

	@Override
	public String toString() {
		return "CASE " + selector + " OF ...";
	}
}
