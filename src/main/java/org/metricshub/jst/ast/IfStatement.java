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

public final class IfStatement extends Statement {

	private final List<ConditionalBranch> branches;
	private final List<Statement> elseBody;

	/**
	 * @param id node id
	 * @param span source location
	 * @param branches the IF branch followed by the ELSIF branches
	 * @param elseBody statements of the ELSE clause, {@code null} when there is none
	 */
	public IfStatement(NodeId id, SourceSpan span, List<ConditionalBranch> branches, List<Statement> elseBody) {
		super(id, span);
		this.branches = Collections.unmodifiableList(new ArrayList<ConditionalBranch>(branches));
		this.elseBody = elseBody == null ? null : freeze(elseBody);
	}

	public List<ConditionalBranch> getBranches() {
		return branches;
	}

	public boolean hasElse() {
		return elseBody != null;
	}

	/**
	 * @return the ELSE statements, empty when there is no ELSE clause
	 */
	public List<Statement> getElseBody() {
		return elseBody == null ? Collections.<Statement>emptyList() : elseBody;
	}

	@Override
	public StatementKind getKind() {
		return StatementKind.IF;
	}

	@Override
	public String toString() {
		return "IF " + branches.get(0).getCondition() + " THEN ...";
	}
}
