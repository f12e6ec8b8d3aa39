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
 * Access to a member of a function block instance, e.g. <code>Timer1.Q</code>.
 */
public final class MemberRef extends Expression {

	private final String instanceName;
	private final String member;

	public MemberRef(NodeId id, SourceSpan span, String instanceName, String member) {
		super(id, span);
		this.instanceName = instanceName;
		this.member = member;
	}

	public String getInstanceName() {
		return instanceName;
	}

	public String getMember() {
		return member;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.MEMBER;
	}

	@Override
	public String toString() {
		return instanceName + "." + member;
	}
}
