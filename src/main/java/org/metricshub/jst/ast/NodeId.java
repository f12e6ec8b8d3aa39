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

import java.util.Objects;

/**
 * Identity of an AST node that survives re-parsing.
 * <p>
 * Statement ids are built from the statement kind and a hash of its
 * canonical syntax (no positions, whitespace or comments), so editing other
 * parts of the source leaves them unchanged. Nested nodes extend the id of
 * their parent with a path segment: <code>assign-0a1b2c3d/value/left</code>.
 */
public final class NodeId {

	private final String value;

	private NodeId(String value) {
		this.value = value;
	}

	public static NodeId of(String value) {
		return new NodeId(Objects.requireNonNull(value, "value"));
	}

	/**
	 * @param segment path segment
	 * @return the id of a child node
	 */
	public NodeId child(String segment) {
		return new NodeId(value + "/" + segment);
	}

	public String getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof NodeId && ((NodeId) o).value.equals(value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value;
	}
}
