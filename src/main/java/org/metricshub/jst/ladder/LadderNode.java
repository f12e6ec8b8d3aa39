package org.metricshub.jst.ladder;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the ladder graph: a contact, a coil, a function block box, a
 * comparator, a power rail or a junction where parallel branches open or
 * close.
 */
public class LadderNode {

	/** Canvas coordinates, in pixels */
	public static final class Position {
		private final int x;
		private final int y;

		Position(int x, int y) {
			this.x = x;
			this.y = y;
		}

		public int getX() {
			return x;
		}

		public int getY() {
			return y;
		}

		@Override
		public String toString() {
			return "(" + x + ", " + y + ")";
		}
	}

	private final String id;
	private final LadderNodeType type;
	private final Position position;
	private final Map<String, Object> data;

	LadderNode(String id, LadderNodeType type, int x, int y, Map<String, Object> data) {
		this.id = id;
		this.type = type;
		this.position = new Position(x, y);
		this.data = new LinkedHashMap<String, Object>(data);
	}

	public String getId() {
		return id;
	}

	public LadderNodeType getType() {
		return type;
	}

	public Position getPosition() {
		return position;
	}

	/**
	 * Type-specific attributes: <code>variable</code> and
	 * <code>contactType</code> of a contact, <code>instanceName</code> and
	 * <code>timerType</code> of a timer, and so on.
	 *
	 * @return the attributes
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Map<String, Object> getData() {
		return data;
	}

	/**
	 * @param key attribute name
	 * @return the attribute, or {@code null}
	 */
	public Object get(String key) {
		return data.get(key);
	}

	@Override
	public String toString() {
		return type + " " + id + " " + data + " @" + position;
	}
}
