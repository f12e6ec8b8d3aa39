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

import com.google.gson.annotations.SerializedName;

/**
 * Kinds of ladder diagram nodes, serialized under the names the diagram
 * canvas expects.
 */
public enum LadderNodeType {
	@SerializedName("contact")
	CONTACT,
	@SerializedName("coil")
	COIL,
	@SerializedName("timer")
	TIMER,
	@SerializedName("counter")
	COUNTER,
	@SerializedName("comparator")
	COMPARATOR,
	@SerializedName("powerRail")
	POWER_RAIL,
	@SerializedName("junction")
	JUNCTION,
	@SerializedName("unsupported")
	UNSUPPORTED
}
