package org.metricshub.jst.jrt;

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

/**
 * State of an R_TRIG or F_TRIG instance. <code>M</code> holds the
 * <code>CLK</code> sample of the previous call, so <code>Q</code> is true for
 * exactly one call after a transition.
 */
public class EdgeTriggerInstance extends FunctionBlockInstance {

	private boolean clk;
	private boolean q;
	private boolean m;

	EdgeTriggerInstance(String name, FunctionBlockType type) {
		super(name, type);
		if (type.getCategory() != FunctionBlockType.Category.EDGE) {
			throw new IllegalArgumentException(type + " is not an edge detector");
		}
	}

	public boolean getQ() {
		return q;
	}

	@Override
	public void execute() {
		if (getType() == FunctionBlockType.R_TRIG) {
			q = clk && !m;
		} else {
			q = !clk && m;
		}
		m = clk;
	}

	@Override
	public Value getMember(String member) {
		switch (member) {
		case "CLK":
			return Value.ofBool(clk);
		case "Q":
			return Value.ofBool(q);
		case "M":
			return Value.ofBool(m);
		default:
			throw unknownMember(member);
		}
	}

	@Override
	public void setMember(String member, Value value) {
		if (!"CLK".equals(member)) {
			throw notAnInput(member);
		}
		clk = value.asBool();
	}
}
