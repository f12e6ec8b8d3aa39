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
 * State of an SR (set-dominant) or RS (reset-dominant) latch.
 */
public class BistableInstance extends FunctionBlockInstance {

	private boolean set;
	private boolean reset;
	private boolean q1;

	BistableInstance(String name, FunctionBlockType type) {
		super(name, type);
		if (type.getCategory() != FunctionBlockType.Category.BISTABLE) {
			throw new IllegalArgumentException(type + " is not a bistable");
		}
	}

	public boolean getQ1() {
		return q1;
	}

	@Override
	public void execute() {
		if (getType() == FunctionBlockType.SR) {
			q1 = set || (!reset && q1);
		} else {
			q1 = !reset && (set || q1);
		}
	}

	private boolean isSetInput(String member) {
		return getType() == FunctionBlockType.SR ? "S1".equals(member) : "S".equals(member);
	}

	private boolean isResetInput(String member) {
		return getType() == FunctionBlockType.SR ? "R".equals(member) : "R1".equals(member);
	}

	@Override
	public Value getMember(String member) {
		if ("Q1".equals(member)) {
			return Value.ofBool(q1);
		}
		if (isSetInput(member)) {
			return Value.ofBool(set);
		}
		if (isResetInput(member)) {
			return Value.ofBool(reset);
		}
		throw unknownMember(member);
	}

	@Override
	public void setMember(String member, Value value) {
		if (isSetInput(member)) {
			set = value.asBool();
		} else if (isResetInput(member)) {
			reset = value.asBool();
		} else {
			throw notAnInput(member);
		}
	}
}
