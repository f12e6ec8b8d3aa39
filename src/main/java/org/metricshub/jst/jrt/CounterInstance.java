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
 * State of a CTU, CTD or CTUD instance.
 * <p>
 * Counting happens in {@link #execute()} on rising edges of <code>CU</code>
 * and <code>CD</code> relative to the previous call. <code>R</code>, then
 * <code>LD</code>, take priority over counting. <code>CV</code> never goes
 * below zero.
 */
public class CounterInstance extends FunctionBlockInstance {

	private boolean cu;
	private boolean cd;
	private boolean r;
	private boolean ld;
	private long pv;
	private long cv;
	private boolean qu;
	private boolean qd;

	private boolean previousCu;
	private boolean previousCd;

	CounterInstance(String name, FunctionBlockType type) {
		super(name, type);
		if (type.getCategory() != FunctionBlockType.Category.COUNTER) {
			throw new IllegalArgumentException(type + " is not a counter");
		}
		refreshOutputs();
	}

	public long getCurrentValue() {
		return cv;
	}

	public long getPresetValue() {
		return pv;
	}

	public boolean getQu() {
		return qu;
	}

	public boolean getQd() {
		return qd;
	}

	/**
	 * @return <code>QD</code> for CTD, <code>QU</code> otherwise
	 */
	public boolean getQ() {
		return getType() == FunctionBlockType.CTD ? qd : qu;
	}

	/**
	 * Sets <code>PV</code>; <code>QU</code> follows immediately.
	 *
	 * @param pv the preset value
	 */
	public void setPresetValue(long pv) {
		this.pv = pv;
		refreshOutputs();
	}

	/**
	 * Increments <code>CV</code> by one and refreshes the outputs.
	 */
	public void countUp() {
		cv++;
		refreshOutputs();
	}

	/**
	 * Decrements <code>CV</code> by one, not below zero, and refreshes the outputs.
	 */
	public void countDown() {
		cv = Math.max(0, cv - 1);
		refreshOutputs();
	}

	/**
	 * Sets <code>CV</code> back to zero.
	 */
	public void reset() {
		cv = 0;
		refreshOutputs();
	}

	/**
	 * Loads <code>PV</code> into <code>CV</code>.
	 */
	public void load() {
		cv = pv;
		refreshOutputs();
	}

	private void refreshOutputs() {
		qu = cv >= pv;
		qd = cv <= 0;
	}

	@Override
	public void execute() {
		boolean countUp = cu && !previousCu;
		boolean countDown = cd && !previousCd;
		previousCu = cu;
		previousCd = cd;

		FunctionBlockType type = getType();
		if (r && type != FunctionBlockType.CTD) {
			cv = 0;
		} else if (ld && type != FunctionBlockType.CTU) {
			cv = pv;
		} else {
			if (countUp && type != FunctionBlockType.CTD) {
				cv++;
			}
			if (countDown && type != FunctionBlockType.CTU) {
				cv = Math.max(0, cv - 1);
			}
		}
		refreshOutputs();
	}

	@Override
	public Value getMember(String member) {
		if (!getType().hasMember(member)) {
			throw unknownMember(member);
		}
		switch (member) {
		case "CU":
			return Value.ofBool(cu);
		case "CD":
			return Value.ofBool(cd);
		case "R":
			return Value.ofBool(r);
		case "LD":
			return Value.ofBool(ld);
		case "PV":
			return Value.ofInt(pv);
		case "CV":
			return Value.ofInt(cv);
		case "QU":
			return Value.ofBool(qu);
		case "QD":
			return Value.ofBool(qd);
		case "Q":
			return Value.ofBool(getQ());
		default:
			throw unknownMember(member);
		}
	}

	@Override
	public void setMember(String member, Value value) {
		if (!getType().getInputs().contains(member)) {
			throw notAnInput(member);
		}
		switch (member) {
		case "CU":
			cu = value.asBool();
			break;
		case "CD":
			cd = value.asBool();
			break;
		case "R":
			r = value.asBool();
			break;
		case "LD":
			ld = value.asBool();
			break;
		case "PV":
			setPresetValue(value.asLong());
			break;
		default:
			throw notAnInput(member);
		}
	}
}
