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
 * State of a TON, TOF or TP instance.
 * <p>
 * Transitions of <code>IN</code> are detected against the previous
 * <em>write</em> of <code>IN</code>, not against the value it had at the
 * previous scan: writing the same value twice is never an edge, even when
 * several scans elapsed in between. Elapsed time only moves in
 * {@link #advance(long)}, called once per scan after the statement pass.
 */
public class TimerInstance extends FunctionBlockInstance {

	private boolean in;
	private long pt;
	private long et;
	private boolean q;
	private boolean running;

	TimerInstance(String name, FunctionBlockType type) {
		super(name, type);
		if (type.getCategory() != FunctionBlockType.Category.TIMER) {
			throw new IllegalArgumentException(type + " is not a timer");
		}
	}

	public boolean getIn() {
		return in;
	}

	public long getPresetTime() {
		return pt;
	}

	public long getElapsedTime() {
		return et;
	}

	public boolean getQ() {
		return q;
	}

	public boolean isRunning() {
		return running;
	}

	/**
	 * Sets <code>PT</code>. Takes effect at the next input write or time
	 * advance; negative presets are treated as zero.
	 *
	 * @param presetMs preset time in milliseconds
	 */
	public void setPresetTime(long presetMs) {
		this.pt = Math.max(0, presetMs);
	}

	/**
	 * Writes <code>IN</code>, reacting to the transition from the previously
	 * written value.
	 *
	 * @param newIn the new input value
	 */
	public void setInput(boolean newIn) {
		boolean rising = newIn && !in;
		boolean falling = !newIn && in;
		in = newIn;
		switch (getType()) {
		case TON:
			writeOnDelay(rising, falling);
			break;
		case TOF:
			writeOffDelay(falling);
			break;
		case TP:
			writePulse(rising, falling);
			break;
		default:
			break;
		}
	}

	private void writeOnDelay(boolean rising, boolean falling) {
		if (rising) {
			et = 0;
			if (pt <= 0) {
				q = true;
				running = false;
			} else {
				q = false;
				running = true;
			}
		} else if (falling) {
			running = false;
			et = 0;
			q = false;
		}
	}

	private void writeOffDelay(boolean falling) {
		if (in) {
			// output follows the input, a pending delay is cancelled
			q = true;
			et = 0;
			running = false;
		} else if (falling) {
			et = 0;
			running = pt > 0;
			if (!running) {
				q = false;
			}
		}
	}

	private void writePulse(boolean rising, boolean falling) {
		if (rising && !running && !q) {
			if (pt > 0) {
				q = true;
				running = true;
				et = 0;
			} else {
				et = 0;
			}
		} else if (falling && !running) {
			et = 0;
		}
	}

	/**
	 * Adds elapsed time to a running timer, clamped to <code>PT</code>, and
	 * completes it when <code>PT</code> is reached.
	 *
	 * @param deltaMs elapsed milliseconds since the previous scan
	 */
	@Override
	public void advance(long deltaMs) {
		if (!running) {
			return;
		}
		et = Math.min(et + Math.max(0, deltaMs), pt);
		if (et >= pt) {
			running = false;
			switch (getType()) {
			case TON:
				q = true;
				break;
			case TOF:
				q = false;
				break;
			case TP:
				q = false;
				if (!in) {
					et = 0;
				}
				break;
			default:
				break;
			}
		}
	}

	@Override
	public Value getMember(String member) {
		switch (member) {
		case "IN":
			return Value.ofBool(in);
		case "PT":
			return Value.ofTime(pt);
		case "ET":
			return Value.ofTime(et);
		case "Q":
			return Value.ofBool(q);
		default:
			throw unknownMember(member);
		}
	}

	@Override
	public void setMember(String member, Value value) {
		switch (member) {
		case "IN":
			setInput(value.asBool());
			break;
		case "PT":
			setPresetTime(value.asLong());
			break;
		default:
			throw notAnInput(member);
		}
	}
}
