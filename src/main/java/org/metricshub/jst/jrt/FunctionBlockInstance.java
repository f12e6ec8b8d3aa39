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
 * State of one function block instance, kept in the {@link Store} across
 * scan cycles.
 * <p>
 * A call such as <code>T1(IN := x, PT := T#1s)</code> writes the bound inputs
 * with {@link #setMember(String, Value)} then runs {@link #execute()}. The
 * scan cycle then calls {@link #advance(long)} on every instance once the
 * statement pass is over.
 */
public abstract class FunctionBlockInstance {

	private final String name;
	private final FunctionBlockType type;

	protected FunctionBlockInstance(String name, FunctionBlockType type) {
		this.name = name;
		this.type = type;
	}

	/**
	 * Creates a fresh instance of the specified type.
	 *
	 * @param name instance name
	 * @param type function block type
	 * @return a new instance with default state
	 */
	public static FunctionBlockInstance create(String name, FunctionBlockType type) {
		switch (type.getCategory()) {
		case TIMER:
			return new TimerInstance(name, type);
		case COUNTER:
			return new CounterInstance(name, type);
		case EDGE:
			return new EdgeTriggerInstance(name, type);
		case BISTABLE:
			return new BistableInstance(name, type);
		default:
			throw new IllegalArgumentException("Unsupported function block type " + type);
		}
	}

	public String getName() {
		return name;
	}

	public FunctionBlockType getType() {
		return type;
	}

	/**
	 * Reads an input or output member.
	 *
	 * @param member member name, e.g. <code>Q</code>
	 * @return its current value
	 * @throws StRuntimeException when the member does not exist
	 */
	public abstract Value getMember(String member);

	/**
	 * Writes an input member.
	 *
	 * @param member input name, e.g. <code>IN</code>
	 * @param value new value
	 * @throws StRuntimeException when the member is not a writable input
	 */
	public abstract void setMember(String member, Value value);

	/**
	 * Evaluates the block body once its inputs are written. Timers evaluate
	 * their inputs as they are written, so this does nothing for them.
	 */
	public void execute() {}

	/**
	 * Advances the elapsed time of the block. Only timers use it.
	 *
	 * @param deltaMs elapsed milliseconds since the previous scan
	 */
	public void advance(long deltaMs) {}

	protected StRuntimeException unknownMember(String member) {
		return new StRuntimeException(type + " instance '" + name + "' has no member " + member);
	}

	protected StRuntimeException notAnInput(String member) {
		if (type.hasMember(member)) {
			return new StRuntimeException("Cannot write output " + member + " of " + type + " instance '" + name + "'");
		}
		return unknownMember(member);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name).append(" : ").append(type).append(" (");
		boolean first = true;
		for (String member : type.getInputs()) {
			sb.append(first ? "" : ", ").append(member).append('=').append(getMember(member));
			first = false;
		}
		for (String member : type.getOutputs()) {
			sb.append(", ").append(member).append('=').append(getMember(member));
		}
		return sb.append(')').toString();
	}
}
