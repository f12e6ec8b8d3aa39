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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable runtime state of a loaded program: one typed slot per variable and
 * one {@link FunctionBlockInstance} per function block instance, both
 * addressed by name.
 * <p>
 * The kind of a slot is fixed when the variable is declared. Later writes
 * through any typed setter are converted to that kind, so a slot never
 * changes type. Reading a name that does not exist returns the zero value of
 * the requested kind.
 * <p>
 * A Store is owned by a single program session and is not thread-safe.
 */
public class Store {

	private final Map<String, Value> variables = new LinkedHashMap<String, Value>();
	private final Map<String, FunctionBlockInstance> instances = new LinkedHashMap<String, FunctionBlockInstance>();

	/**
	 * Creates or replaces a variable slot, fixing its kind to the kind of the
	 * initial value.
	 *
	 * @param name variable name
	 * @param initial initial value
	 */
	public void declare(String name, Value initial) {
		instances.remove(name);
		variables.put(name, initial);
	}

	public boolean containsVariable(String name) {
		return variables.containsKey(name);
	}

	public boolean containsInstance(String name) {
		return instances.containsKey(name);
	}

	/**
	 * @param name variable name
	 * @return the kind of the slot, or {@code null} when there is no such variable
	 */
	public ValueKind getKind(String name) {
		Value value = variables.get(name);
		return value == null ? null : value.getKind();
	}

	/**
	 * @param name variable name
	 * @return its value, or {@code null} when there is no such variable
	 */
	public Value getValue(String name) {
		return variables.get(name);
	}

	/**
	 * Writes a variable. An existing slot keeps its kind and the value is
	 * converted; a missing slot is created with the kind of the value.
	 *
	 * @param name variable name
	 * @param value new value
	 */
	public void setValue(String name, Value value) {
		Value current = variables.get(name);
		variables.put(name, current == null ? value : value.convertTo(current.getKind()));
	}

	private Value read(String name, ValueKind kind) {
		Value value = variables.get(name);
		return value == null ? Value.zero(kind) : value.convertTo(kind);
	}

	public boolean getBool(String name) {
		return read(name, ValueKind.BOOL).asBool();
	}

	public void setBool(String name, boolean value) {
		setValue(name, Value.ofBool(value));
	}

	public long getInt(String name) {
		return read(name, ValueKind.INT).asLong();
	}

	public void setInt(String name, long value) {
		setValue(name, Value.ofInt(value));
	}

	public double getReal(String name) {
		return read(name, ValueKind.REAL).asDouble();
	}

	public void setReal(String name, double value) {
		setValue(name, Value.ofReal(value));
	}

	/**
	 * @param name variable name
	 * @return the duration in milliseconds
	 */
	public long getTime(String name) {
		return read(name, ValueKind.TIME).asLong();
	}

	/**
	 * @param name variable name
	 * @param ms duration in milliseconds
	 */
	public void setTime(String name, long ms) {
		setValue(name, Value.ofTime(ms));
	}

	/**
	 * Creates or replaces a function block instance with default state.
	 *
	 * @param name instance name
	 * @param type function block type
	 * @return the new instance
	 */
	public FunctionBlockInstance initInstance(String name, FunctionBlockType type) {
		FunctionBlockInstance instance = FunctionBlockInstance.create(name, type);
		variables.remove(name);
		instances.put(name, instance);
		return instance;
	}

	/**
	 * @param name instance name
	 * @return the instance, or {@code null} when there is none
	 */
	public FunctionBlockInstance getInstance(String name) {
		return instances.get(name);
	}

	/**
	 * @param name instance name
	 * @return the timer, or {@code null} when there is no timer with that name
	 */
	public TimerInstance getTimer(String name) {
		FunctionBlockInstance instance = instances.get(name);
		return instance instanceof TimerInstance ? (TimerInstance) instance : null;
	}

	/**
	 * Creates or replaces a timer.
	 *
	 * @param name instance name
	 * @param type TON, TOF or TP
	 * @param presetMs initial <code>PT</code>
	 * @return the new timer
	 */
	public TimerInstance initTimer(String name, FunctionBlockType type, long presetMs) {
		if (type.getCategory() != FunctionBlockType.Category.TIMER) {
			throw new IllegalArgumentException(type + " is not a timer type");
		}
		TimerInstance timer = (TimerInstance) initInstance(name, type);
		timer.setPresetTime(presetMs);
		return timer;
	}

	private TimerInstance requireTimer(String name) {
		TimerInstance timer = getTimer(name);
		if (timer == null) {
			throw new IllegalArgumentException("No timer named '" + name + "'");
		}
		return timer;
	}

	/**
	 * Writes <code>IN</code> of a timer; edges are detected against the
	 * previous write.
	 *
	 * @param name timer name
	 * @param in new input value
	 */
	public void setTimerInput(String name, boolean in) {
		requireTimer(name).setInput(in);
	}

	public void setTimerPreset(String name, long presetMs) {
		requireTimer(name).setPresetTime(presetMs);
	}

	/**
	 * Advances one timer.
	 *
	 * @param name timer name
	 * @param deltaMs elapsed milliseconds
	 */
	public void updateTimer(String name, long deltaMs) {
		requireTimer(name).advance(deltaMs);
	}

	/**
	 * Advances every function block instance (only timers react).
	 *
	 * @param deltaMs elapsed milliseconds
	 */
	public void updateTimers(long deltaMs) {
		for (FunctionBlockInstance instance : instances.values()) {
			instance.advance(deltaMs);
		}
	}

	/**
	 * @param name instance name
	 * @return the counter, or {@code null} when there is no counter with that name
	 */
	public CounterInstance getCounter(String name) {
		FunctionBlockInstance instance = instances.get(name);
		return instance instanceof CounterInstance ? (CounterInstance) instance : null;
	}

	/**
	 * Creates or replaces a counter.
	 *
	 * @param name instance name
	 * @param type CTU, CTD or CTUD
	 * @param presetValue initial <code>PV</code>
	 * @return the new counter
	 */
	public CounterInstance initCounter(String name, FunctionBlockType type, long presetValue) {
		if (type.getCategory() != FunctionBlockType.Category.COUNTER) {
			throw new IllegalArgumentException(type + " is not a counter type");
		}
		CounterInstance counter = (CounterInstance) initInstance(name, type);
		counter.setPresetValue(presetValue);
		return counter;
	}

	private CounterInstance requireCounter(String name) {
		CounterInstance counter = getCounter(name);
		if (counter == null) {
			throw new IllegalArgumentException("No counter named '" + name + "'");
		}
		return counter;
	}

	public void pulseCountUp(String name) {
		requireCounter(name).countUp();
	}

	public void pulseCountDown(String name) {
		requireCounter(name).countDown();
	}

	public void resetCounter(String name) {
		requireCounter(name).reset();
	}

	public void loadCounter(String name) {
		requireCounter(name).load();
	}

	/**
	 * Removes a variable or instance.
	 *
	 * @param name its name
	 */
	public void remove(String name) {
		variables.remove(name);
		instances.remove(name);
	}

	/**
	 * @return variable names in declaration order
	 */
	public Set<String> names() {
		return Collections.unmodifiableSet(variables.keySet());
	}

	/**
	 * @return function block instance names in declaration order
	 */
	public Set<String> instanceNames() {
		return Collections.unmodifiableSet(instances.keySet());
	}

	/**
	 * Flattened copy of the state for variable watches: variables by name and
	 * instance members as <code>instance.member</code>.
	 *
	 * @return a new ordered map
	 */
	public Map<String, Value> snapshot() {
		Map<String, Value> result = new LinkedHashMap<String, Value>(variables);
		for (FunctionBlockInstance instance : instances.values()) {
			FunctionBlockType type = instance.getType();
			for (String member : type.getInputs()) {
				result.put(instance.getName() + "." + member, instance.getMember(member));
			}
			for (String member : type.getOutputs()) {
				result.put(instance.getName() + "." + member, instance.getMember(member));
			}
		}
		return result;
	}

	/**
	 * Removes every variable and instance.
	 */
	public void clear() {
		variables.clear();
		instances.clear();
	}

	@Override
	public String toString() {
		return snapshot().toString();
	}
}
