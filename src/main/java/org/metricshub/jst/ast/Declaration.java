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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jst.util.SourceSpan;

/**
 * One declared name. <code>A, B : BOOL;</code> yields two declarations
 * sharing the type and the initial value.
 */
public final class Declaration extends AstNode {

	private final String name;
	private final DataType dataType;
	private final String typeName;
	private final StorageClass storageClass;
	private final boolean constant;
	private final boolean retain;
	private final Expression initialValue;
	private final List<ParameterBinding> presets;

	public Declaration(
			NodeId id,
			SourceSpan span,
			String name,
			DataType dataType,
			String typeName,
			StorageClass storageClass,
			boolean constant,
			boolean retain,
			Expression initialValue,
			List<ParameterBinding> presets) {
		super(id, span);
		this.name = name;
		this.dataType = dataType;
		this.typeName = typeName;
		this.storageClass = storageClass;
		this.constant = constant;
		this.retain = retain;
		this.initialValue = initialValue;
		this.presets = presets == null ? Collections.<ParameterBinding>emptyList()
				: Collections.unmodifiableList(new ArrayList<ParameterBinding>(presets));
	}

	public String getName() {
		return name;
	}

	public DataType getDataType() {
		return dataType;
	}

	/**
	 * @return the type name as written, e.g. <code>DINT</code> for an INT
	 */
	public String getTypeName() {
		return typeName;
	}

	public StorageClass getStorageClass() {
		return storageClass;
	}

	public boolean isConstant() {
		return constant;
	}

	public boolean isRetain() {
		return retain;
	}

	public boolean isFunctionBlock() {
		return dataType.isFunctionBlock();
	}

	/**
	 * @return the initial value expression, {@code null} when absent
	 */
	public Expression getInitialValue() {
		return initialValue;
	}

	/**
	 * @return the preset bindings of a function block instance
	 */
	public List<ParameterBinding> getPresets() {
		return presets;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name).append(" : ").append(typeName);
		if (initialValue != null) {
			sb.append(" := ").append(initialValue);
		} else if (!presets.isEmpty()) {
			sb.append(" := (");
			for (int i = 0; i < presets.size(); i++) {
				sb.append(i > 0 ? ", " : "").append(presets.get(i));
			}
			sb.append(')');
		}
		return sb.append(';').toString();
	}
}
