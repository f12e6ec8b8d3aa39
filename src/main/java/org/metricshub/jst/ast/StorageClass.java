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

/**
 * The VAR block a variable is declared in.
 * <p>
 * In a single PROGRAM they only differ by {@link #VAR_TEMP}, whose variables
 * are reset to their initial value at the start of every scan.
 */
public enum StorageClass {
	VAR,
	VAR_INPUT,
	VAR_OUTPUT,
	VAR_IN_OUT,
	VAR_TEMP;

	/**
	 * @param keyword VAR block keyword, e.g. <code>VAR_INPUT</code>
	 * @return the storage class
	 */
	public static StorageClass fromKeyword(String keyword) {
		return valueOf(keyword);
	}
}
