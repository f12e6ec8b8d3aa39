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

import org.metricshub.jst.util.JstSettings;

/**
 * Options of {@link LadderTransformer}.
 */
public class TransformOptions {

	private boolean warnOnUnsupported = true;
	private boolean includeIntermediates;

	/**
	 * @param settings the settings to read the ladder options from
	 * @return options matching the settings
	 */
	public static TransformOptions from(JstSettings settings) {
		return new TransformOptions()
				.setWarnOnUnsupported(settings.isWarnOnUnsupported())
				.setIncludeIntermediates(settings.isIncludeIntermediates());
	}

	/**
	 * @return {@code true} to skip constructs that have no ladder equivalent
	 *         with a warning, {@code false} to render them as marker nodes
	 */
	public boolean isWarnOnUnsupported() {
		return warnOnUnsupported;
	}

	public TransformOptions setWarnOnUnsupported(boolean warnOnUnsupported) {
		this.warnOnUnsupported = warnOnUnsupported;
		return this;
	}

	/**
	 * @return {@code true} to also lower the statements nested in IF and CASE
	 *         bodies, guarded by the branch condition
	 */
	public boolean isIncludeIntermediates() {
		return includeIntermediates;
	}

	public TransformOptions setIncludeIntermediates(boolean includeIntermediates) {
		this.includeIntermediates = includeIntermediates;
		return this;
	}
}
