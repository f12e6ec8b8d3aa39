package org.metricshub.jst.util;

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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one Structured Text source, i.e. a description used in messages
 * and a {@link Reader} serving the program text.
 */
public class ScriptSource {

	/** Description of a program supplied on the command line */
	public static final String DESCRIPTION_COMMAND_LINE_SCRIPT = "<command-line-supplied-program>";

	/** Description of a program supplied as a string through the API */
	public static final String DESCRIPTION_INLINE = "<inline>";

	private String description;
	private Reader reader;

	/**
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source backed by an in-memory string.
	 *
	 * @param source program text
	 * @return a new ScriptSource described as {@value #DESCRIPTION_INLINE}
	 */
	public static ScriptSource of(String source) {
		return new ScriptSource(DESCRIPTION_INLINE, new StringReader(source));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the program contents.
	 *
	 * @return The reader which contains the program contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole program text. The reader is consumed.
	 *
	 * @return the program text
	 * @throws IOException when the reader fails
	 */
	public String readContent() throws IOException {
		return readFully(getReader());
	}

	/**
	 * @param r reader to drain, left open
	 * @return everything the reader serves
	 * @throws IOException when the reader fails
	 */
	protected static String readFully(Reader r) throws IOException {
		StringBuilder content = new StringBuilder();
		char[] buffer = new char[4096];
		int count;
		while ((count = r.read(buffer)) >= 0) {
			content.append(buffer, 0, count);
		}
		return content.toString();
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
