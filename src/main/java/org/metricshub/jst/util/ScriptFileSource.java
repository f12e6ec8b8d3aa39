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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A {@link ScriptSource} reading a <code>.st</code> file as UTF-8. Every call
 * to {@link #getReader()} opens the file again, so a session can reload the
 * program after it was edited on disk.
 */
public class ScriptFileSource extends ScriptSource {

	private final Path path;

	/**
	 * @param filePath path of the Structured Text file
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.path = Paths.get(filePath);
	}

	public Path getPath() {
		return path;
	}

	/**
	 * @return a new reader on the file
	 * @throws IOException when the file does not exist or is a directory
	 */
	@Override
	public Reader getReader() throws IOException {
		if (Files.isDirectory(path)) {
			throw new IOException(path + " is a directory, not a Structured Text program");
		}
		if (!Files.exists(path)) {
			throw new NoSuchFileException(path.toString(), null, "Structured Text program not found");
		}
		return Files.newBufferedReader(path, StandardCharsets.UTF_8);
	}

	@Override
	public String readContent() throws IOException {
		try (Reader reader = getReader()) {
			return readFully(reader);
		}
	}
}
