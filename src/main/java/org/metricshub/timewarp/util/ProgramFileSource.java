package org.metricshub.timewarp.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Time Warp
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
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Program text stored in a file. The path is the description shown in
 * error messages, and its extension (<code>.twb</code>, <code>.pas</code>,
 * <code>.pl</code>...) selects the language when none is given.
 * The file is read as UTF-8 and opened on the first {@link #getReader()}.
 */
public class ProgramFileSource extends ProgramSource {

	private final String filePath;
	private Reader fileReader;

	/**
	 * @param filePath path of the program file, as typed by the user
	 */
	public ProgramFileSource(String filePath) {
		super(filePath, null);
		this.filePath = filePath;
	}

	public String getFilePath() {
		return filePath;
	}

	@Override
	public Reader getReader() throws IOException {
		if (fileReader == null) {
			Path path = Paths.get(filePath);
			if (!Files.isRegularFile(path)) {
				throw new IOException("Program file not found: " + filePath);
			}
			fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
		}
		return fileReader;
	}
}
