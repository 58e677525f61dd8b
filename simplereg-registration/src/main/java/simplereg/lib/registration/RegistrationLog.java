/*-
 * #%L
 * This file is part of SimpleReg.
 * %%
 * Copyright (C) 2024 SimpleReg developers
 * %%
 * SimpleReg is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SimpleReg is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SimpleReg.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package simplereg.lib.registration;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Progress log for a single registration.
 * Messages go to SLF4J (at INFO if console logging is requested, DEBUG otherwise)
 * and optionally to a plain text log file.
 * 
 * @author SimpleReg developers
 */
class RegistrationLog implements Closeable {

	private static final Logger logger = LoggerFactory.getLogger(RegistrationLog.class);

	private final boolean logToConsole;
	private final BufferedWriter writer;

	private RegistrationLog(boolean logToConsole, BufferedWriter writer) {
		this.logToConsole = logToConsole;
		this.writer = writer;
	}

	/**
	 * Open a log according to the settings.
	 * @param settings
	 * @return
	 * @throws UncheckedIOException if the log file cannot be created
	 */
	static RegistrationLog open(RegistrationSettings settings) {
		if (!settings.getLogToFile())
			return new RegistrationLog(settings.getLogToConsole(), null);
		var path = settings.getLogFilePath();
		try {
			var parent = path.toAbsolutePath().getParent();
			if (parent != null)
				Files.createDirectories(parent);
			var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
					StandardOpenOption.CREATE, StandardOpenOption.APPEND);
			logger.debug("Writing registration log to {}", path);
			return new RegistrationLog(settings.getLogToConsole(), writer);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to open registration log " + path, e);
		}
	}

	void log(String format, Object... arguments) {
		if (logToConsole)
			logger.info(format, arguments);
		else
			logger.debug(format, arguments);
		if (writer != null) {
			try {
				writer.write(MessageFormatter.arrayFormat(format, arguments).getMessage());
				writer.newLine();
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}
	}

	@Override
	public void close() {
		if (writer == null)
			return;
		try {
			writer.close();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
