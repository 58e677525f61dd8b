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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Settings for a registration that are not part of the parameter maps:
 * where to write logs, and optional point-set files.
 * <p>
 * Instances are immutable; use a {@link Builder} to create or modify settings.
 * Settings can also be read from JSON, where any missing property keeps its default value, e.g.
 * <pre>
 * {
 *   "outputDirectory": "/tmp/registration",
 *   "logFileName": "registration.log",
 *   "logToFile": true,
 *   "logToConsole": false
 * }
 * </pre>
 * 
 * @author SimpleReg developers
 */
public class RegistrationSettings {

	private static final Gson gson = new GsonBuilder()
			.setPrettyPrinting()
			.disableHtmlEscaping()
			.create();

	/**
	 * Default name of the log file written when logging to file.
	 */
	public static final String DEFAULT_LOG_FILE_NAME = "registration.log";

	private String outputDirectory = ".";
	private String logFileName = DEFAULT_LOG_FILE_NAME;
	private boolean logToFile = false;
	private boolean logToConsole = false;
	private String fixedPointSetFileName = "";
	private String movingPointSetFileName = "";

	private RegistrationSettings() {}

	/**
	 * Get the default settings: no file logging, no console logging and no point sets.
	 * @return
	 */
	public static RegistrationSettings getDefault() {
		return new RegistrationSettings();
	}

	/**
	 * Read settings from JSON text.
	 * @param json
	 * @return
	 * @throws JsonParseException if the text is not valid JSON for this class
	 */
	public static RegistrationSettings fromJson(String json) {
		return validated(gson.fromJson(json, RegistrationSettings.class));
	}

	/**
	 * Read settings from JSON.
	 * @param reader
	 * @return
	 * @throws JsonParseException if the text is not valid JSON for this class
	 */
	public static RegistrationSettings fromJson(Reader reader) {
		return validated(gson.fromJson(reader, RegistrationSettings.class));
	}

	/**
	 * Read settings from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static RegistrationSettings read(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return fromJson(reader);
		} catch (JsonParseException e) {
			throw new IOException("Unable to read registration settings from " + path, e);
		}
	}

	private static RegistrationSettings validated(RegistrationSettings settings) {
		if (settings == null)
			return getDefault();
		// JSON may contain explicit nulls
		return new Builder(settings).build();
	}

	/**
	 * Convert the settings to JSON.
	 * @return
	 */
	public String toJson() {
		return gson.toJson(this);
	}

	/**
	 * Get the directory for output files.
	 * @return
	 */
	public String getOutputDirectory() {
		return outputDirectory;
	}

	/**
	 * Get the name of the log file, relative to the output directory.
	 * @return
	 */
	public String getLogFileName() {
		return logFileName;
	}

	/**
	 * Returns true if progress should be written to the log file.
	 * @return
	 */
	public boolean getLogToFile() {
		return logToFile;
	}

	/**
	 * Returns true if progress should be logged at INFO level, rather than DEBUG.
	 * @return
	 */
	public boolean getLogToConsole() {
		return logToConsole;
	}

	/**
	 * Get the fixed point-set file name, or an empty string if none is used.
	 * @return
	 */
	public String getFixedPointSetFileName() {
		return fixedPointSetFileName;
	}

	/**
	 * Get the moving point-set file name, or an empty string if none is used.
	 * @return
	 */
	public String getMovingPointSetFileName() {
		return movingPointSetFileName;
	}

	/**
	 * Returns true if both fixed and moving point-set files are set.
	 * @return
	 */
	public boolean hasPointSets() {
		return !fixedPointSetFileName.isEmpty() && !movingPointSetFileName.isEmpty();
	}

	/**
	 * Get the path of the log file.
	 * @return
	 */
	public Path getLogFilePath() {
		return Path.of(outputDirectory).resolve(logFileName);
	}

	@Override
	public String toString() {
		return "RegistrationSettings [outputDirectory=" + outputDirectory + ", logFileName=" + logFileName
				+ ", logToFile=" + logToFile + ", logToConsole=" + logToConsole + ", fixedPointSetFileName="
				+ fixedPointSetFileName + ", movingPointSetFileName=" + movingPointSetFileName + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(fixedPointSetFileName, logFileName, logToConsole, logToFile, movingPointSetFileName, outputDirectory);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		RegistrationSettings other = (RegistrationSettings) obj;
		return Objects.equals(fixedPointSetFileName, other.fixedPointSetFileName)
				&& Objects.equals(logFileName, other.logFileName) && logToConsole == other.logToConsole
				&& logToFile == other.logToFile && Objects.equals(movingPointSetFileName, other.movingPointSetFileName)
				&& Objects.equals(outputDirectory, other.outputDirectory);
	}


	/**
	 * Builder for {@link RegistrationSettings}.
	 */
	public static class Builder {

		private final RegistrationSettings settings = new RegistrationSettings();

		/**
		 * Builder starting from the default settings.
		 */
		public Builder() {}

		/**
		 * Builder starting from existing settings.
		 * @param settings
		 */
		public Builder(RegistrationSettings settings) {
			outputDirectory(settings.outputDirectory);
			logFileName(settings.logFileName);
			logToFile(settings.logToFile);
			logToConsole(settings.logToConsole);
			fixedPointSetFileName(settings.fixedPointSetFileName);
			movingPointSetFileName(settings.movingPointSetFileName);
		}

		/**
		 * Set the directory for output files.
		 * @param outputDirectory
		 * @return
		 */
		public Builder outputDirectory(String outputDirectory) {
			settings.outputDirectory = outputDirectory == null || outputDirectory.isBlank() ? "." : outputDirectory;
			return this;
		}

		/**
		 * Set the name of the log file, relative to the output directory.
		 * @param logFileName
		 * @return
		 */
		public Builder logFileName(String logFileName) {
			settings.logFileName = logFileName == null || logFileName.isBlank() ? DEFAULT_LOG_FILE_NAME : logFileName;
			return this;
		}

		/**
		 * Specify whether progress should be written to the log file.
		 * @param logToFile
		 * @return
		 */
		public Builder logToFile(boolean logToFile) {
			settings.logToFile = logToFile;
			return this;
		}

		/**
		 * Specify whether progress should be logged at INFO level.
		 * @param logToConsole
		 * @return
		 */
		public Builder logToConsole(boolean logToConsole) {
			settings.logToConsole = logToConsole;
			return this;
		}

		/**
		 * Set the fixed point-set file.
		 * @param fileName
		 * @return
		 */
		public Builder fixedPointSetFileName(String fileName) {
			settings.fixedPointSetFileName = fileName == null ? "" : fileName;
			return this;
		}

		/**
		 * Set the moving point-set file.
		 * @param fileName
		 * @return
		 */
		public Builder movingPointSetFileName(String fileName) {
			settings.movingPointSetFileName = fileName == null ? "" : fileName;
			return this;
		}

		/**
		 * Build the settings.
		 * @return
		 */
		public RegistrationSettings build() {
			var copy = new RegistrationSettings();
			copy.outputDirectory = settings.outputDirectory;
			copy.logFileName = settings.logFileName;
			copy.logToFile = settings.logToFile;
			copy.logToConsole = settings.logToConsole;
			copy.fixedPointSetFileName = settings.fixedPointSetFileName;
			copy.movingPointSetFileName = settings.movingPointSetFileName;
			return copy;
		}

	}

}
