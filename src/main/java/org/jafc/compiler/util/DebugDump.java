package org.jafc.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jafc.ain.Ain;
import org.jafc.compiler.diagnostics.CompilerLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for dumping debug information during compilation.
 */
public final class DebugDump {

	static final String OBJECT_MODEL_FILE = "object_model.json";

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

	private DebugDump() {}

	/**
	 * Writes the populated object model as JSON to {@code <directory>/<program>/object_model.json}.
	 * Failures are logged and otherwise ignored.
	 * @param directory The dump root directory.
	 * @param programName The name of the program, used for creating the dump directory.
	 * @param ain The object to dump.
	 * @return The written file, or null if writing failed.
	 */
	public static Path dumpObjectModel(Path directory, String programName, Ain ain) {
		Path root = directory.resolve(sanitize(programName));
		Path file = root.resolve(OBJECT_MODEL_FILE);
		try {
			Files.createDirectories(root);
			Files.writeString(file, GSON.toJson(ain));
			CompilerLogger.debug("DebugDump: wrote " + file);
			return file;
		} catch (IOException e) {
			CompilerLogger.warn("DebugDump: could not write " + file + ": " + e.getMessage());
			return null;
		}
	}

	static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
