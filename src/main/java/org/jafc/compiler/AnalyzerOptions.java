package org.jafc.compiler;

import com.typesafe.config.Config;
import org.jafc.compiler.config.ConfigLoader;

import java.nio.file.Path;

/**
 * Settings of the static analyzer, read from the {@code jafc.analyzer} section of the configuration.
 *
 * @param foldConstants Whether literal subexpressions are folded.
 * @param implicitFloatConversion Whether int values may be stored into float locations.
 * @param verbosity The {@link org.jafc.compiler.diagnostics.CompilerLogger} level.
 * @param dumpEnabled Whether the object model is dumped after a successful analysis.
 * @param dumpDirectory The root directory of debug dumps.
 */
public record AnalyzerOptions(boolean foldConstants,
                              boolean implicitFloatConversion,
                              int verbosity,
                              boolean dumpEnabled,
                              Path dumpDirectory) {

    private static final String PREFIX = "jafc.analyzer";

    /**
     * @param config A resolved configuration containing the {@code jafc.analyzer} section.
     * @return The options.
     */
    public static AnalyzerOptions fromConfig(Config config) {
        Config analyzer = config.getConfig(PREFIX);
        return new AnalyzerOptions(
                analyzer.getBoolean("fold-constants"),
                analyzer.getBoolean("implicit-float-conversion"),
                analyzer.getInt("verbosity"),
                analyzer.getBoolean("dump.enabled"),
                Path.of(analyzer.getString("dump.directory")));
    }

    /**
     * @return The options of the configuration found by {@link ConfigLoader#load()}: {@code reference.conf}
     *         overridden by {@code jafc.conf}, system properties and environment variables.
     */
    public static AnalyzerOptions defaults() {
        return fromConfig(ConfigLoader.load());
    }
}
