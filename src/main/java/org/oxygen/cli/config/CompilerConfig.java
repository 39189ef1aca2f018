package org.oxygen.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import picocli.CommandLine.Help.Ansi;

/**
 * The settings of the command line compiler, read from the {@code oxygen} block
 * of the HOCON configuration:
 * <pre>
 * oxygen {
 *   source-extension = "o2"
 *   diagnostics.color = "AUTO"   # AUTO, ON or OFF
 * }
 * </pre>
 *
 * @param sourceExtension The expected extension of source files, without the dot.
 * @param color Whether diagnostics are coloured.
 */
public record CompilerConfig(String sourceExtension, Ansi color) {

    private static final String ROOT_PATH = "oxygen";
    private static final String SOURCE_EXTENSION_KEY = "source-extension";
    private static final String COLOR_KEY = "diagnostics.color";

    /**
     * Reads the compiler settings.
     * @param config The application configuration; must contain the {@code oxygen} block.
     * @return The settings.
     * @throws ConfigException if a setting is missing or invalid.
     */
    public static CompilerConfig fromConfig(final Config config) {
        final Config oxygen = config.getConfig(ROOT_PATH);
        final String extension = oxygen.getString(SOURCE_EXTENSION_KEY);
        if (extension.isBlank() || extension.startsWith(".")) {
            throw new ConfigException.BadValue(oxygen.origin(), ROOT_PATH + "." + SOURCE_EXTENSION_KEY,
                    "must be a non-empty extension without leading dot, got '" + extension + "'");
        }
        return new CompilerConfig(extension, oxygen.getEnum(Ansi.class, COLOR_KEY));
    }

    /**
     * @param fileName A file name or path.
     * @return {@code true} if the name ends with the configured source extension.
     */
    public boolean isSourceFile(final String fileName) {
        return fileName.endsWith("." + sourceExtension);
    }
}
