package org.tessera.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Loads the application configuration for the command line.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dmosaic.threads=8})</li>
 *   <li>environment variables</li>
 *   <li>the user configuration file, if one is found</li>
 *   <li>{@code reference.conf} defaults on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are merged, so a user override of a value that
 * {@code reference.conf} refers to reaches every reference.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "tessera.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates and loads the configuration. The first match wins:
     * <ol>
     *   <li>{@code explicitConfigFile} from the {@code --config} option</li>
     *   <li>the {@code -Dconfig.file} system property</li>
     *   <li>{@code config/tessera.conf} in the working directory</li>
     *   <li>{@code APP_HOME/config/tessera.conf} next to the installed jar</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile the file named on the command line, or {@code null}.
     * @param handler            receives a message naming the chosen source.
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            final File file = new File(property).getAbsoluteFile();
            requireExists(file, "Configuration file named by -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + file);
            return loadFromFile(file);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installedFile = installationConfigFile();
        if (installedFile != null) {
            handler.log(MessageLevel.INFO, "Using installed configuration file " + installedFile.getAbsolutePath());
            return loadFromFile(installedFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using built-in defaults");
        return loadDefaults();
    }

    /**
     * Loads a configuration file over the classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the classpath defaults with system property and environment overrides.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExists(final File file, final String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    /**
     * Finds {@code config/tessera.conf} in the installation directory, which is the parent of the {@code lib}
     * directory holding the application jar.
     *
     * @return the file, or {@code null} when not running from an installed jar or when the file is absent.
     */
    private static File installationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final File location;
        try {
            location = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!location.isFile() || location.getParentFile() == null) {
            return null;
        }
        final File appHome = location.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        final File file = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return file.isFile() ? file : null;
    }
}
