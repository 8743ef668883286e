package org.asmscribe.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Composes the HOCON configuration for the command line.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dasmscribe.rendering.indent=2})</li>
 *   <li>Environment variables</li>
 *   <li>The configuration file found by {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are stacked, so a user file may override values
 * that {@code reference.conf} refers to.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "asmscribe.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is looked up.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Finds the configuration file and loads it:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/asmscribe.conf} in the working directory</li>
     *   <li>{@code APP_HOME/config/asmscribe.conf} next to the installed jar</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile File from the command line, or {@code null}.
     * @param handler            Receives which file was chosen.
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: "
                            + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.INFO,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using built-in defaults.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/asmscribe.conf}, where {@code APP_HOME} is the parent of the
     * {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} if it cannot be determined or does not exist.
     */
    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain != null ? protectionDomain.getCodeSource() : null;
        if (codeSource == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jarOrClasses.isFile()) {
            // classes directory during development, the working directory lookup covers it
            return null;
        }
        final File libDir = jarOrClasses.getParentFile();
        final File appHome = libDir != null ? libDir.getParentFile() : null;
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
