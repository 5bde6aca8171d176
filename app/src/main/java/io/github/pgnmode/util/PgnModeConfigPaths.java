package io.github.pgnmode.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Locates per-user settings files. They live in a {@code PgnMode} directory under the platform's usual place for
 * application settings ({@code %APPDATA%}, {@code ~/Library/Application Support}, {@code $XDG_CONFIG_HOME} or
 * {@code ~/.config}), unless the {@code pgnmode.configDir} system property names another directory.
 */
public final class PgnModeConfigPaths {
    private static final Logger logger = LogManager.getLogger(PgnModeConfigPaths.class);

    static final String DIRECTORY_NAME = "PgnMode";
    static final String OVERRIDE_PROPERTY = "pgnmode.configDir";

    private PgnModeConfigPaths() {}

    /** The user settings file {@code fileName}, which may not exist. */
    public static Path settingsFile(String fileName) {
        return settingsDir(System.getProperties(), System.getenv()).resolve(fileName);
    }

    static Path settingsDir(Properties system, Map<String, String> env) {
        var override = system.getProperty(OVERRIDE_PROPERTY, "").strip();
        if (!override.isEmpty()) {
            try {
                return Path.of(override);
            } catch (InvalidPathException e) {
                logger.warn("Ignoring {}={}: {}", OVERRIDE_PROPERTY, override, e.getReason());
            }
        }
        var home = Path.of(system.getProperty("user.home", ""));
        return applicationSettingsRoot(system.getProperty("os.name", ""), env, home)
                .resolve(DIRECTORY_NAME);
    }

    private static Path applicationSettingsRoot(String osName, Map<String, String> env, Path home) {
        var os = osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return envDirectory(env, "APPDATA").orElse(home.resolve("AppData").resolve("Roaming"));
        }
        if (os.startsWith("mac")) {
            return home.resolve("Library").resolve("Application Support");
        }
        return envDirectory(env, "XDG_CONFIG_HOME").orElse(home.resolve(".config"));
    }

    private static Optional<Path> envDirectory(Map<String, String> env, String name) {
        var value = env.getOrDefault(name, "").strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(value));
        } catch (InvalidPathException e) {
            logger.warn("Ignoring ${}={}: {}", name, value, e.getReason());
            return Optional.empty();
        }
    }
}
