package io.github.pgnmode.util;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings for the backend process and its session.
 *
 * <p>Values come from the classpath defaults in {@code pgn-mode.properties}, overlaid by {@code backend.properties} in
 * the user settings directory (see {@link PgnModeConfigPaths}), overlaid by {@code pgnmode.*} system properties. Keys:
 *
 * <ul>
 *   <li>{@code backend.command}: space-separated command line
 *   <li>{@code backend.libraryPath}: library search path handed to the process
 *   <li>{@code backend.clientVersion}: protocol version this client speaks
 *   <li>{@code backend.pollIntervalMillis}, {@code backend.receiveTimeoutMillis}, {@code backend.startupTimeoutMillis}
 *   <li>{@code backend.stderrLog}: file receiving the process's standard error; blank discards it
 * </ul>
 */
public record BackendConfig(
        List<String> command,
        String libraryPath,
        String clientVersion,
        Duration pollInterval,
        Duration receiveTimeout,
        Duration startupTimeout,
        @Nullable Path stderrLog) {
    private static final Logger logger = LogManager.getLogger(BackendConfig.class);

    static final String DEFAULTS_RESOURCE = "/pgn-mode.properties";
    static final String USER_FILE = "backend.properties";
    static final String SYSTEM_PROPERTY_PREFIX = "pgnmode.";

    public static final String KEY_COMMAND = "backend.command";
    public static final String KEY_LIBRARY_PATH = "backend.libraryPath";
    public static final String KEY_CLIENT_VERSION = "backend.clientVersion";
    public static final String KEY_POLL_INTERVAL = "backend.pollIntervalMillis";
    public static final String KEY_RECEIVE_TIMEOUT = "backend.receiveTimeoutMillis";
    public static final String KEY_STARTUP_TIMEOUT = "backend.startupTimeoutMillis";
    public static final String KEY_STDERR_LOG = "backend.stderrLog";

    public BackendConfig {
        if (command.isEmpty()) {
            throw new IllegalArgumentException(KEY_COMMAND + " must not be empty");
        }
        command = List.copyOf(command);
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive: " + pollInterval);
        }
    }

    public static BackendConfig load() {
        return load(PgnModeConfigPaths.settingsFile(USER_FILE));
    }

    static BackendConfig load(Path userFile) {
        var props = new Properties();
        try (InputStream in = BackendConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("Missing classpath resource {}", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load default backend settings: {}", e.getMessage());
        }

        if (Files.exists(userFile)) {
            try (var reader = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
                props.load(reader);
                logger.debug("Loaded backend settings from {}", userFile);
            } catch (IOException e) {
                logger.warn("Failed to load backend settings from {}: {}", userFile, e.getMessage());
            }
        }

        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX + "backend.")) {
                props.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static BackendConfig fromProperties(Properties props) {
        var command = Splitter.on(' ')
                .trimResults()
                .omitEmptyStrings()
                .splitToList(props.getProperty(KEY_COMMAND, "python3 pygn_server.py"));
        var stderr = props.getProperty(KEY_STDERR_LOG, "").strip();
        return new BackendConfig(
                command,
                props.getProperty(KEY_LIBRARY_PATH, "").strip(),
                props.getProperty(KEY_CLIENT_VERSION, "0.6.0").strip(),
                Duration.ofMillis(parseMillis(props, KEY_POLL_INTERVAL, 10)),
                Duration.ofMillis(parseMillis(props, KEY_RECEIVE_TIMEOUT, 2_000)),
                Duration.ofMillis(parseMillis(props, KEY_STARTUP_TIMEOUT, 10_000)),
                stderr.isEmpty() ? null : Path.of(stderr));
    }

    private static long parseMillis(Properties props, String key, long fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.strip());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value for {}: '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }
}
