package io.github.pgnmode.server;

import com.google.common.base.CharMatcher;
import io.github.pgnmode.server.BackendException.AlreadyRunningException;
import io.github.pgnmode.server.BackendException.EmptyResponseException;
import io.github.pgnmode.server.BackendException.MalformedTagException;
import io.github.pgnmode.server.BackendException.MissingVersionException;
import io.github.pgnmode.server.BackendException.ProtocolException;
import io.github.pgnmode.server.BackendException.SessionNotRunningException;
import io.github.pgnmode.server.BackendException.StartupFailedException;
import io.github.pgnmode.server.BackendException.VersionMismatchException;
import io.github.pgnmode.util.BackendConfig;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A long-lived handle to one backend process.
 *
 * <p>Output from the process is accumulated by a reader thread into a pending buffer; {@link #receive()} polls that
 * buffer and hands back whatever has arrived once a full line is present or the receive timeout passes. Only one
 * request may be outstanding at a time, so {@link #query} is synchronized.
 *
 * <p>A session restarted while a receive is in flight abandons that receive: output from the old process is dropped
 * because every reader thread is tagged with the generation of the process it reads.
 */
public class BackendSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(BackendSession.class);

    public static final String READY_TAG = ":ready";

    private static final Pattern VERSION = Pattern.compile("\\A:version\\s+([0-9]+(?:\\.[0-9A-Za-z]+)*)(?=\\s|\\z)");
    private static final Pattern TAG = Pattern.compile("\\A\\s+(:\\S+)");

    public enum State {
        STOPPED,
        STARTING,
        READY,
        QUERYING,
        RESTARTING,
        ERROR
    }

    private final BackendLauncher launcher;
    private final String clientVersion;
    private final Duration pollInterval;
    private final Duration receiveTimeout;
    private final Duration startupTimeout;

    private final Object bufferLock = new Object();
    private final StringBuilder pending = new StringBuilder();
    private final AtomicInteger generation = new AtomicInteger();

    @Nullable
    private Process process;

    @Nullable
    private Writer input;

    private volatile boolean outputClosed;
    private volatile State state = State.STOPPED;

    public BackendSession(BackendConfig config) {
        this(
                new ProcessBackendLauncher(config),
                config.clientVersion(),
                config.pollInterval(),
                config.receiveTimeout(),
                config.startupTimeout());
    }

    public BackendSession(
            BackendLauncher launcher,
            String clientVersion,
            Duration pollInterval,
            Duration receiveTimeout,
            Duration startupTimeout) {
        this.launcher = launcher;
        this.clientVersion = clientVersion;
        this.pollInterval = pollInterval;
        this.receiveTimeout = receiveTimeout;
        this.startupTimeout = startupTimeout;
    }

    public String clientVersion() {
        return clientVersion;
    }

    public State state() {
        return state;
    }

    public synchronized boolean isRunning() {
        return process != null && process.isAlive();
    }

    /**
     * Spawns the backend and blocks until its first line acknowledges readiness.
     *
     * @param force kill a live session first instead of failing
     * @throws AlreadyRunningException if a session is live and {@code force} is false
     * @throws StartupFailedException if the process cannot be spawned or never reports ready
     */
    public synchronized void start(boolean force) throws BackendException, InterruptedException {
        if (isRunning()) {
            if (!force) {
                throw new AlreadyRunningException();
            }
            kill();
        } else if (process != null) {
            // exited on its own; release what is left of it
            kill();
        }

        state = State.STARTING;
        Process p;
        try {
            p = launcher.launch();
        } catch (IOException e) {
            state = State.ERROR;
            throw new StartupFailedException("failed to launch backend: " + e.getMessage(), "", e);
        }

        int gen = generation.incrementAndGet();
        synchronized (bufferLock) {
            pending.setLength(0);
        }
        outputClosed = false;
        process = p;
        input = new BufferedWriter(new OutputStreamWriter(p.getOutputStream(), StandardCharsets.UTF_8));
        var reader = new Thread(() -> readOutput(p, gen), "pgn-backend-reader-" + gen);
        reader.setDaemon(true);
        reader.start();

        awaitReady();
        state = State.READY;
        logger.info("Backend session ready (client version {})", clientVersion);
    }

    private void awaitReady() throws StartupFailedException, InterruptedException {
        long deadline = System.nanoTime() + startupTimeout.toNanos();
        while (true) {
            // read before the buffer: once the reader reports EOF the buffer holds all output
            boolean closed = outputClosed;
            String firstLine = null;
            synchronized (bufferLock) {
                int newline = pending.indexOf("\n");
                if (newline >= 0) {
                    firstLine = pending.substring(0, newline + 1);
                    pending.delete(0, newline + 1);
                }
            }
            if (firstLine != null) {
                if (isReadyLine(firstLine)) {
                    return;
                }
                failStartup("backend did not acknowledge readiness", firstLine + drain());
            }
            if (closed) {
                failStartup("backend exited before acknowledging readiness", drain());
            }
            if (System.nanoTime() - deadline >= 0) {
                failStartup("timed out after " + startupTimeout.toMillis() + " ms waiting for backend", drain());
            }
            sleepPollInterval();
        }
    }

    private boolean isReadyLine(String line) {
        var versionMatch = VERSION.matcher(line);
        if (!versionMatch.find()) {
            return false;
        }
        var rest = line.substring(versionMatch.end());
        var tagMatch = TAG.matcher(rest);
        if (!tagMatch.find() || !READY_TAG.equals(tagMatch.group(1))) {
            return false;
        }
        var serverVersion = versionMatch.group(1);
        if (!serverVersion.equals(clientVersion)) {
            logger.warn("Backend reports version {} but client speaks {}", serverVersion, clientVersion);
        }
        return true;
    }

    private void failStartup(String message, String output) throws StartupFailedException {
        kill();
        state = State.ERROR;
        logger.warn("Backend startup failed: {}", message);
        throw new StartupFailedException(message, output);
    }

    /**
     * Writes one request line to the backend.
     *
     * @throws SessionNotRunningException if no session is ready, or the write fails
     */
    public synchronized void send(String command, Map<String, ?> options, String payloadType, String payload)
            throws SessionNotRunningException {
        var in = input;
        if (state != State.READY || in == null || !isRunning()) {
            throw new SessionNotRunningException("cannot send " + command + ": no backend session is running");
        }
        var request = RequestEncoder.encode(clientVersion, command, options, payloadType, payload);
        logger.debug("-> {}", request.stripTrailing());
        try {
            in.write(request);
            in.flush();
        } catch (IOException e) {
            logger.warn("Failed writing to backend: {}", e.getMessage());
            kill();
            var ex = new SessionNotRunningException("backend input closed while sending " + command);
            ex.initCause(e);
            throw ex;
        }
    }

    /**
     * Waits for the next response line. Returns as soon as the pending output ends with a newline; after the receive
     * timeout returns whatever has accumulated, possibly the empty string. Either way the buffer is cleared.
     *
     * @throws SessionNotRunningException if no session was ever started, or it has been killed
     */
    public synchronized String receive() throws SessionNotRunningException, InterruptedException {
        if (process == null) {
            throw new SessionNotRunningException("cannot receive: no backend session is running");
        }
        long deadline = System.nanoTime() + receiveTimeout.toNanos();
        while (true) {
            synchronized (bufferLock) {
                int len = pending.length();
                if (len > 0 && pending.charAt(len - 1) == '\n') {
                    var raw = drain();
                    logger.debug("<- {}", raw.stripTrailing());
                    return raw;
                }
            }
            if (System.nanoTime() - deadline >= 0) {
                var partial = drain();
                logger.debug(
                        "Receive timed out after {} ms with {} chars", receiveTimeout.toMillis(), partial.length());
                return partial;
            }
            sleepPollInterval();
        }
    }

    /** Starts a session if none is live, then sends the request and waits for its reply. */
    public synchronized String query(String command, Map<String, ?> options, String payloadType, String payload)
            throws BackendException, InterruptedException {
        if (!isRunning() || state != State.READY) {
            start(true);
        }
        send(command, options, payloadType, payload);
        state = State.QUERYING;
        try {
            return receive();
        } finally {
            if (state == State.QUERYING) {
                state = State.READY;
            }
        }
    }

    /**
     * Validates a raw reply and splits it into version, tag and content. A missing or mismatched version restarts the
     * session before the exception is thrown, so the next query runs against a fresh process.
     */
    public BackendResponse parseResponse(String raw) throws ProtocolException, InterruptedException {
        if (raw.isEmpty()) {
            throw new EmptyResponseException();
        }
        var versionMatch = VERSION.matcher(raw);
        if (!versionMatch.find()) {
            restart("response without version");
            throw new MissingVersionException(raw);
        }
        var serverVersion = versionMatch.group(1);
        if (!serverVersion.equals(clientVersion)) {
            restart("version mismatch (backend " + serverVersion + ")");
            throw new VersionMismatchException(clientVersion, serverVersion, raw);
        }
        var rest = raw.substring(versionMatch.end());
        var tagMatch = TAG.matcher(rest);
        if (!tagMatch.find()) {
            throw new MalformedTagException(raw);
        }
        var content = rest.substring(tagMatch.end());
        if (content.endsWith("\r\n")) {
            content = content.substring(0, content.length() - 2);
        } else if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        content = CharMatcher.whitespace().trimLeadingFrom(content);
        return new BackendResponse(serverVersion, tagMatch.group(1), content);
    }

    private synchronized void restart(String reason) throws InterruptedException {
        logger.warn("Restarting backend session: {}", reason);
        state = State.RESTARTING;
        try {
            start(true);
        } catch (BackendException e) {
            logger.warn("Backend restart failed", e);
        }
    }

    /** Closes the process input, terminates the process and clears the session. Safe to call repeatedly. */
    public synchronized void kill() {
        var p = process;
        var in = input;
        process = null;
        input = null;
        generation.incrementAndGet();
        synchronized (bufferLock) {
            pending.setLength(0);
        }
        if (p == null) {
            if (state != State.ERROR) {
                state = State.STOPPED;
            }
            return;
        }

        if (in != null) {
            try {
                in.close();
            } catch (IOException e) {
                logger.debug("Error closing backend input: {}", e.getMessage());
            }
        }
        try {
            if (!p.waitFor(200, TimeUnit.MILLISECONDS)) {
                p.destroy();
                if (!p.waitFor(1, TimeUnit.SECONDS)) {
                    p.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        state = State.STOPPED;
        logger.info("Backend session stopped");
    }

    @Override
    public void close() {
        kill();
    }

    private String drain() {
        synchronized (bufferLock) {
            var out = pending.toString();
            pending.setLength(0);
            return out;
        }
    }

    private void sleepPollInterval() throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(pollInterval.toNanos());
    }

    private void readOutput(Process p, int gen) {
        var buf = new char[4096];
        try (var reader = new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                synchronized (bufferLock) {
                    if (generation.get() != gen) {
                        return;
                    }
                    pending.append(buf, 0, n);
                }
            }
        } catch (IOException e) {
            if (generation.get() == gen) {
                logger.error("Error reading backend output", e);
            } else {
                logger.debug("Reader for replaced backend stopped: {}", e.getMessage());
            }
        }
        if (generation.get() == gen) {
            outputClosed = true;
            logger.debug("Backend output closed");
        }
    }
}
