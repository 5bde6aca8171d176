package io.github.pgnmode.server;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory stand-in for the backend process. Every request line written to its input is recorded and handed to a
 * responder whose reply, if any, is written to its output. Closing the input ends the process, as with the real
 * backend.
 */
final class FakeBackendProcess extends Process {
    static final String READY_LINE = ":version 0.6.0 :ready\n";

    private final PipedInputStream stdout = new PipedInputStream(64 * 1024);
    private final PipedOutputStream stdoutSink = new PipedOutputStream();
    private final PipedInputStream stdinSource = new PipedInputStream(64 * 1024);
    private final PipedOutputStream stdin = new PipedOutputStream();
    private final CountDownLatch exited = new CountDownLatch(1);
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final Function<String, @Nullable String> responder;

    private FakeBackendProcess(@Nullable String greeting, Function<String, @Nullable String> responder)
            throws IOException {
        this.responder = responder;
        stdout.connect(stdoutSink);
        stdinSource.connect(stdin);
        var worker = new Thread(() -> serve(greeting), "fake-backend");
        worker.setDaemon(true);
        worker.start();
    }

    /** A backend that acknowledges readiness and answers every request through {@code responder}. */
    static FakeBackendProcess ready(Function<String, @Nullable String> responder) throws IOException {
        return new FakeBackendProcess(READY_LINE, responder);
    }

    /** A backend that prints {@code greeting} first, or nothing at all when it is null. */
    static FakeBackendProcess greeting(@Nullable String greeting, Function<String, @Nullable String> responder)
            throws IOException {
        return new FakeBackendProcess(greeting, responder);
    }

    List<String> requests() {
        return requests;
    }

    private void serve(@Nullable String greeting) {
        try (var reader = new BufferedReader(new InputStreamReader(stdinSource, StandardCharsets.UTF_8))) {
            if (greeting != null) {
                write(greeting);
            }
            String line;
            while ((line = reader.readLine()) != null) {
                requests.add(line);
                var reply = responder.apply(line);
                if (reply != null) {
                    write(reply);
                }
            }
        } catch (IOException e) {
            // the session side went away; nothing left to serve
        } finally {
            finish();
        }
    }

    private void write(String s) throws IOException {
        stdoutSink.write(s.getBytes(StandardCharsets.UTF_8));
        stdoutSink.flush();
    }

    private void finish() {
        try {
            stdoutSink.close();
        } catch (IOException e) {
            // already closed
        }
        exited.countDown();
    }

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return new ByteArrayInputStream(new byte[0]);
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return 0;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (exited.getCount() > 0) {
            throw new IllegalThreadStateException("still running");
        }
        return 0;
    }

    @Override
    public void destroy() {
        try {
            stdinSource.close();
        } catch (IOException e) {
            // already closed
        }
        finish();
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }
}
