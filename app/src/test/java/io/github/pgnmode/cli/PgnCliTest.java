package io.github.pgnmode.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.github.pgnmode.server.BackendLauncher;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class PgnCliTest {
    private static final String TEXT = "[Event \"A\"]\n\n1. e4 e5 (1... c5 2. Nf3) 2. Nf3 *\n";

    @TempDir
    Path tempDir;

    private Path pgn;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        pgn = tempDir.resolve("game.pgn");
        Files.writeString(pgn, TEXT);
        System.setProperty("pgnmode.configDir", tempDir.resolve("config").toString());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("pgnmode.configDir");
    }

    private int run(@Nullable BackendLauncher launcher, String... args) {
        var cmd = new CommandLine(new PgnCli(launcher));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private int run(String... args) {
        return run(null, args);
    }

    @Test
    void testNextMove() {
        int code = run(pgn.toString(), "--next", "--pos", String.valueOf(TEXT.indexOf("e4")));
        assertEquals(0, code, err.toString());
        assertEquals(String.valueOf(TEXT.indexOf("e5")), out.toString().strip());
    }

    @Test
    void testPreviousMoveWithCount() {
        int code = run(pgn.toString(), "--previous", "--count", "2", "--pos", String.valueOf(TEXT.lastIndexOf("Nf3")));
        assertEquals(0, code, err.toString());
        assertEquals(String.valueOf(TEXT.indexOf("e4")), out.toString().strip());
    }

    @Test
    void testNoMoreMovesExitsWithOne() {
        int code = run(pgn.toString(), "--previous", "--pos", String.valueOf(TEXT.indexOf("e4")));
        assertEquals(1, code);
        assertTrue(err.toString().contains("No more moves"), err.toString());
    }

    @Test
    void testExtractAsVariation() {
        var pos = String.valueOf(TEXT.indexOf("Nf3)") + 3);
        int code = run(pgn.toString(), "--extract", "--as-variation", "--pos", pos);
        assertEquals(0, code, err.toString());
        assertEquals("[Event \"A\"]\n\n1... c5 2. Nf3", out.toString().stripTrailing());
    }

    @Test
    void testTree() throws IOException {
        var file = tempDir.resolve("short.pgn");
        Files.writeString(file, "1. e4 *");
        assertEquals(0, run(file.toString(), "--tree"));
        assertEquals(
                "(series_of_games (game (movetext (move_number) (san_move)) (result_code)))",
                out.toString().strip());
    }

    @Test
    void testUsageErrors() {
        assertEquals(2, run(pgn.toString()));
        assertEquals(2, run(pgn.toString(), "--next", "--previous"));
        assertEquals(2, run(pgn.toString(), "--next", "--pos", "10000"));
        assertEquals(2, run(pgn.toString(), "--next", "--count", "0"));
        assertEquals(2, run("--bogus"));
    }

    @Test
    void testMissingFileExitsWithOne() {
        assertEquals(1, run(tempDir.resolve("missing.pgn").toString(), "--extract"));
    }

    @Test
    void testVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().contains("0.6.0"), out.toString());
    }

    @Test
    void testFenThroughBackend() {
        BackendLauncher launcher = () -> new ScriptedProcess(":version 0.6.0 :ready\n:version 0.6.0 :fen the-fen\n");
        int code = run(launcher, pgn.toString(), "--fen", "--pos", String.valueOf(TEXT.indexOf("e5") + 2));
        assertEquals(0, code, err.toString());
        assertEquals("the-fen", out.toString().strip());
    }

    @Test
    void testBackendFailureExitsWithOne() {
        BackendLauncher launcher = () -> new ScriptedProcess(":version 0.6.0 :ready\n:version 0.6.0 :san wrong\n");
        assertEquals(1, run(launcher, pgn.toString(), "--fen"));
        assertTrue(err.toString().contains("Backend error"), err.toString());
    }

    /** A process whose entire output is fixed up front and which ignores its input. */
    private static final class ScriptedProcess extends Process {
        private final PipedInputStream stdout = new PipedInputStream();
        private final PipedOutputStream stdin = new PipedOutputStream();
        private final PipedInputStream stdinSink = new PipedInputStream();
        private volatile boolean alive = true;

        ScriptedProcess(String output) throws IOException {
            stdin.connect(stdinSink);
            var source = new PipedOutputStream(stdout);
            var writer = new Thread(() -> {
                try {
                    source.write(output.getBytes(StandardCharsets.UTF_8));
                    source.flush();
                    // keep the write end open until the process is destroyed
                    while (alive) {
                        Thread.sleep(10);
                    }
                    source.close();
                } catch (IOException | InterruptedException e) {
                    alive = false;
                }
            });
            writer.setDaemon(true);
            writer.start();
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
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() {
            return 0;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException();
            }
            return 0;
        }

        @Override
        public void destroy() {
            alive = false;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
