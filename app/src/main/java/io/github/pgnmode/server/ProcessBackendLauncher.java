package io.github.pgnmode.server;

import io.github.pgnmode.util.BackendConfig;
import java.io.IOException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Launches the backend as an operating-system process described by a {@link BackendConfig}. */
public class ProcessBackendLauncher implements BackendLauncher {
    private static final Logger logger = LogManager.getLogger(ProcessBackendLauncher.class);

    private final BackendConfig config;

    public ProcessBackendLauncher(BackendConfig config) {
        this.config = config;
    }

    @Override
    public Process launch() throws IOException {
        var pb = createProcessBuilder(config);
        logger.info("Starting backend: {}", String.join(" ", pb.command()));
        return pb.start();
    }

    static ProcessBuilder createProcessBuilder(BackendConfig config) {
        var pb = new ProcessBuilder(List.copyOf(config.command()));
        var env = pb.environment();
        if (!config.libraryPath().isEmpty()) {
            env.put("PYTHONPATH", config.libraryPath());
        }
        env.put("PYTHONIOENCODING", "UTF-8");
        env.put("PYTHONUNBUFFERED", "1");
        env.put("LC_ALL", "C.UTF-8");
        // stderr must never interleave with responses on stdout
        var stderrLog = config.stderrLog();
        if (stderrLog != null) {
            pb.redirectError(ProcessBuilder.Redirect.appendTo(stderrLog.toFile()));
        } else {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }
        return pb;
    }
}
