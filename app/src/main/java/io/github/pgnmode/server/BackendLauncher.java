package io.github.pgnmode.server;

import java.io.IOException;

/** Spawns the backend process for a session. Tests substitute an in-memory process. */
@FunctionalInterface
public interface BackendLauncher {
    Process launch() throws IOException;
}
