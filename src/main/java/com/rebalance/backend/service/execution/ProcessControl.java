package com.rebalance.backend.service.execution;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Operating-system process operations used for the short-lived execution process.
 */
public interface ProcessControl {

    /**
     * Starts the command detached, with stdout and stderr appended to {@code logFile}.
     * @return the pid of the started process
     */
    long launch(List<String> command, Path workingDir, Path logFile) throws IOException;

    boolean isAlive(long pid);

    /**
     * @return true if a graceful termination request was delivered
     */
    boolean requestTerminate(long pid);

    boolean forceKill(long pid);
}
