package com.rebalance.backend.service.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class OsProcessControl implements ProcessControl {

    @Override
    public long launch(List<String> command, Path workingDir, Path logFile) throws IOException {
        Files.createDirectories(workingDir);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process = pb.start();
        log.info("Process started pid={} command={}", process.pid(), command);
        return process.pid();
    }

    @Override
    public boolean isAlive(long pid) {
        return handle(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean requestTerminate(long pid) {
        return handle(pid).map(ProcessHandle::destroy).orElse(false);
    }

    @Override
    public boolean forceKill(long pid) {
        return handle(pid).map(ProcessHandle::destroyForcibly).orElse(false);
    }

    private Optional<ProcessHandle> handle(long pid) {
        return ProcessHandle.of(pid);
    }
}
