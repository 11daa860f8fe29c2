package com.quasar.relayservice.platform.process;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 基于 ProcessBuilder 的默认实现
 */
@Slf4j
public class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command, Map<String, String> env, Path workDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (env != null) {
            pb.environment().clear();
            pb.environment().putAll(env);
        }
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        Process process = pb.start();
        log.debug("子进程已启动: pid={}, command={}", process.pid(), command);
        return process;
    }
}
