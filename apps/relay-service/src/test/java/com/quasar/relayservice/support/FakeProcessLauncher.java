package com.quasar.relayservice.support;

import com.quasar.relayservice.platform.process.ProcessLauncher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 记录启动参数并返回 FakeProcess
 */
public class FakeProcessLauncher implements ProcessLauncher {

    public record Launch(List<String> command, Map<String, String> env, FakeProcess process) {
    }

    private final List<Launch> launches = new ArrayList<>();
    private IOException failure;
    private long nextPid = 4242;

    @Override
    public Process launch(List<String> command, Map<String, String> env, Path workDir) throws IOException {
        if (failure != null) {
            throw failure;
        }
        FakeProcess process = new FakeProcess(nextPid++);
        launches.add(new Launch(List.copyOf(command), env, process));
        return process;
    }

    public void failWith(IOException failure) {
        this.failure = failure;
    }

    public List<Launch> launches() {
        return launches;
    }

    public Launch last() {
        return launches.get(launches.size() - 1);
    }
}
