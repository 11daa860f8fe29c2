package com.quasar.relayservice.platform.process;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * 子进程输出泵：守护线程逐行读取 stdout / stderr 并交给回调。
 * 进程退出（流关闭）时线程自然结束。
 */
@Slf4j
public final class ProcessOutputPump {

    private ProcessOutputPump() {
    }

    /**
     * @param name   线程名
     * @param stream 子进程输出流
     * @param sink   每一行的处理回调（在泵线程上调用）
     */
    public static Thread start(String name, InputStream stream, Consumer<String> sink) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                log.debug("输出流已关闭: thread={}, reason={}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
