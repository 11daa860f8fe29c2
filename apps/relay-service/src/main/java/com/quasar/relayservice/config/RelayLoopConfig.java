package com.quasar.relayservice.config;

import com.quasar.relayservice.loop.ExecutorRelayLoop;
import com.quasar.relayservice.loop.RelayLoop;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * relay 事件循环配置类。
 *
 * 功能说明：
 * 1. 只创建 1 个线程的 ScheduledThreadPoolExecutor，保证所有处理器串行执行；
 * 2. 线程命名为 relay-loop，便于在线程 dump 中定位；
 * 3. 设置为守护线程，JVM 退出时不等待；
 * 4. 关闭后提交的任务直接丢弃（AbortPolicy 由 ExecutorRelayLoop 捕获）；
 * 5. 启用 setRemoveOnCancelPolicy(true)，slot 销毁后定时任务立即从队列移除。
 *
 * 另外提供 WebSocket 发送线程池：网络写不占用 relay 循环线程，慢客户端只拖慢自己。
 */
@Configuration
public class RelayLoopConfig {

    @Value("${quasar.loop.call-timeout-ms:2000}")
    private long callTimeoutMs;

    @Bean(name = "relayLoop", destroyMethod = "close")
    public ExecutorRelayLoop relayLoop() {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "relay-loop");
            // 非业务线程，允许 JVM 优雅退出时不用等它
            t.setDaemon(true);
            return t;
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, tf, new ThreadPoolExecutor.AbortPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return new ExecutorRelayLoop(executor, Duration.ofMillis(callTimeoutMs));
    }

    /**
     * WebSocket 发送线程池。
     * 按需创建线程、空闲 60s 回收；每个会话同一时刻最多占用一个线程。
     */
    @Bean(name = "wsSendExecutor", destroyMethod = "shutdownNow")
    public ExecutorService wsSendExecutor() {
        AtomicInteger idx = new AtomicInteger(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "ws-send-" + idx.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), tf);
    }
}
