package com.quasar.relayservice.loop;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 基于单线程 ScheduledThreadPoolExecutor 的 RelayLoop 实现。
 *
 * 说明：
 *  - 线程池只有 1 个线程，所有任务天然串行；
 *  - 周期任务落在线程池的延迟队列（按下次触发时间排序的小顶堆）里，
 *    256 个 slot 定时器 + 1 个主 tick 共用同一个调度器，不会各起线程；
 *  - 周期任务内部异常被吞掉并记录，否则 scheduleAtFixedRate 会静默停止后续执行。
 */
@Slf4j
public class ExecutorRelayLoop implements RelayLoop, AutoCloseable {

    private final ScheduledThreadPoolExecutor executor;
    private final Duration callTimeout;
    private volatile Thread loopThread;

    public ExecutorRelayLoop(ScheduledThreadPoolExecutor executor, Duration callTimeout) {
        this.executor = executor;
        this.callTimeout = callTimeout;
        // 记录循环线程，用于 call() 的重入判断
        executor.execute(() -> loopThread = Thread.currentThread());
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(() -> runSafely(task));
        } catch (RejectedExecutionException e) {
            log.debug("relay 循环已关闭，丢弃任务");
        }
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                () -> runSafely(task), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        return new TimerHandle() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    @Override
    public <T> T call(Supplier<T> task) {
        if (Thread.currentThread() == loopThread) {
            return task.get();
        }
        Future<T> future;
        try {
            future = executor.submit(task::get);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("relay loop is shut down");
        }
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new IllegalStateException("relay loop busy, try again");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for relay loop");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("relay 循环任务执行异常（循环继续）", t);
        }
    }

    /**
     * 关闭循环：取消所有定时器，丢弃未执行任务。
     */
    @Override
    public void close() {
        executor.shutdownNow();
        log.info("relay 循环已关闭");
    }
}
