package com.quasar.relayservice.support;

import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.loop.TimerHandle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * 测试用 relay 循环：虚拟时钟 + 虚拟定时器，任务在调用线程上同步执行。
 */
public class ManualRelayLoop implements RelayLoop {

    private long now;
    private long sequence;
    private final List<Timer> timers = new ArrayList<>();

    public ManualRelayLoop() {
        this(1_000_000L);
    }

    public ManualRelayLoop(long start) {
        this.now = start;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    @Override
    public synchronized void execute(Runnable task) {
        task.run();
    }

    @Override
    public synchronized TimerHandle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        Timer timer = new Timer(task, now + initialDelayMs, periodMs, sequence++);
        timers.add(timer);
        return timer;
    }

    @Override
    public synchronized <T> T call(Supplier<T> task) {
        return task.get();
    }

    /**
     * 推进虚拟时钟，按触发时间顺序执行到期的定时器
     */
    public synchronized void advance(long ms) {
        long target = now + ms;
        while (true) {
            Timer next = timers.stream()
                    .filter(t -> !t.cancelled && t.nextFire <= target)
                    .min(Comparator.comparingLong((Timer t) -> t.nextFire).thenComparingLong(t -> t.seq))
                    .orElse(null);
            if (next == null) {
                break;
            }
            now = next.nextFire;
            next.nextFire += next.period;
            next.task.run();
        }
        now = target;
    }

    public synchronized int activeTimerCount() {
        timers.removeIf(t -> t.cancelled);
        return timers.size();
    }

    private static final class Timer implements TimerHandle {
        private final Runnable task;
        private final long period;
        private final long seq;
        private long nextFire;
        private boolean cancelled;

        private Timer(Runnable task, long nextFire, long period, long seq) {
            this.task = task;
            this.nextFire = nextFire;
            this.period = period;
            this.seq = seq;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
