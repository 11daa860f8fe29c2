package com.quasar.relayservice.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorRelayLoopTest {

    private final ExecutorRelayLoop loop = new ExecutorRelayLoop(new ScheduledThreadPoolExecutor(1), Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void callRunsOnLoopThreadAndReturnsValue() {
        String thread = loop.call(() -> Thread.currentThread().getName());

        assertThat(thread).isNotEqualTo(Thread.currentThread().getName());
    }

    @Test
    void nestedCallDoesNotDeadlock() {
        int value = loop.call(() -> loop.call(() -> 7) + 1);

        assertThat(value).isEqualTo(8);
    }

    @Test
    void callPropagatesRuntimeExceptions() {
        assertThatThrownBy(() -> loop.call(() -> {
            throw new IllegalArgumentException("bad fps");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad fps");
    }

    @Test
    void failingTaskDoesNotStopTheLoop() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(ran::countDown);

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void periodicTaskKeepsRunningAfterFailureUntilCancelled() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch three = new CountDownLatch(3);

        TimerHandle timer = loop.scheduleAtFixedRate(() -> {
            runs.incrementAndGet();
            three.countDown();
            throw new IllegalStateException("tick failed");
        }, 0, 5);

        assertThat(three.await(2, TimeUnit.SECONDS)).isTrue();
        timer.cancel();
        assertThat(timer.isCancelled()).isTrue();
    }
}
