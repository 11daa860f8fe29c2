package com.quasar.relayservice.loop;

/**
 * 定时任务句柄：由 {@link RelayLoop#scheduleAtFixedRate} 返回，用于取消周期任务。
 */
public interface TimerHandle {

    /**
     * 取消后续触发（不打断正在执行的那一次）。重复调用无副作用。
     */
    void cancel();

    boolean isCancelled();
}
