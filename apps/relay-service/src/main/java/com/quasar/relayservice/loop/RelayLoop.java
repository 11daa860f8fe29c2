package com.quasar.relayservice.loop;

import java.util.function.Supplier;

/**
 * RelayLoop
 * ---------------------------------------
 * relay 核心的单线程事件循环。
 *
 * 约定：
 *  - 所有 WebSocket 回调、进程退出通知、引擎输出、定时器都投递到这里串行执行；
 *  - 每个任务执行完毕后才执行下一个，因此 viewers / sources / slots / bridges 这些共享表不需要加锁；
 *  - 核心组件（WsProtocol、MasterTick、SlotManager、BridgeFactory）只允许在循环线程上调用。
 */
public interface RelayLoop {

    /**
     * 循环使用的时钟（毫秒）。
     */
    long now();

    /**
     * 投递一个任务，异步执行。任务抛出的异常只记录日志，不会终止循环。
     */
    void execute(Runnable task);

    /**
     * 固定间隔周期任务，没有自我校正：负载高时允许累计漂移。
     * @param task           周期任务
     * @param initialDelayMs 首次延迟（毫秒）
     * @param periodMs       周期（毫秒）
     * @return 用于取消的句柄
     */
    TimerHandle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs);

    /**
     * 在循环线程上执行并等待结果（供 HTTP 等外部线程读写核心状态）。
     * 若已在循环线程上则直接执行。
     * @throws IllegalStateException 循环繁忙超时或已关闭
     */
    <T> T call(Supplier<T> task);
}
