package com.quasar.relayservice.tick;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.frame.FrameBus;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.loop.TimerHandle;
import com.quasar.relayservice.registry.ConnectionRegistry;
import com.quasar.relayservice.registry.SourceConnection;
import com.quasar.relayservice.transport.MessageCodec;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MasterTick
 * ---------------------------------------
 * 固定间隔的主广播循环：把 viewer 看到的帧率和 source 的生产抖动解耦。
 *
 * 每个 tick：
 *  1. 向每个打开的 source 发 poll，并把它缓存的帧按 gameType 聚合进诊断用的 tick 包；
 *  2. 若 FrameBus 有最近一帧，复制一份打上本 tick 的时间戳和序号，广播给所有 viewer。
 *
 * 定时器跑在 relay 循环上，同一实例任何时刻只有一个定时器，tick 之间不会重叠。
 */
@Slf4j
public class MasterTick {

    private final ConnectionRegistry registry;
    private final FrameBus frameBus;
    private final MessageCodec codec;
    private final RelayLoop loop;
    private final boolean broadcastBundle;

    private int fps;
    private long interval;
    private TimerHandle timer;
    private long tickCount;
    private ObjectNode lastBundle;

    private final Stats stats = new Stats();

    public MasterTick(ConnectionRegistry registry, FrameBus frameBus, MessageCodec codec, RelayLoop loop,
                      int fps, boolean broadcastBundle) {
        this.registry = registry;
        this.frameBus = frameBus;
        this.codec = codec;
        this.loop = loop;
        this.broadcastBundle = broadcastBundle;
        applyFps(fps);
    }

    /**
     * 启动；已在运行时无操作
     */
    public void start() {
        if (timer != null) {
            return;
        }
        timer = loop.scheduleAtFixedRate(this::tick, interval, interval);
        log.info("MasterTick 已启动: {} FPS（{}ms）", fps, interval);
    }

    /**
     * 停止；未运行时无操作
     */
    public void stop() {
        if (timer == null) {
            return;
        }
        timer.cancel();
        timer = null;
        log.info("MasterTick 已停止");
    }

    public boolean isRunning() {
        return timer != null;
    }

    /**
     * 调整帧率；运行中则先停后启，旧定时器取消后才注册新定时器。
     * @throws IllegalArgumentException fps <= 0
     */
    public void setFps(int fps) {
        applyFps(fps);
        if (timer != null) {
            stop();
            start();
        }
    }

    private void applyFps(int fps) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive: " + fps);
        }
        this.fps = fps;
        this.interval = Math.max(1, 1000 / fps);
    }

    /**
     * 执行一次 tick（定时器回调；测试中也可以直接调用）
     */
    public void tick() {
        long tickStart = loop.now();
        tickCount++;
        stats.tickCount++;

        String poll = codec.write(codec.message("poll"));
        Map<String, ObjectNode> frames = new LinkedHashMap<>();
        for (SourceConnection source : registry.sources()) {
            if (!source.getSocket().isOpen()) {
                continue;
            }
            source.getSocket().send(poll);
            stats.pollsTotal++;
            if (source.getLastFrame() != null) {
                frames.put(source.getGameType(), source.getLastFrame());
                stats.framesCollected++;
            }
        }

        ObjectNode bundle = codec.message("tick")
                .put("tick", tickCount)
                .put("ts", tickStart);
        ObjectNode sources = bundle.putObject("sources");
        frames.forEach(sources::set);
        lastBundle = bundle;
        if (broadcastBundle) {
            frameBus.rebroadcast(bundle);
        }

        frameBus.lastFrame().ifPresent(last -> {
            ObjectNode frame = last.deepCopy();
            frame.put("serverTs", tickStart);
            frame.put("tick", tickCount);
            frameBus.rebroadcast(frame);
        });

        stats.lastTickMs = loop.now() - tickStart;
        stats.avgTickMs = Math.round(stats.avgTickMs * 0.9 + stats.lastTickMs * 0.1);
    }

    public int getFps() {
        return fps;
    }

    public long getInterval() {
        return interval;
    }

    public Stats getStats() {
        return stats;
    }

    /** 最近一次 tick 的聚合包，还没 tick 过时为 null */
    public ObjectNode getLastBundle() {
        return lastBundle;
    }

    /**
     * {enabled, fps, interval, stats}
     */
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", isRunning());
        status.put("fps", fps);
        status.put("interval", interval);
        status.put("stats", stats);
        return status;
    }

    /**
     * tick 耗时统计；avgTickMs 为指数加权平均（0.9 / 0.1）
     */
    @Data
    public static class Stats {
        private long tickCount;
        private long pollsTotal;
        private long framesCollected;
        private long lastTickMs;
        private long avgTickMs;
    }
}
