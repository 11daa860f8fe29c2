package com.quasar.relayservice.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.registry.ConnectionRegistry;
import com.quasar.relayservice.registry.ViewerConnection;
import com.quasar.relayservice.transport.MessageCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * FrameBus
 * ---------------------------------------
 * 帧的唯一广播出口。source 转发（relayFrame）和 slot 渲染（broadcastFrame）都从这里 publish，
 * 每次 publish 都显式带上生产者标签。
 *
 * 共享缓存（单槽 MRU，后写覆盖，不合并不排队）：
 *  - lastFrame / lastFrameTs：最近一帧及其服务端时间，poll / ping / MasterTick 读取；
 *  - currentScreen：最近的屏幕文本（slot 帧的 display 或 viewer 上报的 screen）；
 *  - lastProducer：最近一次写缓存的是谁。
 *
 * 丢帧统计只对带 seq 的 source 帧做，slot 帧不影响 viewer 的 lastFrameSeq。
 */
@Slf4j
public class FrameBus {

    /** 前几帧打 INFO 日志，便于排查“有没有帧进来” */
    private static final int LOGGED_FRAMES = 3;

    private final ConnectionRegistry registry;
    private final SoundState soundState;
    private final MessageCodec codec;
    private final RelayLoop loop;

    private ObjectNode lastFrame;
    private long lastFrameTs;
    private FrameProducer lastProducer;
    private String currentScreen = "";

    private final Map<FrameProducer.Kind, Long> published = new EnumMap<>(FrameProducer.Kind.class);

    public FrameBus(ConnectionRegistry registry, SoundState soundState, MessageCodec codec, RelayLoop loop) {
        this.registry = registry;
        this.soundState = soundState;
        this.codec = codec;
        this.loop = loop;
    }

    /**
     * 发布一帧：打 serverTs、覆盖缓存、合并声音增量、序列化一次后扇出给所有打开的 viewer。
     * @param frame    帧（会被原地加上 serverTs）
     * @param producer 生产者标签
     */
    public void publish(ObjectNode frame, FrameProducer producer) {
        long serverTs = loop.now();
        frame.put("serverTs", serverTs);

        lastFrame = frame;
        lastFrameTs = serverTs;
        lastProducer = producer;
        long count = published.merge(producer.kind(), 1L, Long::sum);

        if (producer.kind() == FrameProducer.Kind.SOURCE && count <= LOGGED_FRAMES) {
            log.info("已收到第 {} 帧, 观众数: {}", count, registry.viewerCount());
        }

        JsonNode display = frame.get("display");
        if (producer.kind() == FrameProducer.Kind.SLOT && display != null && display.isTextual()) {
            currentScreen = display.asText();
        }

        if (frame.has("snd")) {
            soundState.apply(frame.get("snd"));
        }

        String payload = codec.write(frame);
        long seq = frame.path("seq").asLong(0);
        for (ViewerConnection viewer : registry.viewers()) {
            if (!viewer.getSocket().isOpen()) {
                continue;
            }
            if (producer.sequenced()) {
                viewer.recordFrame(seq);
            }
            viewer.getSocket().send(payload);
        }
    }

    /**
     * 把一份已组装好的消息广播给所有 viewer，不写缓存、不计丢帧（MasterTick 重播用）。
     */
    public int rebroadcast(JsonNode message) {
        return registry.broadcastToViewers(codec.write(message));
    }

    public Optional<ObjectNode> lastFrame() {
        return Optional.ofNullable(lastFrame);
    }

    /** 0 表示还没有帧 */
    public long lastFrameTs() {
        return lastFrameTs;
    }

    public long lastSeq() {
        return lastFrame == null ? 0 : lastFrame.path("seq").asLong(0);
    }

    public Optional<FrameProducer> lastProducer() {
        return Optional.ofNullable(lastProducer);
    }

    public String currentScreen() {
        return currentScreen;
    }

    public void setCurrentScreen(String screen) {
        this.currentScreen = screen == null ? "" : screen;
    }

    public long publishedCount(FrameProducer.Kind kind) {
        return published.getOrDefault(kind, 0L);
    }

    public long publishedTotal() {
        return published.values().stream().mapToLong(Long::longValue).sum();
    }
}
