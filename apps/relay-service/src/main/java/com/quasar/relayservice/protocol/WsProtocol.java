package com.quasar.relayservice.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.bridge.BridgeFactory;
import com.quasar.relayservice.frame.FrameBus;
import com.quasar.relayservice.frame.FrameProducer;
import com.quasar.relayservice.frame.SoundState;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.registry.ConnectionRegistry;
import com.quasar.relayservice.registry.ConnectionRole;
import com.quasar.relayservice.registry.RelayStats;
import com.quasar.relayservice.registry.SourceConnection;
import com.quasar.relayservice.registry.ViewerConnection;
import com.quasar.relayservice.transport.ClientSocket;
import com.quasar.relayservice.transport.MessageCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WsProtocol
 * ---------------------------------------
 * WebSocket 协议处理：接入分类、按 t 字段路由、帧转发、延迟测量。
 *
 * 约定：
 *  - 所有方法都在 relay 循环线程上调用（由 RelayWebSocketHandler 投递），内部不加锁；
 *  - 协议 / 资源错误一律回复 error 消息，不向调用方抛异常；
 *  - source 的协议是固定且可信的，未知类型静默忽略；viewer 的未知类型显式回复 error。
 */
@Slf4j
public class WsProtocol {

    private final ConnectionRegistry registry;
    private final FrameBus frameBus;
    private final SoundState soundState;
    private final BridgeFactory bridgeFactory;
    private final MatchMessageHandler matchHandler;
    private final MessageCodec codec;
    private final RelayLoop loop;
    private final RelayStats stats;

    public WsProtocol(ConnectionRegistry registry, FrameBus frameBus, SoundState soundState,
                      BridgeFactory bridgeFactory, MatchMessageHandler matchHandler,
                      MessageCodec codec, RelayLoop loop, RelayStats stats) {
        this.registry = registry;
        this.frameBus = frameBus;
        this.soundState = soundState;
        this.bridgeFactory = bridgeFactory;
        this.matchHandler = matchHandler;
        this.codec = codec;
        this.loop = loop;
        this.stats = stats;
    }

    // ===================== 连接生命周期 =====================

    /**
     * 新连接接入：source 直接登记；viewer 分配 id 后立即下发当前声音状态（sync）。
     */
    public void handleConnection(ClientSocket socket, ConnectionRole role) {
        long now = loop.now();
        if (role == ConnectionRole.SOURCE) {
            registry.addSource(new SourceConnection(socket, now));
            log.info("游戏源已连接: {}", socket.remoteAddress());
            return;
        }

        String id = "c_" + now + "_" + RandomStringUtils.randomAlphanumeric(4).toLowerCase();
        registry.addViewer(new ViewerConnection(id, socket, now));
        stats.clientConnected();
        log.info("浏览器客户端已连接: {} [{}]（总数: {}）", socket.remoteAddress(), id, registry.viewerCount());

        ObjectNode sync = codec.message("sync");
        sync.set("snd", soundState.toJson());
        codec.send(socket, sync);
    }

    /**
     * 连接关闭：移出注册表；viewer 额外做对局清理。
     */
    public void handleClose(ClientSocket socket) {
        Optional<SourceConnection> source = registry.removeSource(socket);
        if (source.isPresent()) {
            log.info("游戏源已断开: {}（gameType={}）", socket.remoteAddress(), source.get().getGameType());
            return;
        }
        registry.removeViewer(socket).ifPresent(viewer -> {
            log.info("浏览器客户端已断开: {} [{}]（总数: {}）",
                    socket.remoteAddress(), viewer.getId(), registry.viewerCount());
            matchHandler.release(viewer);
        });
    }

    public void handleError(ClientSocket socket, Throwable error) {
        log.error("WS 连接异常: socket={}, error={}", socket.id(), error.getMessage());
    }

    // ===================== 消息路由 =====================

    /**
     * 处理一条入站文本消息。非法 JSON 记录后丢弃，连接保持打开。
     */
    public void handleMessage(ClientSocket socket, String text) {
        ObjectNode data;
        try {
            data = codec.parse(text);
        } catch (JsonProcessingException e) {
            log.warn("WS 消息解析失败: socket={}, error={}", socket.id(), e.getOriginalMessage());
            return;
        }

        Optional<SourceConnection> source = registry.source(socket);
        if (source.isPresent()) {
            handleSourceMessage(source.get(), data);
            return;
        }
        Optional<ViewerConnection> viewer = registry.viewer(socket);
        if (viewer.isPresent()) {
            handleViewerMessage(viewer.get(), data, text);
        } else {
            log.debug("忽略未登记连接的消息: socket={}", socket.id());
        }
    }

    private void handleSourceMessage(SourceConnection source, ObjectNode data) {
        String type = MessageCodec.typeOf(data);
        if ("frame".equals(type)) {
            source.setLastFrame(data);
            relayFrame(data);
        } else if ("register".equals(type)) {
            String gameType = data.path("gameType").asText("");
            source.setGameType(gameType.isEmpty() ? SourceConnection.UNKNOWN_GAME : gameType);
            log.info("游戏已注册: {}", source.getGameType());
        }
    }

    private void handleViewerMessage(ViewerConnection viewer, ObjectNode data, String raw) {
        String type = MessageCodec.typeOf(data);
        if (type == null) {
            codec.send(viewer.getSocket(), codec.error("Unknown message type: " + data.path(MessageCodec.TYPE).asText("undefined")));
            return;
        }
        if (type.startsWith("lobby.") || type.startsWith("match.")) {
            matchHandler.handle(viewer, type, data);
            return;
        }
        switch (type) {
            case "input" -> registry.broadcastToSources(raw);
            case "screen" -> frameBus.setCurrentScreen(data.path("screen").asText(""));
            case "bridge.spawn" -> bridgeFactory.handleSpawn(viewer, data);
            case "game.reset" -> gameReset(data);
            case "ping" -> pong(viewer, data);
            case "poll" -> frameBus.lastFrame().ifPresent(frame -> codec.send(viewer.getSocket(), frame));
            case "sound.volume" -> setVolume(viewer, data);
            default -> codec.send(viewer.getSocket(), codec.error("Unknown message type: " + type));
        }
    }

    /**
     * 转发 source 帧：统计后交给 FrameBus（打 serverTs、写缓存、合并声音、扇出、丢帧统计）。
     */
    public void relayFrame(ObjectNode frame) {
        stats.frameRelayed();
        frameBus.publish(frame, FrameProducer.source());
    }

    private void gameReset(ObjectNode data) {
        JsonNode game = data.get("game");
        log.info("收到游戏重置请求: {}", game == null ? "all" : game.asText());
        ObjectNode reset = codec.message("game.reset");
        if (game != null) {
            reset.set("game", game);
        }
        registry.broadcastToSources(codec.write(reset));
    }

    /**
     * ping -> pong：clientTs 原样回显，frameAge 以本次回复时刻计算。
     */
    private void pong(ViewerConnection viewer, ObjectNode data) {
        long serverTs = loop.now();
        long lastFrameTs = frameBus.lastFrameTs();
        viewer.setLastPingTs(serverTs);

        JsonNode rtt = data.get("rtt");
        if (rtt != null && rtt.isNumber()) {
            viewer.getLatency().addSample(rtt.asLong());
        }

        ObjectNode pong = codec.message("pong");
        if (data.has("ts")) {
            pong.set("clientTs", data.get("ts"));
        }
        pong.put("serverTs", serverTs);
        pong.put("frameAge", lastFrameTs > 0 ? serverTs - lastFrameTs : 0);
        pong.put("lastSeq", frameBus.lastSeq());
        codec.send(viewer.getSocket(), pong);
    }

    /**
     * 每连接音量，不转发。缺失或非数字视为 1.0，显式 0 保留。
     */
    private void setVolume(ViewerConnection viewer, ObjectNode data) {
        JsonNode v = data.get("volume");
        double volume = v != null && v.isNumber() ? v.asDouble() : 1.0;
        viewer.setVolume(Math.max(0.0, Math.min(1.0, volume)));
        log.info("客户端 {} 音量: {}%", viewer.getMonogram() != null ? viewer.getMonogram() : viewer.getId(),
                Math.round(viewer.getVolume() * 100));
    }

    // ===================== 广播 & 查询 =====================

    /**
     * 向所有打开的 viewer 广播
     */
    public int broadcast(JsonNode message) {
        return registry.broadcastToViewers(codec.write(message));
    }

    public boolean broadcastToMatch(int matchId, JsonNode message) {
        return matchHandler.broadcastToMatch(matchId, message);
    }

    public List<LatencyView> getLatencyStats() {
        long now = loop.now();
        return registry.viewers().stream()
                .map(v -> new LatencyView(v.getId(), now - v.getConnectedAt(),
                        v.getLatency().getRtt(), v.getLatency().getAvg(),
                        v.getStats().getFramesReceived(), v.getStats().getFramesDropped()))
                .toList();
    }

    /**
     * {clients, gameSources, lastFrameSeq, lastFrameAge}，还没有帧时 lastFrameAge 为 null
     */
    public Map<String, Object> status() {
        long lastFrameTs = frameBus.lastFrameTs();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("clients", registry.viewerCount());
        status.put("gameSources", registry.sourceCount());
        status.put("lastFrameSeq", frameBus.lastSeq());
        status.put("lastFrameAge", lastFrameTs > 0 ? loop.now() - lastFrameTs : null);
        return status;
    }

    public RelayStats stats() {
        return stats;
    }
}
