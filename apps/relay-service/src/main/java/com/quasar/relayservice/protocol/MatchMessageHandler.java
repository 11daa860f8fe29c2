package com.quasar.relayservice.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.match.JoinResult;
import com.quasar.relayservice.match.Match;
import com.quasar.relayservice.match.MatchOptions;
import com.quasar.relayservice.match.MatchRegistry;
import com.quasar.relayservice.match.Matchmaker;
import com.quasar.relayservice.match.MonogramManager;
import com.quasar.relayservice.match.PlayerInfo;
import com.quasar.relayservice.match.StartResult;
import com.quasar.relayservice.registry.ViewerConnection;
import com.quasar.relayservice.transport.MessageCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * MatchMessageHandler
 * ---------------------------------------
 * viewer 发来的 lobby.* / match.* 消息路由。
 *
 * 对局规则、队列、monogram 分配都在外部协作者里，这里只负责：
 *  - 给 viewer 分配 / 复用玩家身份（playerId + monogram）；
 *  - 把消息翻译成协作者调用，再把结果翻译回线协议回复；
 *  - 断开时做离开对局 + 释放 monogram 的清理。
 *
 * 三个协作者任一缺失都视为“对局系统不可用”。
 */
@Slf4j
public class MatchMessageHandler {

    static final String NOT_AVAILABLE = "Match system not available";

    private final MatchRegistry matchRegistry;
    private final Matchmaker matchmaker;
    private final MonogramManager monograms;
    private final MessageCodec codec;
    private final RelayLoop loop;

    /**
     * @param matchRegistry 可为 null
     * @param matchmaker    可为 null
     * @param monograms     可为 null
     */
    public MatchMessageHandler(MatchRegistry matchRegistry, Matchmaker matchmaker, MonogramManager monograms,
                               MessageCodec codec, RelayLoop loop) {
        this.matchRegistry = matchRegistry;
        this.matchmaker = matchmaker;
        this.monograms = monograms;
        this.codec = codec;
        this.loop = loop;
    }

    public boolean available() {
        return matchRegistry != null && matchmaker != null && monograms != null;
    }

    /**
     * 处理一条 lobby.* / match.* 消息
     */
    public void handle(ViewerConnection viewer, String type, ObjectNode data) {
        if (!available()) {
            reply(viewer, codec.error(NOT_AVAILABLE));
            return;
        }
        switch (type) {
            case "lobby.join" -> lobbyJoin(viewer, data);
            case "lobby.leave" -> lobbyLeave(viewer);
            case "lobby.private" -> lobbyPrivate(viewer, data);
            case "lobby.join.private" -> lobbyJoinPrivate(viewer, data);
            case "match.join" -> matchJoin(viewer, data);
            case "match.start" -> matchStart(viewer, data);
            case "match.input" -> matchInput(viewer, data);
            case "match.leave" -> matchLeave(viewer);
            case "match.heartbeat" -> matchHeartbeat(viewer);
            case "match.score" -> matchScore(viewer, data);
            default -> reply(viewer, codec.error("Unknown message type: " + type));
        }
    }

    /**
     * 连接断开：离开对局并释放 monogram
     */
    public void release(ViewerConnection viewer) {
        if (matchRegistry == null || viewer.getPlayerId() == null) {
            return;
        }
        matchRegistry.leave(viewer.getPlayerId());
        if (monograms != null && viewer.getMonogram() != null) {
            monograms.disconnect(viewer.getMonogram());
        }
        log.info("玩家断开，已清理对局身份: playerId={}, monogram={}", viewer.getPlayerId(), viewer.getMonogram());
    }

    /**
     * 向某个对局的所有玩家广播
     * @return 对局不存在或对局系统不可用时返回 false
     */
    public boolean broadcastToMatch(int matchId, JsonNode message) {
        if (matchRegistry == null) {
            return false;
        }
        Optional<Match> match = matchRegistry.get(matchId);
        match.ifPresent(m -> m.broadcastToPlayers(message));
        return match.isPresent();
    }

    // ---------------- lobby.* ----------------

    private void lobbyJoin(ViewerConnection viewer, ObjectNode data) {
        String playerId = claimIdentity(viewer, text(data, "playerId"));
        String monogram = viewer.getMonogram();
        String gameType = text(data, "gameType");
        PlayerInfo info = new PlayerInfo(text(data, "name"), monogram, viewer.getSocket());

        ObjectNode joined = codec.message("lobby.joined")
                .put("playerId", playerId)
                .put("monogram", monogram);
        joined.set("gameType", data.get("gameType"));
        reply(viewer, joined);

        if (data.path("createImmediate").asBoolean(false)) {
            matchRegistry.create(gameType, MatchOptions.immediate()).ifPresent(match -> {
                JoinResult result = match.addPlayer(playerId, info);
                if (result.isError()) {
                    log.warn("立即开局加入失败: playerId={}, error={}", playerId, result.error());
                    return;
                }
                ObjectNode created = codec.message("match.created")
                        .put("matchId", match.idHex());
                created.set("gameType", data.get("gameType"));
                ObjectNode player = created.putArray("players").addObject();
                player.put("monogram", monogram);
                player.put("slot", result.slot());
                reply(viewer, created);
            });
        } else {
            matchmaker.enqueue(playerId, gameType, info);
        }
    }

    private void lobbyLeave(ViewerConnection viewer) {
        if (viewer.getPlayerId() == null) {
            return;
        }
        matchmaker.dequeue(viewer.getPlayerId());
        reply(viewer, codec.message("lobby.left"));
    }

    private void lobbyPrivate(ViewerConnection viewer, ObjectNode data) {
        String playerId = claimIdentity(viewer, text(data, "playerId"));
        PlayerInfo info = new PlayerInfo(text(data, "name"), viewer.getMonogram(), viewer.getSocket());

        Matchmaker.PrivateMatch result = matchmaker.createPrivate(text(data, "gameType"), playerId, info);

        ObjectNode created = codec.message("lobby.private.created")
                .put("playerId", playerId)
                .put("monogram", viewer.getMonogram())
                .put("matchId", result.match() == null ? null : result.match().idHex())
                .put("inviteCode", result.inviteCode());
        reply(viewer, created);
    }

    private void lobbyJoinPrivate(ViewerConnection viewer, ObjectNode data) {
        String playerId = claimIdentity(viewer, text(data, "playerId"));
        PlayerInfo info = new PlayerInfo(text(data, "name"), viewer.getMonogram(), viewer.getSocket());

        Matchmaker.PrivateJoin result = matchmaker.joinPrivate(text(data, "inviteCode"), playerId, info);
        if (result.error() != null) {
            reply(viewer, codec.error(result.error()));
            return;
        }
        ObjectNode joined = codec.message("lobby.private.joined")
                .put("playerId", playerId)
                .put("monogram", viewer.getMonogram())
                .put("matchId", result.match() == null ? null : result.match().idHex());
        reply(viewer, joined);
    }

    // ---------------- match.* ----------------

    private void matchJoin(ViewerConnection viewer, ObjectNode data) {
        String playerId = viewer.getPlayerId() != null ? viewer.getPlayerId() : newPlayerId();
        viewer.setPlayerId(playerId);
        if (viewer.getMonogram() == null) {
            viewer.setMonogram(monograms.assign(playerId));
        }

        Optional<Match> found = findMatch(data);
        if (found.isEmpty()) {
            reply(viewer, codec.error("Match not found"));
            return;
        }
        Match match = found.get();
        if (!match.joinable()) {
            reply(viewer, codec.error("Match is not joinable"));
            return;
        }

        JoinResult result = match.addPlayer(playerId,
                new PlayerInfo(text(data, "name"), viewer.getMonogram(), viewer.getSocket()));
        if (result.isError()) {
            reply(viewer, codec.error(result.error()));
            return;
        }
        ObjectNode joined = codec.message("match.joined")
                .put("matchId", match.idHex())
                .put("gameType", match.gameType())
                .put("state", match.state())
                .put("slot", result.slot())
                .put("playerCount", match.playerCount())
                .put("maxPlayers", match.maxPlayers());
        reply(viewer, joined);
    }

    private void matchStart(ViewerConnection viewer, ObjectNode data) {
        findMatch(data).ifPresent(match -> {
            StartResult result = match.start();
            if (result.isError()) {
                reply(viewer, codec.error(result.error()));
                return;
            }
            ObjectNode started = codec.message("match.started")
                    .put("matchId", match.idHex())
                    .put("gameType", match.gameType())
                    .put("state", match.state());
            match.broadcastToPlayers(started);
            log.info("对局开始: matchId={}, gameType={}", match.idHex(), match.gameType());
        });
    }

    private void matchInput(ViewerConnection viewer, ObjectNode data) {
        String playerId = viewer.getPlayerId();
        if (playerId == null) {
            return;
        }
        matchRegistry.getByPlayer(playerId).ifPresent(match -> {
            match.recordInput(playerId, data.get("input"));
            match.player(playerId).ifPresent(p -> p.setLastSeen(loop.now()));
        });
    }

    private void matchLeave(ViewerConnection viewer) {
        if (viewer.getPlayerId() == null) {
            return;
        }
        matchRegistry.leave(viewer.getPlayerId());
        reply(viewer, codec.message("match.left"));
    }

    private void matchHeartbeat(ViewerConnection viewer) {
        String playerId = viewer.getPlayerId();
        long now = loop.now();
        if (playerId != null) {
            matchRegistry.getByPlayer(playerId)
                    .flatMap(match -> match.player(playerId))
                    .ifPresent(p -> p.setLastSeen(now));
        }
        reply(viewer, codec.message("heartbeat.ack").put("ts", now));
    }

    private void matchScore(ViewerConnection viewer, ObjectNode data) {
        String playerId = viewer.getPlayerId();
        if (playerId == null) {
            return;
        }
        matchRegistry.getByPlayer(playerId)
                .flatMap(match -> match.player(playerId))
                .ifPresent(p -> p.setScore(data.get("score")));
    }

    // ---------------- helpers ----------------

    /**
     * 采用客户端给的 playerId（没有就生成），先释放旧 monogram 再重新分配
     */
    private String claimIdentity(ViewerConnection viewer, String requested) {
        String playerId = StringUtils.isNotEmpty(requested) ? requested : newPlayerId();
        if (viewer.getMonogram() != null) {
            monograms.disconnect(viewer.getMonogram());
        }
        viewer.setPlayerId(playerId);
        viewer.setMonogram(monograms.assign(playerId));
        return playerId;
    }

    private String newPlayerId() {
        return "ws_" + loop.now() + "_" + RandomStringUtils.randomAlphanumeric(6).toLowerCase();
    }

    /**
     * matchId 是十六进制串，可带 0x 前缀；解析失败视为不存在
     */
    private Optional<Match> findMatch(ObjectNode data) {
        String raw = StringUtils.removeStartIgnoreCase(StringUtils.defaultString(text(data, "matchId")), "0x");
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return matchRegistry.get(Integer.parseInt(raw, 16));
        } catch (NumberFormatException e) {
            log.debug("无效的 matchId: {}", raw);
            return Optional.empty();
        }
    }

    private void reply(ViewerConnection viewer, JsonNode message) {
        codec.send(viewer.getSocket(), message);
    }

    private static String text(ObjectNode data, String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
