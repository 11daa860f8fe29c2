package com.quasar.relayservice.match;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * 单个对局（外部协作者）。
 */
public interface Match {

    /** 0x 前缀的十六进制 ID */
    String idHex();

    String gameType();

    /** 对局状态，原样透传给客户端 */
    String state();

    boolean joinable();

    int playerCount();

    int maxPlayers();

    /**
     * 加入玩家
     * @return 成功时带座位号，失败时带 error
     */
    JoinResult addPlayer(String playerId, PlayerInfo info);

    StartResult start();

    /**
     * 向对局内所有玩家发送消息
     */
    void broadcastToPlayers(JsonNode message);

    void recordInput(String playerId, JsonNode input);

    List<MatchPlayer> players();

    default Optional<MatchPlayer> player(String playerId) {
        return players().stream().filter(p -> p.id().equals(playerId)).findFirst();
    }
}
