package com.quasar.relayservice.match;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 对局内的玩家视图
 */
public interface MatchPlayer {

    String id();

    /** 心跳 / 输入时刷新 */
    void setLastSeen(long ts);

    /** 分数结构由游戏自行定义，原样保存 */
    void setScore(JsonNode score);
}
