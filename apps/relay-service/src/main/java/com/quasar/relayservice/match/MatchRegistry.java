package com.quasar.relayservice.match;

import java.util.Optional;

/**
 * MatchRegistry
 * ----------------------------------------
 * 对局注册表（外部协作者）
 * - relay 只通过这个接口创建 / 查找 / 离开对局，不关心对局内部规则；
 * - 未配置实现时，所有 lobby.* / match.* 消息都会回复 'Match system not available'。
 */
public interface MatchRegistry {

    /**
     * 创建对局
     * @param gameType 游戏类型
     * @param options  公开/私有、最少人数
     * @return 新对局；容量满等情况返回 empty
     */
    Optional<Match> create(String gameType, MatchOptions options);

    /**
     * 按数字 ID 查找（线上用十六进制串表示，见 {@link Match#idHex()}）
     */
    Optional<Match> get(int matchId);

    /**
     * 查找玩家当前所在的对局
     */
    Optional<Match> getByPlayer(String playerId);

    /**
     * 玩家离开其所在的对局（不在任何对局中时无操作）
     */
    void leave(String playerId);
}
