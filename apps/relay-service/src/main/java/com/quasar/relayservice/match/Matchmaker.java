package com.quasar.relayservice.match;

/**
 * Matchmaker
 * ----------------------------------------
 * 匹配队列（外部协作者）
 * - 公开队列：enqueue / dequeue；
 * - 私有对局：createPrivate 生成邀请码，joinPrivate 凭邀请码加入。
 */
public interface Matchmaker {

    void enqueue(String playerId, String gameType, PlayerInfo info);

    void dequeue(String playerId);

    PrivateMatch createPrivate(String gameType, String playerId, PlayerInfo info);

    PrivateJoin joinPrivate(String inviteCode, String playerId, PlayerInfo info);

    /**
     * @param match      可能为 null
     * @param inviteCode 邀请码
     */
    record PrivateMatch(Match match, String inviteCode) {
    }

    /**
     * error 非空表示失败
     */
    record PrivateJoin(Match match, String error) {

        public static PrivateJoin failed(String error) {
            return new PrivateJoin(null, error);
        }
    }
}
