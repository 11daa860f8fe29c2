package com.quasar.relayservice.match;

/**
 * 创建对局的参数
 * @param publicMatch 是否公开
 * @param minPlayers  开局最少人数
 */
public record MatchOptions(boolean publicMatch, int minPlayers) {

    /** 立即开局（lobby.join + createImmediate） */
    public static MatchOptions immediate() {
        return new MatchOptions(true, 1);
    }
}
