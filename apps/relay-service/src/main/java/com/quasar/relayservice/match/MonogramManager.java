package com.quasar.relayservice.match;

/**
 * 玩家 monogram 令牌分配（外部协作者）。断开连接时必须 disconnect 释放。
 */
public interface MonogramManager {

    /**
     * @return 分配给该玩家的 monogram
     */
    String assign(String playerId);

    void disconnect(String monogram);
}
