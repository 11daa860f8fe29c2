package com.quasar.relayservice.match;

import com.quasar.relayservice.transport.ClientSocket;

/**
 * 加入对局 / 队列时携带的玩家信息；socket 用于对局向玩家直接推送。
 */
public record PlayerInfo(String name, String monogram, ClientSocket socket) {
}
