package com.quasar.relayservice.bridge;

/**
 * bridge 进程的只读快照（GET /api/bridges）
 */
public record BridgeView(String key, String game, int slot, BridgeState state, long pid, long startedAt) {
}
