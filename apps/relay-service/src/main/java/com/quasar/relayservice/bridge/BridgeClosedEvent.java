package com.quasar.relayservice.bridge;

/**
 * bridge 进程退出事件，由 RelayLifecycle 转成 bridge.closed 广播给 viewer
 */
public record BridgeClosedEvent(String game, int slot, int exitCode) {
}
