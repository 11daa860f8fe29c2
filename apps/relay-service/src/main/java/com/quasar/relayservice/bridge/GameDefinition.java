package com.quasar.relayservice.bridge;

/**
 * 游戏目录中的一项
 */
public record GameDefinition(String name, GameKind kind, String title) {
}
