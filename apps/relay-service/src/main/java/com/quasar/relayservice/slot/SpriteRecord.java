package com.quasar.relayservice.slot;

/**
 * 已下发的精灵（参数为补齐默认值后的实际值），仅用于查询
 */
public record SpriteRecord(String type, int x, int y, double len0, double dtheta, int valence) {
}
