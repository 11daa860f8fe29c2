package com.quasar.relayservice.slot;

/**
 * 精灵参数，未指定的字段取默认值 len0=4, dtheta=0.1, valence=1。
 */
public record SpriteParams(Double len0, Double dtheta, Integer valence) {

    public static final double DEFAULT_LEN0 = 4;
    public static final double DEFAULT_DTHETA = 0.1;
    public static final int DEFAULT_VALENCE = 1;

    public static SpriteParams defaults() {
        return new SpriteParams(null, null, null);
    }

    public double len0OrDefault() {
        return len0 != null ? len0 : DEFAULT_LEN0;
    }

    public double dthetaOrDefault() {
        return dtheta != null ? dtheta : DEFAULT_DTHETA;
    }

    public int valenceOrDefault() {
        return valence != null ? valence : DEFAULT_VALENCE;
    }
}
