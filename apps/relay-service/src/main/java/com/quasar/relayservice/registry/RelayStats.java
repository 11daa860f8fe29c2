package com.quasar.relayservice.registry;

import lombok.Data;

/**
 * 服务级累计统计，/api/status 原样输出。
 */
@Data
public class RelayStats {

    /** source 帧转发次数 */
    private long framesRelayed;

    /** 累计接入的 viewer 数（不是当前在线数） */
    private long clientsConnected;

    /** 成功拉起的 bridge 数（含进程内引擎槽位） */
    private long bridgesSpawned;

    private final long startedAt;

    public RelayStats(long startedAt) {
        this.startedAt = startedAt;
    }

    public void frameRelayed() {
        framesRelayed++;
    }

    public void clientConnected() {
        clientsConnected++;
    }

    public void bridgeSpawned() {
        bridgesSpawned++;
    }
}
