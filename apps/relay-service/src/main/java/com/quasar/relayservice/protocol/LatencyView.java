package com.quasar.relayservice.protocol;

/**
 * 单个 viewer 的延迟 / 丢帧快照
 * @param connected 已连接时长（ms）
 */
public record LatencyView(String id, long connected, long rtt, double avg,
                          long framesReceived, long framesDropped) {
}
