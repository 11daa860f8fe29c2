package com.quasar.relayservice.registry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.transport.ClientSocket;
import lombok.Getter;
import lombok.Setter;

/**
 * 游戏 source 连接的元数据：声明的游戏类型 + 该 source 最近一帧。
 */
@Getter
public class SourceConnection {

    public static final String UNKNOWN_GAME = "unknown";

    private final ClientSocket socket;

    private final long connectedAt;

    @Setter
    private String gameType = UNKNOWN_GAME;

    /** MasterTick 聚合诊断包时读取 */
    @Setter
    private ObjectNode lastFrame;

    public SourceConnection(ClientSocket socket, long connectedAt) {
        this.socket = socket;
        this.connectedAt = connectedAt;
    }
}
