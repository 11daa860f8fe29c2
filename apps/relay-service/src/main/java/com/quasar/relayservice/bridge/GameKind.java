package com.quasar.relayservice.bridge;

/**
 * 游戏的运行方式
 */
public enum GameKind {
    /** 进程内 PULSAR 引擎槽位 */
    ENGINE,
    /** 纯浏览器端游戏，服务端不拉起任何东西 */
    BUILTIN,
    /** 外部 game_bridge 进程，帧通过它自己的 source 连接回传 */
    GAME_BRIDGE
}
