package com.quasar.relayservice.transport;

/**
 * relay 核心看到的“连接句柄”，屏蔽具体 WebSocket 实现（Spring 会话 / 测试替身）。
 * 发送是 fire-and-forget：失败只记录日志，不向调用方抛异常。
 */
public interface ClientSocket {

    /** 连接唯一标识 */
    String id();

    /** 远端地址，仅用于日志 */
    String remoteAddress();

    boolean isOpen();

    /**
     * 发送一条文本消息。
     * @return 是否已交给底层连接（连接已关闭或写失败返回 false）
     */
    boolean send(String text);

    void close();
}
