package com.quasar.relayservice.platform.ws;

import com.quasar.relayservice.transport.ClientSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spring WebSocketSession 到 ClientSocket 的适配。
 *
 * 说明：
 *  - send 只入队，不在调用线程（relay 循环）上写网络，真正的写由发送线程池完成；
 *  - 每个会话同一时刻最多一个发送任务在排空队列，消息顺序与入队顺序一致；
 *  - 积压字节数超过上限时丢弃最旧的消息（慢客户端只影响自己，帧是后写覆盖的，旧帧没有价值）。
 */
@Slf4j
public class SessionClientSocket implements ClientSocket {

    static final int DEFAULT_BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final Executor sender;
    private final int bufferSizeLimit;

    private final Deque<TextMessage> outbound = new ConcurrentLinkedDeque<>();
    private final AtomicInteger bufferedBytes = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    public SessionClientSocket(WebSocketSession session, Executor sender) {
        this(session, sender, DEFAULT_BUFFER_SIZE_LIMIT);
    }

    public SessionClientSocket(WebSocketSession session, Executor sender, int bufferSizeLimit) {
        this.session = session;
        this.sender = sender;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String remoteAddress() {
        InetSocketAddress address = session.getRemoteAddress();
        return address != null ? address.getHostString() : "unknown";
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * 入队并触发排空，立即返回
     */
    @Override
    public boolean send(String text) {
        if (!session.isOpen()) {
            return false;
        }
        TextMessage message = new TextMessage(text);
        outbound.addLast(message);
        bufferedBytes.addAndGet(message.getPayloadLength());
        while (bufferedBytes.get() > bufferSizeLimit) {
            TextMessage oldest = outbound.pollFirst();
            if (oldest == null) {
                break;
            }
            bufferedBytes.addAndGet(-oldest.getPayloadLength());
            long total = dropped.incrementAndGet();
            if (total == 1 || total % 100 == 0) {
                log.warn("WS 发送积压，丢弃旧消息: session={}, dropped={}", session.getId(), total);
            }
        }
        scheduleDrain();
        return true;
    }

    /** 因积压被丢弃的消息数 */
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        outbound.clear();
        bufferedBytes.set(0);
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.warn("WS 关闭失败: session={}, error={}", session.getId(), e.getMessage());
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            sender.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.debug("发送线程池已关闭，丢弃待发消息: session={}", session.getId());
        }
    }

    private void drain() {
        try {
            TextMessage message;
            while ((message = outbound.pollFirst()) != null) {
                bufferedBytes.addAndGet(-message.getPayloadLength());
                if (!session.isOpen()) {
                    outbound.clear();
                    bufferedBytes.set(0);
                    return;
                }
                try {
                    session.sendMessage(message);
                } catch (IOException | IllegalStateException e) {
                    log.warn("WS 发送失败: session={}, error={}", session.getId(), e.getMessage());
                }
            }
        } finally {
            draining.set(false);
            // 释放标记与最后一次入队之间的竞争：还有消息就再排一次
            if (!outbound.isEmpty() && session.isOpen()) {
                scheduleDrain();
            }
        }
    }
}
