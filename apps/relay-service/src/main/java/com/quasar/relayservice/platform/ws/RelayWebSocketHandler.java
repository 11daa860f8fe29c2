package com.quasar.relayservice.platform.ws;

import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.protocol.WsProtocol;
import com.quasar.relayservice.registry.ConnectionRole;
import com.quasar.relayservice.transport.ClientSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * WebSocket 容器回调入口。
 *
 * 容器线程上只做一件事：把事件投递到 relay 循环，协议处理全部在循环线程上串行执行。
 * 出站消息经 wsSendExecutor 写出，不占用循环线程。
 */
@Slf4j
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private final WsProtocol protocol;
    private final RelayLoop relayLoop;
    private final ExecutorService sendExecutor;

    /** sessionId -> socket，容器线程间共享 */
    private final Map<String, ClientSocket> sockets = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(WsProtocol protocol,
                                 RelayLoop relayLoop,
                                 @Qualifier("wsSendExecutor") ExecutorService sendExecutor) {
        this.protocol = protocol;
        this.relayLoop = relayLoop;
        this.sendExecutor = sendExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ConnectionRole role = ConnectionRole.fromUri(session.getUri());
        ClientSocket socket = new SessionClientSocket(session, sendExecutor);
        sockets.put(session.getId(), socket);
        relayLoop.execute(() -> protocol.handleConnection(socket, role));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientSocket socket = sockets.get(session.getId());
        if (socket == null) {
            return;
        }
        String payload = message.getPayload();
        relayLoop.execute(() -> protocol.handleMessage(socket, payload));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientSocket socket = sockets.get(session.getId());
        if (socket == null) {
            log.warn("WS 传输错误（未登记会话）: session={}, error={}", session.getId(), exception.getMessage());
            return;
        }
        relayLoop.execute(() -> protocol.handleError(socket, exception));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientSocket socket = sockets.remove(session.getId());
        if (socket == null) {
            return;
        }
        log.debug("WS 连接关闭: session={}, status={}", session.getId(), status);
        relayLoop.execute(() -> protocol.handleClose(socket));
    }
}
