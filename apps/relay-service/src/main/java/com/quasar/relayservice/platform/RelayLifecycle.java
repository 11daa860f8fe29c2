package com.quasar.relayservice.platform;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.bridge.BridgeClosedEvent;
import com.quasar.relayservice.bridge.BridgeFactory;
import com.quasar.relayservice.config.QuasarProperties;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.protocol.WsProtocol;
import com.quasar.relayservice.registry.ConnectionRegistry;
import com.quasar.relayservice.slot.SlotManager;
import com.quasar.relayservice.tick.MasterTick;
import com.quasar.relayservice.transport.MessageCodec;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * RelayLifecycle
 * -------------------------------------------------
 * relay 核心的启停编排。
 *
 * 1) ApplicationReady 后按配置启动 MasterTick；
 * 2) bridge 进程退出时向所有 viewer 广播 bridge.closed{game, slot, code}；
 * 3) 停机时在循环线程上依次：停主 tick、结束全部 bridge、停全部槽位并关闭引擎、关闭所有连接。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelayLifecycle {

    private final RelayLoop relayLoop;
    private final MasterTick masterTick;
    private final SlotManager slotManager;
    private final BridgeFactory bridgeFactory;
    private final ConnectionRegistry registry;
    private final WsProtocol protocol;
    private final MessageCodec codec;
    private final QuasarProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getTick().isEnabled()) {
            log.info("MasterTick 已禁用（quasar.tick.enabled=false）");
            return;
        }
        relayLoop.execute(masterTick::start);
    }

    @EventListener
    public void onBridgeClosed(BridgeClosedEvent event) {
        relayLoop.execute(() -> {
            ObjectNode closed = codec.message("bridge.closed")
                    .put("game", event.game())
                    .put("slot", event.slot())
                    .put("code", event.exitCode());
            int sent = protocol.broadcast(closed);
            log.info("bridge.closed 已广播: game={}, slot={}, code={}, viewers={}",
                    event.game(), event.slot(), event.exitCode(), sent);
        });
    }

    @PreDestroy
    public void shutdown() {
        log.info("relay 开始停机...");
        try {
            relayLoop.call(() -> {
                masterTick.stop();
                int killed = bridgeFactory.killAll();
                slotManager.stop();
                registry.dispose();
                log.info("relay 停机完成: bridgesKilled={}", killed);
                return null;
            });
        } catch (IllegalStateException e) {
            log.warn("relay 停机未完成: {}", e.getMessage());
        }
    }
}
