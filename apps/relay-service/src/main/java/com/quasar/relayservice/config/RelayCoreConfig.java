package com.quasar.relayservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quasar.relayservice.bridge.BridgeFactory;
import com.quasar.relayservice.bridge.GameCatalog;
import com.quasar.relayservice.frame.FrameBus;
import com.quasar.relayservice.frame.SoundState;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.match.MatchRegistry;
import com.quasar.relayservice.match.Matchmaker;
import com.quasar.relayservice.match.MonogramManager;
import com.quasar.relayservice.platform.process.DefaultProcessLauncher;
import com.quasar.relayservice.platform.process.ProcessLauncher;
import com.quasar.relayservice.protocol.MatchMessageHandler;
import com.quasar.relayservice.protocol.WsProtocol;
import com.quasar.relayservice.registry.ConnectionRegistry;
import com.quasar.relayservice.registry.RelayStats;
import com.quasar.relayservice.slot.PulsarProcessEngine;
import com.quasar.relayservice.slot.SlotEngine;
import com.quasar.relayservice.slot.SlotManager;
import com.quasar.relayservice.tick.MasterTick;
import com.quasar.relayservice.transport.MessageCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RelayCoreConfig
 * ---------------------------------------
 * relay 核心对象的装配。核心类都是普通对象（不带 Spring 注解），这里只负责把它们拼起来，
 * 测试中可以直接 new。
 *
 * 说明：
 *  - 所有核心对象共用一个 RelayLoop（见 {@link RelayLoopConfig}）；
 *  - 对局协作者（MatchRegistry / Matchmaker / MonogramManager）是可选 Bean，缺失时对局消息统一回复不可用；
 *  - 停机顺序由 RelayLifecycle 控制，因此引擎 Bean 关闭 Spring 的自动 destroy 推断。
 */
@Configuration
public class RelayCoreConfig {

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public SoundState soundState() {
        return new SoundState();
    }

    @Bean
    public RelayStats relayStats(RelayLoop relayLoop) {
        return new RelayStats(relayLoop.now());
    }

    @Bean
    public FrameBus frameBus(ConnectionRegistry registry, SoundState soundState,
                             MessageCodec codec, RelayLoop relayLoop) {
        return new FrameBus(registry, soundState, codec, relayLoop);
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }

    @Bean(destroyMethod = "")
    public SlotEngine slotEngine(ProcessLauncher launcher, QuasarProperties properties, RelayLoop relayLoop) {
        return new PulsarProcessEngine(launcher, properties.engineBinary(), relayLoop);
    }

    @Bean
    public SlotManager slotManager(SlotEngine engine, FrameBus frameBus, MessageCodec codec, RelayLoop relayLoop) {
        return new SlotManager(engine, frameBus, codec, relayLoop);
    }

    @Bean
    public GameCatalog gameCatalog(QuasarProperties properties) {
        return new GameCatalog(properties);
    }

    @Bean
    public BridgeFactory bridgeFactory(GameCatalog catalog, SlotManager slotManager, ProcessLauncher launcher,
                                       RelayLoop relayLoop, QuasarProperties properties,
                                       ApplicationEventPublisher events, MessageCodec codec, RelayStats stats) {
        return new BridgeFactory(catalog, slotManager, launcher, relayLoop, properties, events, codec, stats);
    }

    @Bean
    public MatchMessageHandler matchMessageHandler(ObjectProvider<MatchRegistry> matchRegistry,
                                                   ObjectProvider<Matchmaker> matchmaker,
                                                   ObjectProvider<MonogramManager> monogramManager,
                                                   MessageCodec codec, RelayLoop relayLoop) {
        return new MatchMessageHandler(matchRegistry.getIfAvailable(), matchmaker.getIfAvailable(),
                monogramManager.getIfAvailable(), codec, relayLoop);
    }

    @Bean
    public WsProtocol wsProtocol(ConnectionRegistry registry, FrameBus frameBus, SoundState soundState,
                                 BridgeFactory bridgeFactory, MatchMessageHandler matchHandler,
                                 MessageCodec codec, RelayLoop relayLoop, RelayStats stats) {
        return new WsProtocol(registry, frameBus, soundState, bridgeFactory, matchHandler, codec, relayLoop, stats);
    }

    @Bean
    public MasterTick masterTick(ConnectionRegistry registry, FrameBus frameBus, MessageCodec codec,
                                 RelayLoop relayLoop, QuasarProperties properties) {
        QuasarProperties.Tick tick = properties.getTick();
        return new MasterTick(registry, frameBus, codec, relayLoop, tick.getFps(), tick.isBroadcastBundle());
    }
}
