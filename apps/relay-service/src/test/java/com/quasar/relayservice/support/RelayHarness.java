package com.quasar.relayservice.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quasar.relayservice.bridge.BridgeFactory;
import com.quasar.relayservice.bridge.GameCatalog;
import com.quasar.relayservice.bridge.GameKind;
import com.quasar.relayservice.config.QuasarProperties;
import com.quasar.relayservice.frame.FrameBus;
import com.quasar.relayservice.frame.SoundState;
import com.quasar.relayservice.match.MatchRegistry;
import com.quasar.relayservice.match.Matchmaker;
import com.quasar.relayservice.match.MonogramManager;
import com.quasar.relayservice.protocol.MatchMessageHandler;
import com.quasar.relayservice.protocol.WsProtocol;
import com.quasar.relayservice.registry.ConnectionRegistry;
import com.quasar.relayservice.registry.ConnectionRole;
import com.quasar.relayservice.registry.RelayStats;
import com.quasar.relayservice.slot.SlotManager;
import com.quasar.relayservice.transport.MessageCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * 在测试里用假时钟 / 假引擎 / 假进程把 relay 核心整体拼起来
 */
public class RelayHarness {

    public final ManualRelayLoop loop = new ManualRelayLoop();
    public final MessageCodec codec = new MessageCodec(new ObjectMapper());
    public final ConnectionRegistry registry = new ConnectionRegistry();
    public final SoundState soundState = new SoundState();
    public final RelayStats stats = new RelayStats(loop.now());
    public final FrameBus frameBus = new FrameBus(registry, soundState, codec, loop);
    public final FakeSlotEngine engine = new FakeSlotEngine();
    public final SlotManager slotManager = new SlotManager(engine, frameBus, codec, loop);
    public final FakeProcessLauncher launcher = new FakeProcessLauncher();
    public final List<Object> events = new ArrayList<>();
    public final QuasarProperties properties;
    public final BridgeFactory bridgeFactory;
    public final MatchMessageHandler matchHandler;
    public final WsProtocol protocol;

    private int socketSeq;

    public RelayHarness() {
        this(defaultProperties(), null, null, null);
    }

    public RelayHarness(QuasarProperties properties, MatchRegistry matchRegistry, Matchmaker matchmaker,
                        MonogramManager monograms) {
        this.properties = properties;
        this.bridgeFactory = new BridgeFactory(new GameCatalog(properties), slotManager, launcher, loop,
                properties, events::add, codec, stats);
        this.matchHandler = new MatchMessageHandler(matchRegistry, matchmaker, monograms, codec, loop);
        this.protocol = new WsProtocol(registry, frameBus, soundState, bridgeFactory, matchHandler,
                codec, loop, stats);
    }

    public static QuasarProperties defaultProperties() {
        QuasarProperties properties = new QuasarProperties();
        properties.getGames().put("magnetar", game(GameKind.ENGINE));
        properties.getGames().put("pong", game(GameKind.BUILTIN));
        properties.getGames().put("cymatica", game(GameKind.GAME_BRIDGE));
        return properties;
    }

    private static QuasarProperties.Game game(GameKind kind) {
        QuasarProperties.Game game = new QuasarProperties.Game();
        game.setKind(kind);
        return game;
    }

    public RecordingSocket connectViewer() {
        RecordingSocket socket = new RecordingSocket("viewer-" + (++socketSeq));
        protocol.handleConnection(socket, ConnectionRole.VIEWER);
        return socket;
    }

    public RecordingSocket connectSource() {
        RecordingSocket socket = new RecordingSocket("source-" + (++socketSeq));
        protocol.handleConnection(socket, ConnectionRole.SOURCE);
        return socket;
    }
}
