package com.quasar.relayservice.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.config.QuasarProperties;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.platform.process.ProcessLauncher;
import com.quasar.relayservice.platform.process.ProcessOutputPump;
import com.quasar.relayservice.registry.RelayStats;
import com.quasar.relayservice.registry.ViewerConnection;
import com.quasar.relayservice.slot.SlotManager;
import com.quasar.relayservice.slot.SpriteParams;
import com.quasar.relayservice.transport.MessageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BridgeFactory
 * ---------------------------------------
 * 把 viewer 的 bridge.spawn 请求变成一个进程内引擎槽位，或一个受监管的子进程。
 *
 * 按游戏目录分派：
 *  - ENGINE：SlotManager.initSlot + 两个演示精灵；
 *  - BUILTIN：直接回复 builtin，不拉起任何东西；
 *  - GAME_BRIDGE：检查可执行文件和 bridge.json 后拉起 game_bridge 进程，输出只记日志；
 *  - 未登记：立即 bridge.error。
 *
 * 注意：bridge.ready 只表示“已发起”，不表示游戏已就绪。游戏帧经由子进程自己的 source 连接回传。
 * 同一 game:slot 上已有存活进程时拒绝再次拉起。
 */
@Slf4j
public class BridgeFactory {

    static final String UNKNOWN_GAME = "Unknown game";
    static final String ALREADY_RUNNING = "Bridge already running";
    static final String SLOT_INIT_FAILED = "Failed to initialize slot";

    private final GameCatalog catalog;
    private final SlotManager slotManager;
    private final ProcessLauncher launcher;
    private final RelayLoop loop;
    private final QuasarProperties properties;
    private final ApplicationEventPublisher events;
    private final MessageCodec codec;
    private final RelayStats stats;

    /** game:slot -> 进程 */
    private final Map<String, BridgeProcess> bridges = new LinkedHashMap<>();

    public BridgeFactory(GameCatalog catalog, SlotManager slotManager, ProcessLauncher launcher, RelayLoop loop,
                         QuasarProperties properties, ApplicationEventPublisher events,
                         MessageCodec codec, RelayStats stats) {
        this.catalog = catalog;
        this.slotManager = slotManager;
        this.launcher = launcher;
        this.loop = loop;
        this.properties = properties;
        this.events = events;
        this.codec = codec;
        this.stats = stats;
    }

    /**
     * 处理 bridge.spawn{game, channel}；channel 缺省为 0，即槽位号
     */
    public void handleSpawn(ViewerConnection viewer, JsonNode request) {
        String game = request.path("game").isTextual() ? request.path("game").asText() : null;
        int slot = request.path("channel").asInt(0);
        log.info("收到 bridge 拉起请求: game={}, slot={}", game, slot);

        GameDefinition definition = catalog.find(game).orElse(null);
        if (definition == null) {
            ObjectNode error = codec.message("bridge.error")
                    .put("game", game)
                    .put("error", UNKNOWN_GAME);
            codec.send(viewer.getSocket(), error);
            return;
        }

        switch (definition.kind()) {
            case ENGINE -> spawnEngine(viewer, game, slot);
            case BUILTIN -> codec.send(viewer.getSocket(), ready(game, slot, "builtin"));
            case GAME_BRIDGE -> spawnProcess(viewer, game, slot);
        }
    }

    private void spawnEngine(ViewerConnection viewer, String game, int slot) {
        QuasarProperties.Engine engine = properties.getEngine();
        if (!slotManager.initSlot(slot, engine.getCols(), engine.getRows(), engine.getFps())) {
            codec.send(viewer.getSocket(), error(game, slot, SLOT_INIT_FAILED));
            return;
        }
        // 演示精灵：一左一右，反向旋转
        slotManager.spawnSprite(slot, "pulsar", 30, 12, new SpriteParams(4.0, 0.1, 1));
        slotManager.spawnSprite(slot, "pulsar", 50, 12, new SpriteParams(4.0, -0.1, 2));
        stats.bridgeSpawned();
        codec.send(viewer.getSocket(), ready(game, slot, "ok"));
    }

    private void spawnProcess(ViewerConnection viewer, String game, int slot) {
        if (slot < 0 || slot >= SlotManager.MAX_SLOTS) {
            codec.send(viewer.getSocket(), error(game, slot, "Invalid slot: " + slot));
            return;
        }
        String key = BridgeProcess.keyOf(game, slot);
        BridgeProcess existing = bridges.get(key);
        if (existing != null && existing.getState() != BridgeState.EXITED) {
            log.warn("拒绝重复拉起 bridge: key={}, pid={}", key, existing.toView().pid());
            codec.send(viewer.getSocket(), error(game, slot, ALREADY_RUNNING));
            return;
        }

        Path binary = properties.bridgeBinary();
        if (!Files.isExecutable(binary)) {
            log.warn("game_bridge 不存在或不可执行: {}", binary);
            codec.send(viewer.getSocket(), error(game, slot, "Bridge binary not found: " + binary));
            return;
        }
        Path config = bridgeConfig(game);
        if (!Files.isRegularFile(config)) {
            log.warn("bridge 配置不存在: {}", config);
            codec.send(viewer.getSocket(), error(game, slot, "Bridge config not found: " + config));
            return;
        }

        BridgeProcess bridge = new BridgeProcess(game, slot, loop.now());
        bridges.put(key, bridge);
        Process process;
        try {
            process = launcher.launch(List.of(binary.toString(), game), bridgeEnv(), null);
        } catch (IOException e) {
            bridges.remove(key);
            log.error("bridge 拉起失败: key={}, error={}", key, e.getMessage());
            codec.send(viewer.getSocket(), error(game, slot, "Failed to spawn bridge: " + e.getMessage()));
            return;
        }
        bridge.setProcess(process);
        bridge.setState(BridgeState.RUNNING);

        ProcessOutputPump.start("bridge-" + key + "-out", process.getInputStream(),
                line -> log.info("[bridge {}] {}", key, line));
        ProcessOutputPump.start("bridge-" + key + "-err", process.getErrorStream(),
                line -> log.warn("[bridge {}] {}", key, line));
        process.onExit().thenAccept(p -> loop.execute(() -> onExit(bridge, p.exitValue())));

        stats.bridgeSpawned();
        log.info("bridge 已拉起: key={}, pid={}", key, process.pid());
        codec.send(viewer.getSocket(), ready(game, slot, "spawned").put("pid", process.pid()));
    }

    private void onExit(BridgeProcess bridge, int exitCode) {
        bridge.setState(BridgeState.EXITED);
        bridges.remove(bridge.getKey(), bridge);
        if (exitCode != 0) {
            log.warn("bridge 异常退出: key={}, code={}", bridge.getKey(), exitCode);
        } else {
            log.info("bridge 已退出: key={}, code=0", bridge.getKey());
        }
        events.publishEvent(new BridgeClosedEvent(bridge.getGame(), bridge.getSlot(), exitCode));
    }

    /**
     * 终止并移除一个 bridge
     * @return 不存在时返回 false
     */
    public boolean kill(String game, int slot) {
        BridgeProcess bridge = bridges.remove(BridgeProcess.keyOf(game, slot));
        if (bridge == null) {
            return false;
        }
        if (bridge.getProcess() != null) {
            bridge.getProcess().destroy();
        }
        log.info("bridge 已终止: key={}", bridge.getKey());
        return true;
    }

    public int killAll() {
        List<BridgeProcess> all = new ArrayList<>(bridges.values());
        all.forEach(b -> kill(b.getGame(), b.getSlot()));
        return all.size();
    }

    public List<BridgeView> list() {
        return bridges.values().stream().map(BridgeProcess::toView).toList();
    }

    public int size() {
        return bridges.size();
    }

    Path bridgeConfig(String game) {
        return Paths.get(properties.getTetraDir(), "orgs", "tetra", "games", game, "bridge.json");
    }

    private Map<String, String> bridgeEnv() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("TETRA_SRC", properties.getTetraSrc());
        env.put("TETRA_DIR", properties.getTetraDir());
        return env;
    }

    private ObjectNode ready(String game, int slot, String status) {
        return codec.message("bridge.ready")
                .put("game", game)
                .put("slot", slot)
                .put("status", status);
    }

    private ObjectNode error(String game, int slot, String reason) {
        return codec.message("bridge.error")
                .put("game", game)
                .put("slot", slot)
                .put("error", reason);
    }
}
