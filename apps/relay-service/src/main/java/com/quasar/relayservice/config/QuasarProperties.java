package com.quasar.relayservice.config;

import com.quasar.relayservice.bridge.GameKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * quasar.* 配置。
 *
 * 支持通过 application.yml 或环境变量（TETRA_SRC / TETRA_DIR / PULSAR_BIN / GAME_BRIDGE_BIN）覆盖。
 */
@Data
@ConfigurationProperties(prefix = "quasar")
public class QuasarProperties {

    /**
     * tetra 源码目录，传给 bridge 进程的 TETRA_SRC
     */
    private String tetraSrc = Paths.get(System.getProperty("user.home"), "src/devops/tetra").toString();

    /**
     * tetra 运行目录，传给 bridge 进程的 TETRA_DIR；bridge.json 也在这里下面
     */
    private String tetraDir = Paths.get(System.getProperty("user.home"), "tetra").toString();

    private Tick tick = new Tick();

    private Engine engine = new Engine();

    private Bridge bridge = new Bridge();

    /**
     * 游戏目录：游戏名 -> 定义
     */
    private Map<String, Game> games = new LinkedHashMap<>();

    /**
     * 主 tick（MasterTick）配置
     */
    @Data
    public static class Tick {
        /** 应用就绪后是否自动启动 */
        private boolean enabled = true;
        /** 目标帧率，间隔 = floor(1000 / fps) */
        private int fps = 15;
        /** 是否把诊断用的 tick 聚合包也广播给 viewer */
        private boolean broadcastBundle = false;
    }

    /**
     * 进程内引擎（PULSAR slots）配置
     */
    @Data
    public static class Engine {
        /** 引擎可执行文件；为空时取 ${tetraSrc}/bash/pulsar/engine/bin/pulsar_slots */
        private String binary;
        private int cols = 60;
        private int rows = 24;
        private int fps = 15;
    }

    /**
     * 外部 game_bridge 进程配置
     */
    @Data
    public static class Bridge {
        /** bridge 可执行文件；为空时取 ${tetraSrc}/bash/games/bin/game_bridge */
        private String binary;
    }

    /**
     * 单个游戏定义
     */
    @Data
    public static class Game {
        private GameKind kind = GameKind.GAME_BRIDGE;
        private String title;
    }

    public Path engineBinary() {
        if (engine.getBinary() != null && !engine.getBinary().isBlank()) {
            return Paths.get(engine.getBinary());
        }
        return Paths.get(tetraSrc, "bash/pulsar/engine/bin/pulsar_slots");
    }

    public Path bridgeBinary() {
        if (bridge.getBinary() != null && !bridge.getBinary().isBlank()) {
            return Paths.get(bridge.getBinary());
        }
        return Paths.get(tetraSrc, "bash/games/bin/game_bridge");
    }
}
