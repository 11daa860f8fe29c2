package com.quasar.relayservice.interfaces.http;

import com.quasar.relayservice.bridge.BridgeFactory;
import com.quasar.relayservice.bridge.BridgeView;
import com.quasar.relayservice.bridge.GameCatalog;
import com.quasar.relayservice.bridge.GameDefinition;
import com.quasar.relayservice.frame.FrameBus;
import com.quasar.relayservice.frame.SoundState;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.protocol.LatencyView;
import com.quasar.relayservice.protocol.WsProtocol;
import com.quasar.relayservice.slot.SlotManager;
import com.quasar.relayservice.slot.SlotView;
import com.quasar.relayservice.tick.MasterTick;
import com.quasar.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * relay 只读查询接口。核心状态只在循环线程上读取（relayLoop.call）。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatusController {

    static final String NO_SCREEN = "(no screen data)";

    private final RelayLoop relayLoop;
    private final WsProtocol protocol;
    private final MasterTick masterTick;
    private final FrameBus frameBus;
    private final SoundState soundState;
    private final SlotManager slotManager;
    private final BridgeFactory bridgeFactory;
    private final GameCatalog gameCatalog;

    /**
     * 服务整体状态：运行时长、连接数、累计统计、声音状态、主 tick 状态。
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> status() {
        Map<String, Object> body = relayLoop.call(() -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("status", "ok");
            status.put("uptime", relayLoop.now() - protocol.stats().getStartedAt());
            status.putAll(protocol.status());
            status.put("stats", protocol.stats());
            status.put("soundState", soundState.toJson());
            status.put("masterTick", masterTick.status());
            status.put("activeSlots", slotManager.getActiveSlots().size());
            status.put("bridges", bridgeFactory.size());
            return status;
        });
        return ResponseEntity.ok(ApiResponse.success(body));
    }

    /**
     * 当前屏幕文本（纯文本，便于 curl 查看）
     */
    @GetMapping(value = "/screen", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> screen() {
        String screen = relayLoop.call(frameBus::currentScreen);
        return ResponseEntity.ok(screen == null || screen.isEmpty() ? NO_SCREEN : screen);
    }

    @GetMapping("/latency")
    public ResponseEntity<ApiResponse<List<LatencyView>>> latency() {
        return ResponseEntity.ok(ApiResponse.success(relayLoop.call(protocol::getLatencyStats)));
    }

    @GetMapping("/slots")
    public ResponseEntity<ApiResponse<List<SlotView>>> slots() {
        return ResponseEntity.ok(ApiResponse.success(relayLoop.call(slotManager::getActiveSlots)));
    }

    @GetMapping("/bridges")
    public ResponseEntity<ApiResponse<List<BridgeView>>> bridges() {
        return ResponseEntity.ok(ApiResponse.success(relayLoop.call(bridgeFactory::list)));
    }

    /**
     * 游戏目录（启动后只读，不需要进循环）
     */
    @GetMapping("/games")
    public ResponseEntity<ApiResponse<List<GameDefinition>>> games() {
        return ResponseEntity.ok(ApiResponse.success(gameCatalog.all()));
    }
}
