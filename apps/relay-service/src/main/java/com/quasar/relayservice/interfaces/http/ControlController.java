package com.quasar.relayservice.interfaces.http;

import com.quasar.relayservice.bridge.BridgeFactory;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.slot.SlotManager;
import com.quasar.relayservice.tick.MasterTick;
import com.quasar.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * relay 运维控制接口：调主 tick 帧率、销毁槽位、结束 bridge。
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ControlController {

    private final RelayLoop relayLoop;
    private final MasterTick masterTick;
    private final SlotManager slotManager;
    private final BridgeFactory bridgeFactory;

    /**
     * 调整主 tick 帧率；运行中会透明重启定时器。fps 非法时 400。
     */
    @PostMapping("/tick/fps")
    public ResponseEntity<ApiResponse<Map<String, Object>>> setFps(@RequestParam("fps") int fps) {
        Map<String, Object> status = relayLoop.call(() -> {
            masterTick.setFps(fps);
            return masterTick.status();
        });
        log.info("MasterTick fps 已调整: {}", fps);
        return ResponseEntity.ok(ApiResponse.success(status));
    }

    @DeleteMapping("/slots/{index}")
    public ResponseEntity<ApiResponse<Object>> destroySlot(@PathVariable("index") int index) {
        if (index < 0 || index >= SlotManager.MAX_SLOTS) {
            throw new IllegalArgumentException("slot out of range: " + index);
        }
        boolean existed = relayLoop.call(() -> {
            boolean active = slotManager.getSlot(index).isPresent();
            slotManager.destroySlot(index);
            return active;
        });
        if (!existed) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound("slot not active: " + index));
        }
        return ResponseEntity.ok(ApiResponse.success("slot destroyed", Map.of("slot", index)));
    }

    @DeleteMapping("/bridges/{game}/{slot}")
    public ResponseEntity<ApiResponse<Object>> killBridge(@PathVariable("game") String game,
                                                          @PathVariable("slot") int slot) {
        boolean killed = relayLoop.call(() -> bridgeFactory.kill(game, slot));
        if (!killed) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.notFound("bridge not running: " + game + ":" + slot));
        }
        return ResponseEntity.ok(ApiResponse.success("bridge killed", Map.of("game", game, "slot", slot)));
    }
}
