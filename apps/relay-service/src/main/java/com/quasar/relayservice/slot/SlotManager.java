package com.quasar.relayservice.slot;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quasar.relayservice.frame.FrameBus;
import com.quasar.relayservice.frame.FrameProducer;
import com.quasar.relayservice.loop.RelayLoop;
import com.quasar.relayservice.transport.MessageCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SlotManager
 * ---------------------------------------
 * 管理最多 256 个独立的模拟 / 渲染槽位。
 *
 * 要点：
 *  - 每个槽位有自己的定时器（各槽 fps 可以不同），间隔 = floor(1000 / fps)；
 *  - 每次 tick：按实际经过的毫秒推进引擎，然后请求渲染；
 *  - 引擎渲染好的帧经 FrameBus 以 SLOT(n) 生产者身份广播，与 source 转发共用一条出口；
 *  - 同一下标最多一个活动槽位，重复 init 会先销毁旧槽位。
 */
@Slf4j
public class SlotManager {

    public static final int MAX_SLOTS = 256;

    private final SlotEngine engine;
    private final FrameBus frameBus;
    private final MessageCodec codec;
    private final RelayLoop loop;

    private final Slot[] slots = new Slot[MAX_SLOTS];

    public SlotManager(SlotEngine engine, FrameBus frameBus, MessageCodec codec, RelayLoop loop) {
        this.engine = engine;
        this.frameBus = frameBus;
        this.codec = codec;
        this.loop = loop;
        engine.setFrameListener(this::onEngineFrame);
        engine.setExitListener(this::onEngineExit);
    }

    /**
     * 初始化槽位并启动它的定时器
     * @return false：下标越界 / 参数非法 / 引擎无法分配
     */
    public boolean initSlot(int index, int cols, int rows, int fps) {
        if (!inRange(index)) {
            log.warn("initSlot 拒绝：下标越界 index={}", index);
            return false;
        }
        if (cols <= 0 || rows <= 0 || fps <= 0) {
            log.warn("initSlot 拒绝：参数非法 index={}, {}x{} @ {}fps", index, cols, rows, fps);
            return false;
        }
        if (!engine.open()) {
            log.error("initSlot 失败：引擎不可用 index={}", index);
            return false;
        }
        if (slots[index] != null) {
            destroySlot(index);
        }

        engine.init(index, cols, rows, fps);
        Slot slot = new Slot(index, cols, rows, fps, loop.now());
        slots[index] = slot;
        slot.setTimer(loop.scheduleAtFixedRate(() -> tickSlot(index), slot.getInterval(), slot.getInterval()));

        log.info("槽位 {} 已初始化: {}x{} @ {}fps", index, cols, rows, fps);
        return true;
    }

    /**
     * 销毁槽位：停定时器、发 DESTROY、释放；空槽位无操作
     */
    public void destroySlot(int index) {
        if (!inRange(index) || slots[index] == null) {
            return;
        }
        Slot slot = slots[index];
        slots[index] = null;
        if (slot.getTimer() != null) {
            slot.getTimer().cancel();
        }
        engine.destroy(index);
        log.info("槽位 {} 已销毁", index);
    }

    /**
     * 推进一个槽位；槽位不存在时什么都不做
     */
    public void tickSlot(int index) {
        if (!inRange(index)) {
            return;
        }
        Slot slot = slots[index];
        if (slot == null) {
            return;
        }
        long now = loop.now();
        long elapsed = now - slot.getLastTickAt();
        slot.setLastTickAt(now);
        engine.tick(index, elapsed);
        engine.render(index);
    }

    /**
     * 在槽位上生成精灵
     * @return 槽位不存在时返回 false
     */
    public boolean spawnSprite(int index, String type, int x, int y, SpriteParams params) {
        if (!inRange(index) || slots[index] == null) {
            log.warn("spawnSprite 忽略：槽位不存在 index={}", index);
            return false;
        }
        SpriteParams p = params != null ? params : SpriteParams.defaults();
        engine.spawn(index, type, x, y, p);
        slots[index].getSprites().add(new SpriteRecord(type, x, y,
                p.len0OrDefault(), p.dthetaOrDefault(), p.valenceOrDefault()));
        return true;
    }

    /**
     * 广播一帧引擎输出：{t:'frame', slot, display, ts}
     */
    public void broadcastFrame(int index, List<String> lines) {
        ObjectNode frame = codec.message("frame")
                .put("slot", index)
                .put("display", String.join("\n", lines))
                .put("ts", loop.now());
        frameBus.publish(frame, FrameProducer.slot(index));
    }

    public List<SlotView> getActiveSlots() {
        List<SlotView> active = new ArrayList<>();
        for (Slot slot : slots) {
            if (slot != null) {
                active.add(slot.toView());
            }
        }
        return active;
    }

    public Optional<SlotView> getSlot(int index) {
        if (!inRange(index) || slots[index] == null) {
            return Optional.empty();
        }
        return Optional.of(slots[index].toView());
    }

    /**
     * 停掉所有定时器并清空全部槽位（不发 DESTROY）
     */
    public void stopAll() {
        int stopped = 0;
        for (int i = 0; i < MAX_SLOTS; i++) {
            Slot slot = slots[i];
            if (slot == null) {
                continue;
            }
            if (slot.getTimer() != null) {
                slot.getTimer().cancel();
            }
            slots[i] = null;
            stopped++;
        }
        if (stopped > 0) {
            log.info("已停止全部槽位: count={}", stopped);
        }
    }

    /**
     * 停机：stopAll 后关闭引擎
     */
    public void stop() {
        stopAll();
        engine.close();
    }

    private void onEngineFrame(int index, List<String> lines) {
        if (!inRange(index) || slots[index] == null) {
            log.debug("丢弃已销毁槽位的帧: slot={}", index);
            return;
        }
        broadcastFrame(index, lines);
    }

    private void onEngineExit(int exitCode) {
        log.warn("PULSAR 引擎退出: code={}，清空全部槽位", exitCode);
        stopAll();
    }

    private static boolean inRange(int index) {
        return index >= 0 && index < MAX_SLOTS;
    }
}
