package com.quasar.relayservice.slot;

import com.quasar.relayservice.loop.TimerHandle;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个槽位：尺寸、帧率、精灵列表、自己的 tick 定时器。
 */
@Getter
class Slot {

    private final int index;
    private final int cols;
    private final int rows;
    private final int fps;
    private final long interval;
    private final List<SpriteRecord> sprites = new ArrayList<>();

    @Setter
    private TimerHandle timer;

    /** 上次 tick 的时间，用于计算 elapsed */
    @Setter
    private long lastTickAt;

    Slot(int index, int cols, int rows, int fps, long createdAt) {
        this.index = index;
        this.cols = cols;
        this.rows = rows;
        this.fps = fps;
        this.interval = Math.max(1, 1000 / fps);
        this.lastTickAt = createdAt;
    }

    SlotView toView() {
        return new SlotView(index, cols, rows, fps, interval, List.copyOf(sprites));
    }
}
