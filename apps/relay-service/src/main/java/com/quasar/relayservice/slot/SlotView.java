package com.quasar.relayservice.slot;

import java.util.List;

/**
 * 活动槽位的只读快照（getActiveSlots / GET /api/slots）
 */
public record SlotView(int index, int cols, int rows, int fps, long interval, List<SpriteRecord> sprites) {
}
