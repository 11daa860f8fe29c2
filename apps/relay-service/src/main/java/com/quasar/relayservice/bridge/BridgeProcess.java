package com.quasar.relayservice.bridge;

import lombok.Getter;
import lombok.Setter;

/**
 * 被跟踪的 bridge 进程，键为 game:slot
 */
@Getter
public class BridgeProcess {

    private final String key;
    private final String game;
    private final int slot;
    private final long startedAt;

    @Setter
    private Process process;

    @Setter
    private BridgeState state = BridgeState.SPAWNING;

    BridgeProcess(String game, int slot, long startedAt) {
        this.key = keyOf(game, slot);
        this.game = game;
        this.slot = slot;
        this.startedAt = startedAt;
    }

    public static String keyOf(String game, int slot) {
        return game + ":" + slot;
    }

    public BridgeView toView() {
        return new BridgeView(key, game, slot, state, process != null ? process.pid() : -1, startedAt);
    }
}
