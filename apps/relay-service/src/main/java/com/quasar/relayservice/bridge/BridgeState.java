package com.quasar.relayservice.bridge;

/**
 * bridge 进程生命周期：spawning -> running -> exited
 */
public enum BridgeState {
    SPAWNING,
    RUNNING,
    EXITED
}
