package com.quasar.relayservice.match;

/**
 * 加入对局结果：成功时 slot 非空，失败时 error 非空。
 */
public record JoinResult(Integer slot, String error) {

    public static JoinResult joined(int slot) {
        return new JoinResult(slot, null);
    }

    public static JoinResult failed(String error) {
        return new JoinResult(null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
