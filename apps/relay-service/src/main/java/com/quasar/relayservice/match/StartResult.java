package com.quasar.relayservice.match;

/**
 * 开局结果，error 为 null 表示成功
 */
public record StartResult(String error) {

    public static StartResult ok() {
        return new StartResult(null);
    }

    public boolean isError() {
        return error != null;
    }
}
