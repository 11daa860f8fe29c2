package com.quasar.relayservice.registry;

import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * 连接角色：连接建立时由 URL 参数 role 区分。
 * role=game 的是游戏 source，其余都是浏览器 viewer。
 */
public enum ConnectionRole {
    VIEWER,
    SOURCE;

    /** 表示 source 的 role 参数值 */
    public static final String SOURCE_ROLE_PARAM = "game";

    public static ConnectionRole fromUri(URI uri) {
        if (uri == null) {
            return VIEWER;
        }
        String role = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("role");
        return SOURCE_ROLE_PARAM.equals(role) ? SOURCE : VIEWER;
    }
}
