package com.quasar.relayservice.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 共享声音状态 {mode, v:[{g,f,w,v} x4]}。
 *
 * 帧里携带的 snd 增量会原样合并进来；新 viewer 连接时拿到的 sync 就是这里的最新值，
 * 不会是默认值。
 */
public class SoundState {

    public static final String DEFAULT_MODE = "tia";
    public static final int VOICES = 4;

    private String mode = DEFAULT_MODE;

    /** 原样保存，不做字段裁剪 */
    private JsonNode voices;

    public SoundState() {
        ArrayNode v = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < VOICES; i++) {
            v.addObject().put("g", 0).put("f", 0).put("w", 0).put("v", 0);
        }
        this.voices = v;
    }

    /**
     * 合并一份 snd 增量：mode 非空则替换 mode，v 是数组时整体替换声部数组（0 / false / "" 等忽略）。
     */
    public void apply(JsonNode snd) {
        if (snd == null || !snd.isObject()) {
            return;
        }
        JsonNode m = snd.get("mode");
        if (m != null && m.isTextual() && !m.asText().isEmpty()) {
            mode = m.asText();
        }
        JsonNode v = snd.get("v");
        if (v != null && v.isArray()) {
            voices = v.deepCopy();
        }
    }

    public String getMode() {
        return mode;
    }

    /**
     * 当前状态的副本（用于 sync 消息和状态接口）。
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("mode", mode);
        node.set("v", voices.deepCopy());
        return node;
    }
}
