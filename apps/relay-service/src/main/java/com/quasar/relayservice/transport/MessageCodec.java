package com.quasar.relayservice.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 线协议编解码：所有消息都是以 t 字段打标签的 JSON 对象。
 */
@Slf4j
public class MessageCodec {

    /** 消息类型字段 */
    public static final String TYPE = "t";

    private final ObjectMapper mapper;

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 解析入站文本。
     * @throws JsonProcessingException 非法 JSON 或不是 JSON 对象
     */
    public ObjectNode parse(String text) throws JsonProcessingException {
        JsonNode node = mapper.readTree(text);
        if (node == null || !node.isObject()) {
            throw new JsonProcessingException("expected a JSON object") { };
        }
        return (ObjectNode) node;
    }

    /** 序列化一次，多处复用 */
    public String write(JsonNode message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("unserializable message", e);
        }
    }

    /** 新建一条 {t: type} 消息 */
    public ObjectNode message(String type) {
        ObjectNode node = mapper.createObjectNode();
        node.put(TYPE, type);
        return node;
    }

    /** {t:'error', error: reason} */
    public ObjectNode error(String reason) {
        return message("error").put("error", reason);
    }

    public ObjectNode object() {
        return mapper.createObjectNode();
    }

    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    /**
     * 发送给单个连接；连接未打开时静默跳过。
     */
    public void send(ClientSocket socket, JsonNode message) {
        if (socket == null || !socket.isOpen()) {
            return;
        }
        socket.send(write(message));
    }

    /** 取 t 字段，缺失返回 null */
    public static String typeOf(JsonNode message) {
        JsonNode t = message.get(TYPE);
        return t != null && t.isTextual() ? t.asText() : null;
    }
}
