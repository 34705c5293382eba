package org.arena.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析上游的前缀行格式：{@code <prefix>:<json>}
 * <ul>
 *     <li>a0 文本增量</li>
 *     <li>ag 推理增量</li>
 *     <li>ad 结束，可带 finishReason / usage</li>
 *     <li>a2 心跳或图片附件</li>
 *     <li>a3 错误</li>
 * </ul>
 */
@Slf4j
public class ArenaFrameParser {

    static final String ARENA_ERROR_MARKER = "hasArenaError";

    private final ObjectMapper objectMapper;

    public ArenaFrameParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return 解析结果；空行、未知前缀或无法解析的负载返回 null
     */
    public ArenaFrame parse(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        int colon = line.indexOf(':');
        if (colon < 1 || colon > 2) {
            log.debug("忽略无前缀的行: {}", abbreviate(line));
            return null;
        }
        String prefix = line.substring(0, colon);
        String payload = line.substring(colon + 1);

        switch (prefix) {
            case "a0":
                return parseText(payload);
            case "ag":
                String reasoning = readString(payload);
                return reasoning != null ? ArenaFrame.reasoning(reasoning) : null;
            case "ad":
                return parseTerminal(payload);
            case "a2":
                return parseAttachment(payload);
            case "a3":
                return ArenaFrame.error(parseError(payload));
            default:
                log.debug("忽略未知前缀[{}]: {}", prefix, abbreviate(line));
                return null;
        }
    }

    private ArenaFrame parseText(String payload) {
        String text = readString(payload);
        if (text == null) {
            return null;
        }
        if (ARENA_ERROR_MARKER.equals(text)) {
            return ArenaFrame.error("Arena 返回错误");
        }
        return ArenaFrame.text(text);
    }

    private ArenaFrame parseTerminal(String payload) {
        String finishReason = "stop";
        JsonNode usage = null;
        if (!payload.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(payload);
                JsonNode reasonNode = node.get("finishReason");
                if (reasonNode != null && reasonNode.isTextual() && !reasonNode.asText().isEmpty()) {
                    finishReason = reasonNode.asText();
                }
                JsonNode usageNode = node.get("usage");
                if (usageNode != null && usageNode.isObject()) {
                    usage = usageNode;
                }
            } catch (JsonProcessingException e) {
                log.debug("结束帧负载无法解析，按 stop 处理: {}", abbreviate(payload));
            }
        }
        return ArenaFrame.terminal(finishReason, usage);
    }

    private ArenaFrame parseAttachment(String payload) {
        if (payload.contains("heartbeat")) {
            return ArenaFrame.heartbeat();
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            List<String> images = new ArrayList<>();
            if (node.isArray()) {
                for (JsonNode item : node) {
                    JsonNode image = item.get("image");
                    if (image != null && image.isTextual() && !image.asText().isEmpty()) {
                        images.add("![image](" + image.asText() + ")");
                    }
                }
            }
            return images.isEmpty() ? ArenaFrame.heartbeat() : ArenaFrame.attachment(String.join("\n", images));
        } catch (JsonProcessingException e) {
            log.debug("附件帧无法解析，跳过: {}", abbreviate(payload));
            return null;
        }
    }

    private String parseError(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            return node.isTextual() ? node.asText() : node.toString();
        } catch (JsonProcessingException e) {
            return payload;
        }
    }

    private String readString(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node != null && node.isTextual()) {
                return node.asText();
            }
            log.debug("增量负载不是字符串，跳过: {}", abbreviate(payload));
        } catch (JsonProcessingException e) {
            log.debug("增量负载无法解析，跳过: {}", abbreviate(payload));
        }
        return null;
    }

    private static String abbreviate(String s) {
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
