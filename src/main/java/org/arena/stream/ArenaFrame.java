package org.arena.stream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 上游流中解析出的一行
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ArenaFrame {

    FrameType type;
    // 文本、推理、附件 markdown 或错误信息
    String text;
    String finishReason;
    JsonNode usage;

    public static ArenaFrame text(String text) {
        return new ArenaFrame(FrameType.TEXT_DELTA, text, null, null);
    }

    public static ArenaFrame reasoning(String text) {
        return new ArenaFrame(FrameType.REASONING_DELTA, text, null, null);
    }

    public static ArenaFrame attachment(String markdown) {
        return new ArenaFrame(FrameType.ATTACHMENT, markdown, null, null);
    }

    public static ArenaFrame heartbeat() {
        return new ArenaFrame(FrameType.HEARTBEAT, null, null, null);
    }

    public static ArenaFrame terminal(String finishReason, JsonNode usage) {
        return new ArenaFrame(FrameType.TERMINAL, null, finishReason, usage);
    }

    public static ArenaFrame error(String message) {
        return new ArenaFrame(FrameType.ERROR, message, null, null);
    }
}
