package org.arena.stream;

import org.arena.domain.vo.ChatCompletionResponse;
import org.arena.utils.SseUtils;

/**
 * 单帧到 OpenAI 分片的纯函数映射。心跳和错误帧不产生分片
 */
public final class FrameTranslator {

    private FrameTranslator() {
    }

    static final String CLAUDE_DELTA_TYPE = "content_block_delta";

    public static ChatCompletionResponse toChunk(ArenaFrame frame, String requestId, String model,
                                                 long created, ReasoningMode reasoningMode) {
        return toChunk(frame, requestId, model, created, reasoningMode, ClientType.OPENAI);
    }

    /**
     * Claude 系客户端的内容分片额外带上 {@code type: content_block_delta}
     */
    public static ChatCompletionResponse toChunk(ArenaFrame frame, String requestId, String model,
                                                 long created, ReasoningMode reasoningMode, ClientType clientType) {
        switch (frame.getType()) {
            case TEXT_DELTA:
            case ATTACHMENT:
                return contentChunk(frame.getText(), requestId, model, created, clientType);
            case REASONING_DELTA:
                if (reasoningMode == ReasoningMode.INLINE) {
                    return contentChunk(frame.getText(), requestId, model, created, clientType);
                }
                return SseUtils.createChunk(requestId, model, created, null, frame.getText(), null);
            case TERMINAL:
                return SseUtils.createChunk(requestId, model, created, null, null, frame.getFinishReason());
            default:
                return null;
        }
    }

    private static ChatCompletionResponse contentChunk(String text, String requestId, String model,
                                                       long created, ClientType clientType) {
        ChatCompletionResponse chunk = SseUtils.createChunk(requestId, model, created, text, null, null);
        if (clientType == ClientType.CLAUDE) {
            chunk.setType(CLAUDE_DELTA_TYPE);
        }
        return chunk;
    }
}
