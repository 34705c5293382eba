package org.arena.utils;

import org.arena.domain.vo.ChatCompletionResponse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class SseUtils {

    public static final String CHUNK_OBJECT = "chat.completion.chunk";
    public static final String COMPLETION_OBJECT = "chat.completion";

    private SseUtils() {
    }

    /**
     * 创建SSE分片数据
     */
    public static ChatCompletionResponse createChunk(String requestId, String model, long created,
                                                     String content, String reasoning, String finishReason) {
        ChatCompletionResponse chunk = new ChatCompletionResponse();
        chunk.setId(requestId);
        chunk.setObject(CHUNK_OBJECT);
        chunk.setCreated(created);
        chunk.setModel(model);

        ChatCompletionResponse.Choice.Delta delta = new ChatCompletionResponse.Choice.Delta();
        delta.setContent(content);
        delta.setReasoningContent(reasoning);

        ChatCompletionResponse.Choice choice = new ChatCompletionResponse.Choice();
        choice.setIndex(0);
        choice.setDelta(delta);
        choice.setFinishReason(finishReason);

        chunk.setChoices(Collections.singletonList(choice));
        return chunk;
    }

    /**
     * 创建SSE结束标记
     */
    public static String createDoneChunk() {
        return "[DONE]";
    }

    /**
     * OpenAI 风格的错误体
     */
    public static Map<String, Object> errorBody(String message, String type, Object code) {
        return errorBody(message, type, code, Collections.emptyMap());
    }

    /**
     * @param extra 附加到 error 对象中的字段，例如 available_models
     */
    public static Map<String, Object> errorBody(String message, String type, Object code, Map<String, Object> extra) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("type", type);
        error.put("code", code);
        error.putAll(extra);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        return body;
    }
}
