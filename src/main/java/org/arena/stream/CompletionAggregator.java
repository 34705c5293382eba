package org.arena.stream;

import com.fasterxml.jackson.databind.JsonNode;
import org.arena.domain.exception.UpstreamException;
import org.arena.domain.vo.ChatCompletionResponse;
import org.arena.utils.SseUtils;

import java.util.Collections;

/**
 * 非流式模式：累积所有增量，结束帧出现后才生成唯一的完整响应
 */
public class CompletionAggregator implements FrameHandler {

    static final String CLAUDE_MESSAGE_TYPE = "message";

    private final ReasoningMode reasoningMode;
    private final ClientType clientType;
    private final StringBuilder content = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private String finishReason;
    private JsonNode usage;
    private String error;

    public CompletionAggregator(ReasoningMode reasoningMode, ClientType clientType) {
        this.reasoningMode = reasoningMode;
        this.clientType = clientType;
    }

    @Override
    public boolean onFrame(ArenaFrame frame) {
        switch (frame.getType()) {
            case TEXT_DELTA:
            case ATTACHMENT:
                content.append(frame.getText());
                return true;
            case REASONING_DELTA:
                (reasoningMode == ReasoningMode.INLINE ? content : reasoning).append(frame.getText());
                return true;
            case TERMINAL:
                finishReason = frame.getFinishReason();
                usage = frame.getUsage();
                return false;
            case ERROR:
                error = frame.getText();
                return false;
            default:
                return true;
        }
    }

    @Override
    public void onEndOfStream() {
        if (finishReason == null && error == null) {
            finishReason = "stop";
        }
    }

    /**
     * @throws UpstreamException 流中出现错误帧
     */
    public ChatCompletionResponse result(String requestId, String model, long created) {
        if (error != null) {
            throw new UpstreamException("上游返回错误: " + error);
        }
        if (finishReason == null) {
            throw new UpstreamException("上游流未结束");
        }
        ChatCompletionResponse response = new ChatCompletionResponse();
        response.setId(requestId);
        response.setObject(SseUtils.COMPLETION_OBJECT);
        response.setCreated(created);
        response.setModel(model);

        ChatCompletionResponse.Choice.Message message = new ChatCompletionResponse.Choice.Message();
        message.setRole("assistant");
        message.setContent(content.toString());
        if (reasoning.length() > 0) {
            message.setReasoningContent(reasoning.toString());
        }

        ChatCompletionResponse.Choice choice = new ChatCompletionResponse.Choice();
        choice.setIndex(0);
        choice.setMessage(message);
        choice.setFinishReason(finishReason);
        response.setChoices(Collections.singletonList(choice));
        response.setUsage(buildUsage());

        if (clientType == ClientType.CLAUDE) {
            ChatCompletionResponse.ContentBlock block = new ChatCompletionResponse.ContentBlock();
            block.setType("text");
            block.setText(content.toString());
            response.setType(CLAUDE_MESSAGE_TYPE);
            response.setRole("assistant");
            response.setContent(Collections.singletonList(block));
        }
        return response;
    }

    private ChatCompletionResponse.Usage buildUsage() {
        ChatCompletionResponse.Usage result = new ChatCompletionResponse.Usage();
        int prompt = intField(usage, "promptTokens", "prompt_tokens");
        int completion = intField(usage, "completionTokens", "completion_tokens");
        result.setPromptTokens(prompt);
        result.setCompletionTokens(completion);
        result.setTotalTokens(prompt + completion);
        return result;
    }

    private static int intField(JsonNode node, String camel, String snake) {
        if (node == null) {
            return 0;
        }
        JsonNode value = node.has(camel) ? node.get(camel) : node.get(snake);
        return value != null && value.canConvertToInt() ? value.asInt() : 0;
    }
}
