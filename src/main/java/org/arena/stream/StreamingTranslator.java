package org.arena.stream;

import lombok.Getter;
import org.arena.domain.exception.UpstreamException;
import org.arena.domain.vo.ChatCompletionResponse;

import java.io.IOException;

/**
 * 流式模式：每一帧立即翻译并写出，顺序与上游一致
 */
public class StreamingTranslator implements FrameHandler {

    private final String requestId;
    private final String model;
    private final long created;
    private final ReasoningMode reasoningMode;
    private final ClientType clientType;
    private final ChunkSink sink;

    @Getter
    private boolean finished;
    @Getter
    private boolean failed;

    public StreamingTranslator(String requestId, String model, long created,
                               ReasoningMode reasoningMode, ClientType clientType, ChunkSink sink) {
        this.requestId = requestId;
        this.model = model;
        this.created = created;
        this.reasoningMode = reasoningMode;
        this.clientType = clientType;
        this.sink = sink;
    }

    @Override
    public boolean onFrame(ArenaFrame frame) throws IOException {
        if (frame.getType() == FrameType.ERROR) {
            failed = true;
            sink.error(new UpstreamException("上游返回错误: " + frame.getText()));
            return false;
        }
        ChatCompletionResponse chunk = FrameTranslator.toChunk(frame, requestId, model, created, reasoningMode, clientType);
        if (chunk != null) {
            sink.chunk(chunk);
        }
        if (frame.getType() == FrameType.TERMINAL) {
            finished = true;
            sink.done();
            return false;
        }
        return true;
    }

    @Override
    public void onEndOfStream() throws IOException {
        // 上游直接断开时按正常结束处理
        if (!finished && !failed) {
            onFrame(ArenaFrame.terminal("stop", null));
        }
    }

    @Override
    public boolean isCancelled() {
        return !sink.isOpen();
    }
}
