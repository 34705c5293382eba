package org.arena.stream;

import org.arena.domain.exception.UpstreamException;
import org.arena.domain.vo.ChatCompletionResponse;

import java.io.IOException;

/**
 * 流式输出的目标，例如 SSE 连接
 */
public interface ChunkSink {

    void chunk(ChatCompletionResponse chunk) throws IOException;

    void done() throws IOException;

    void error(UpstreamException e) throws IOException;

    default boolean isOpen() {
        return true;
    }
}
