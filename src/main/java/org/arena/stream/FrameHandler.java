package org.arena.stream;

import java.io.IOException;

public interface FrameHandler {

    /**
     * @return false 表示停止读取上游
     */
    boolean onFrame(ArenaFrame frame) throws IOException;

    /**
     * 上游在结束帧之前关闭了流
     */
    void onEndOfStream() throws IOException;

    default boolean isCancelled() {
        return false;
    }
}
