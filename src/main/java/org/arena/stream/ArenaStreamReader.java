package org.arena.stream;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;

/**
 * 从上游读取字符流，按行解析后依次交给 {@link FrameHandler}，不做任何重排
 */
@Slf4j
public class ArenaStreamReader {

    private static final int BUFFER_SIZE = 8192;

    private final ArenaFrameParser parser;

    public ArenaStreamReader(ArenaFrameParser parser) {
        this.parser = parser;
    }

    /**
     * @return 是否因结束帧、错误帧或取消而提前停止
     */
    public boolean pump(Reader reader, FrameHandler handler) throws IOException {
        ArenaLineDecoder decoder = new ArenaLineDecoder();
        char[] buffer = new char[BUFFER_SIZE];
        int read;
        while (!handler.isCancelled() && (read = reader.read(buffer)) != -1) {
            for (String line : decoder.feed(new String(buffer, 0, read))) {
                if (!dispatch(line, handler)) {
                    return true;
                }
                if (handler.isCancelled()) {
                    return true;
                }
            }
        }
        if (handler.isCancelled()) {
            log.debug("读取已取消");
            return true;
        }
        String rest = decoder.flush();
        if (rest != null && !dispatch(rest, handler)) {
            return true;
        }
        handler.onEndOfStream();
        return false;
    }

    private boolean dispatch(String line, FrameHandler handler) throws IOException {
        ArenaFrame frame = parser.parse(line);
        return frame == null || handler.onFrame(frame);
    }
}
