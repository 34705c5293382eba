package org.arena.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把任意切分的网络读取结果还原成完整的行，未遇到换行符的部分留在缓冲区
 */
public class ArenaLineDecoder {

    private final StringBuilder buffer = new StringBuilder();

    public List<String> feed(CharSequence chunk) {
        if (chunk == null || chunk.length() == 0) {
            return Collections.emptyList();
        }
        buffer.append(chunk);
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < buffer.length(); i++) {
            if (buffer.charAt(i) == '\n') {
                lines.add(stripCarriageReturn(buffer.substring(start, i)));
                start = i + 1;
            }
        }
        buffer.delete(0, start);
        return lines;
    }

    /**
     * 流结束时取出最后一个没有换行符的行
     */
    public String flush() {
        if (buffer.length() == 0) {
            return null;
        }
        String rest = stripCarriageReturn(buffer.toString());
        buffer.setLength(0);
        return rest;
    }

    public boolean hasPartial() {
        return buffer.length() > 0;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
