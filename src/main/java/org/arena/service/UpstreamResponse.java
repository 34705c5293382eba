package org.arena.service;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * 一次上游调用的响应，使用完必须关闭
 */
public interface UpstreamResponse extends Closeable {

    int getStatusCode();

    Reader openReader() throws IOException;

    /**
     * 读取错误响应体，最多 maxChars 个字符
     */
    String readBody(int maxChars) throws IOException;

    /**
     * 中断请求并释放连接，客户端断开时调用
     */
    void abort();
}
