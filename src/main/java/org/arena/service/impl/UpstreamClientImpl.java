package org.arena.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.arena.domain.UpstreamRequest;
import org.arena.service.IUpstreamClient;
import org.arena.service.UpstreamResponse;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

@Slf4j
@Service
public class UpstreamClientImpl implements IUpstreamClient {

    private final CloseableHttpClient httpClient;

    public UpstreamClientImpl(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public UpstreamResponse execute(UpstreamRequest request) throws IOException {
        HttpPost httpPost = new HttpPost(request.getUrl());
        request.getHeaders().forEach(httpPost::setHeader);
        httpPost.setEntity(new StringEntity(request.getBody(), ContentType.APPLICATION_JSON));

        log.debug("请求上游[账号: {}, 会话: {}]: {}", request.getProfileId(), request.getEvaluationId(), request.getUrl());
        CloseableHttpResponse response = httpClient.execute(httpPost);
        return new HttpUpstreamResponse(httpPost, response);
    }

    private static class HttpUpstreamResponse implements UpstreamResponse {

        private final HttpPost httpPost;
        private final CloseableHttpResponse response;

        HttpUpstreamResponse(HttpPost httpPost, CloseableHttpResponse response) {
            this.httpPost = httpPost;
            this.response = response;
        }

        @Override
        public int getStatusCode() {
            return response.getCode();
        }

        @Override
        public Reader openReader() throws IOException {
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return new StringReader("");
            }
            return new InputStreamReader(entity.getContent(), StandardCharsets.UTF_8);
        }

        @Override
        public String readBody(int maxChars) throws IOException {
            StringBuilder body = new StringBuilder();
            try (Reader reader = openReader()) {
                char[] buffer = new char[1024];
                int read;
                while (body.length() < maxChars && (read = reader.read(buffer)) != -1) {
                    body.append(buffer, 0, Math.min(read, maxChars - body.length()));
                }
            }
            return body.toString();
        }

        @Override
        public void abort() {
            httpPost.cancel();
            try {
                response.close();
            } catch (IOException e) {
                log.debug("中断上游连接时关闭响应失败", e);
            }
        }

        @Override
        public void close() throws IOException {
            response.close();
        }
    }
}
