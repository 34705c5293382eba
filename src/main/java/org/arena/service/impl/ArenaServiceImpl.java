package org.arena.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.DispatchTicket;
import org.arena.domain.UpstreamRequest;
import org.arena.domain.dto.ChatCompletionRequest;
import org.arena.domain.exception.ServiceUnavailableException;
import org.arena.domain.exception.UpstreamException;
import org.arena.domain.vo.ArenaModelVO;
import org.arena.domain.vo.ChatCompletionResponse;
import org.arena.service.IArenaService;
import org.arena.service.IDispatcher;
import org.arena.service.IModelCatalog;
import org.arena.service.IProfileRegistry;
import org.arena.service.IUpstreamClient;
import org.arena.service.IUpstreamRequestBuilder;
import org.arena.service.UpstreamResponse;
import org.arena.stream.ArenaFrameParser;
import org.arena.stream.ArenaStreamReader;
import org.arena.stream.ChunkSink;
import org.arena.stream.ClientType;
import org.arena.stream.CompletionAggregator;
import org.arena.stream.StreamingTranslator;
import org.arena.utils.SseUtils;
import org.arena.utils.Uuid7;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Service
public class ArenaServiceImpl implements IArenaService {

    static final String VERSION = "1.0.0";
    static final String PLACEHOLDER_MODEL = "waiting-for-extension";
    private static final int ERROR_BODY_LIMIT = 500;

    private final ArenaProperties arenaProperties;
    private final IProfileRegistry profileRegistry;
    private final IModelCatalog modelCatalog;
    private final IDispatcher dispatcher;
    private final IUpstreamRequestBuilder requestBuilder;
    private final IUpstreamClient upstreamClient;
    private final ObjectMapper objectMapper;
    private final TaskExecutor streamExecutor;
    private final ArenaStreamReader streamReader;
    private final Clock clock;

    public ArenaServiceImpl(ArenaProperties arenaProperties,
                            IProfileRegistry profileRegistry,
                            IModelCatalog modelCatalog,
                            IDispatcher dispatcher,
                            IUpstreamRequestBuilder requestBuilder,
                            IUpstreamClient upstreamClient,
                            ObjectMapper objectMapper,
                            @Qualifier("streamExecutor") TaskExecutor streamExecutor,
                            Clock clock) {
        this.arenaProperties = arenaProperties;
        this.profileRegistry = profileRegistry;
        this.modelCatalog = modelCatalog;
        this.dispatcher = dispatcher;
        this.requestBuilder = requestBuilder;
        this.upstreamClient = upstreamClient;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
        this.streamReader = new ArenaStreamReader(new ArenaFrameParser(objectMapper));
        this.clock = clock;
    }

    @Override
    public SseEmitter chatCompletionsStream(ChatCompletionRequest request, ClientType clientType) {
        String evaluationId = Uuid7.next();
        String requestId = "chatcmpl-" + evaluationId;
        Upstream upstream = openUpstream(request, evaluationId, requestId);

        SseEmitter emitter = new SseEmitter(arenaProperties.getTimeout() * 1000L);
        EmitterSink sink = new EmitterSink(emitter, requestId);
        emitter.onCompletion(sink::close);
        emitter.onTimeout(() -> {
            log.warn("SSE连接超时[请求: {}, 账号: {}]", requestId, upstream.profileId);
            sink.close();
            upstream.response.abort();
            emitter.complete();
        });
        emitter.onError(ex -> {
            log.info("SSE连接异常，停止转发[请求: {}, 账号: {}]: {}", requestId, upstream.profileId, ex.getMessage());
            sink.close();
            upstream.response.abort();
        });

        try {
            streamExecutor.execute(() -> relay(upstream, requestId, clientType, sink));
        } catch (TaskRejectedException e) {
            upstream.response.abort();
            log.error("流式线程池已满[请求: {}, 账号: {}]", requestId, upstream.profileId);
            throw new ServiceUnavailableException("服务繁忙，请稍后重试");
        }
        return emitter;
    }

    @Override
    public ChatCompletionResponse chatCompletions(ChatCompletionRequest request, ClientType clientType) {
        String evaluationId = Uuid7.next();
        String requestId = "chatcmpl-" + evaluationId;
        Upstream upstream = openUpstream(request, evaluationId, requestId);

        try (UpstreamResponse response = upstream.response) {
            CompletionAggregator aggregator = new CompletionAggregator(arenaProperties.getReasoningMode(), clientType);
            streamReader.pump(response.openReader(), aggregator);
            ChatCompletionResponse result = aggregator.result(requestId, upstream.model.getName(), nowSeconds());
            log.info("非流式请求完成[请求: {}, 账号: {}]，结束原因: {}",
                    requestId, upstream.profileId, result.getChoices().get(0).getFinishReason());
            return result;
        } catch (UpstreamException e) {
            log.error("上游返回错误[请求: {}, 账号: {}]: {}", requestId, upstream.profileId, e.getMessage());
            profileRegistry.recordError(upstream.profileId);
            throw e;
        } catch (IOException e) {
            log.error("读取上游响应失败[请求: {}, 账号: {}]", requestId, upstream.profileId, e);
            profileRegistry.recordError(upstream.profileId);
            throw new UpstreamException("读取上游响应失败: " + e.getMessage(), null, e);
        }
    }

    @Override
    public Object getModels() {
        List<ArenaModelVO> data = new ArrayList<>();
        for (ArenaModel model : modelCatalog.listModels()) {
            data.add(new ArenaModelVO(model.getName(), model.getCategory()));
        }
        if (data.isEmpty()) {
            // 扩展尚未上报模型
            data.add(new ArenaModelVO(PLACEHOLDER_MODEL, null));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("object", "list");
        response.put("data", data);
        return response;
    }

    @Override
    public Map<String, Object> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("version", VERSION);
        health.put("active_profiles", profileRegistry.listActive(clock.millis()).size());
        return health;
    }

    /**
     * 准入 → 解析模型 → 校验消息 → 取凭证 → 构建请求 → 调用上游并检查状态码。
     * 取凭证之前的任何失败都不会消耗凭证
     */
    private Upstream openUpstream(ChatCompletionRequest request, String evaluationId, String requestId) {
        dispatcher.admit(requestId);
        ArenaModel model = modelCatalog.resolve(request.getModel());
        String prompt = requestBuilder.preparePrompt(request);
        DispatchTicket ticket = dispatcher.acquire(requestId);
        UpstreamRequest upstreamRequest = requestBuilder.build(ticket, prompt, model, evaluationId);

        log.info("发送到 arena[请求: {}, 账号: {}]，模型: {}，流式: {}",
                requestId, ticket.getProfileId(), model.getName(), Boolean.TRUE.equals(request.getStream()));

        UpstreamResponse response;
        try {
            response = upstreamClient.execute(upstreamRequest);
        } catch (IOException e) {
            log.error("请求上游失败[请求: {}, 账号: {}]", requestId, ticket.getProfileId(), e);
            profileRegistry.recordError(ticket.getProfileId());
            throw new UpstreamException("请求上游失败: " + e.getMessage(), null, e);
        }

        int status = response.getStatusCode();
        if (status < 200 || status >= 300) {
            String body = readErrorBody(response, requestId);
            closeQuietly(response, requestId);
            log.error("上游返回错误状态[请求: {}, 账号: {}]: {} {}", requestId, ticket.getProfileId(), status, body);
            profileRegistry.recordError(ticket.getProfileId());
            throw new UpstreamException("Arena API 返回错误状态: " + status, status);
        }
        return new Upstream(ticket.getProfileId(), model, response);
    }

    /**
     * 在线程池中读取上游并写回 SSE
     */
    private void relay(Upstream upstream, String requestId, ClientType clientType, EmitterSink sink) {
        StreamingTranslator translator = new StreamingTranslator(requestId, upstream.model.getName(),
                nowSeconds(), arenaProperties.getReasoningMode(), clientType, sink);
        try (UpstreamResponse response = upstream.response) {
            streamReader.pump(response.openReader(), translator);
            if (translator.isFailed()) {
                profileRegistry.recordError(upstream.profileId);
                log.error("上游流返回错误帧[请求: {}, 账号: {}]", requestId, upstream.profileId);
            } else if (!translator.isFinished()) {
                log.info("客户端已断开连接，停止转发[请求: {}, 账号: {}]", requestId, upstream.profileId);
                response.abort();
            } else {
                log.info("SSE流正常结束[请求: {}, 账号: {}]", requestId, upstream.profileId);
            }
        } catch (IOException e) {
            if (!sink.isOpen()) {
                log.info("客户端已断开连接，停止转发[请求: {}, 账号: {}]", requestId, upstream.profileId);
                upstream.response.abort();
            } else {
                log.error("读取上游流失败[请求: {}, 账号: {}]", requestId, upstream.profileId, e);
                profileRegistry.recordError(upstream.profileId);
                sink.sendErrorQuietly(new UpstreamException("读取上游流失败: " + e.getMessage(), null, e));
            }
        } finally {
            sink.complete();
        }
    }

    private String readErrorBody(UpstreamResponse response, String requestId) {
        try {
            return response.readBody(ERROR_BODY_LIMIT);
        } catch (IOException e) {
            log.debug("读取上游错误响应体失败[请求: {}]", requestId, e);
            return "";
        }
    }

    private void closeQuietly(UpstreamResponse response, String requestId) {
        try {
            response.close();
        } catch (IOException e) {
            log.debug("关闭上游响应失败[请求: {}]", requestId, e);
        }
    }

    private long nowSeconds() {
        return clock.millis() / 1000;
    }

    private static final class Upstream {
        final String profileId;
        final ArenaModel model;
        final UpstreamResponse response;

        Upstream(String profileId, ArenaModel model, UpstreamResponse response) {
            this.profileId = profileId;
            this.model = model;
            this.response = response;
        }
    }

    /**
     * 写入 SseEmitter 的输出端，连接关闭后所有写入都会失败
     */
    private final class EmitterSink implements ChunkSink {

        private final SseEmitter emitter;
        private final String requestId;
        private final AtomicBoolean open = new AtomicBoolean(true);

        EmitterSink(SseEmitter emitter, String requestId) {
            this.emitter = emitter;
            this.requestId = requestId;
        }

        @Override
        public void chunk(ChatCompletionResponse chunk) throws IOException {
            send(objectMapper.writeValueAsString(chunk));
        }

        @Override
        public void done() throws IOException {
            send(SseUtils.createDoneChunk());
        }

        @Override
        public void error(UpstreamException e) throws IOException {
            Map<String, Object> body = SseUtils.errorBody(e.getMessage(), e.getType(), e.getUpstreamStatus());
            send(objectMapper.writeValueAsString(body));
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        void sendErrorQuietly(UpstreamException e) {
            try {
                error(e);
            } catch (IOException ex) {
                log.debug("发送错误事件失败[请求: {}]", requestId, ex);
            }
        }

        void close() {
            open.set(false);
        }

        void complete() {
            if (open.compareAndSet(true, false)) {
                emitter.complete();
            }
        }

        private void send(String data) throws IOException {
            if (!open.get()) {
                throw new IOException("连接已关闭");
            }
            try {
                emitter.send(SseEmitter.event().data(data));
            } catch (IOException | IllegalStateException e) {
                open.set(false);
                throw new IOException("发送SSE数据失败: " + e.getMessage(), e);
            }
        }
    }
}
