package org.arena.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.arena.MutableClock;
import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.Credential;
import org.arena.domain.CredentialKind;
import org.arena.domain.DispatchTicket;
import org.arena.domain.ModelCategory;
import org.arena.domain.UpstreamRequest;
import org.arena.domain.dto.ChatCompletionRequest;
import org.arena.domain.exception.BadRequestException;
import org.arena.domain.exception.ModelNotFoundException;
import org.arena.domain.exception.ServiceUnavailableException;
import org.arena.domain.exception.UpstreamException;
import org.arena.domain.vo.ArenaModelVO;
import org.arena.domain.vo.ChatCompletionResponse;
import org.arena.service.IDispatcher;
import org.arena.service.IModelCatalog;
import org.arena.service.IProfileRegistry;
import org.arena.service.IUpstreamClient;
import org.arena.service.IUpstreamRequestBuilder;
import org.arena.service.UpstreamResponse;
import org.arena.stream.ClientType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ArenaServiceImplTest {

    private static final ArenaModel MODEL = new ArenaModel("gpt-4o", "model-uuid", ModelCategory.TEXT);

    private IProfileRegistry registry;
    private IModelCatalog catalog;
    private IDispatcher dispatcher;
    private IUpstreamRequestBuilder requestBuilder;
    private IUpstreamClient upstreamClient;
    private ArenaServiceImpl service;

    @BeforeEach
    void setUp() {
        registry = mock(IProfileRegistry.class);
        catalog = mock(IModelCatalog.class);
        dispatcher = mock(IDispatcher.class);
        requestBuilder = mock(IUpstreamRequestBuilder.class);
        upstreamClient = mock(IUpstreamClient.class);
        service = new ArenaServiceImpl(new ArenaProperties(), registry, catalog, dispatcher, requestBuilder,
                upstreamClient, new ObjectMapper(), new SyncTaskExecutor(), new MutableClock(1_700_000_000_000L));
    }

    private static ChatCompletionRequest request() {
        ChatCompletionRequest.Message message = new ChatCompletionRequest.Message();
        message.setRole("user");
        message.setContent("hi");
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel("gpt-4o");
        request.setMessages(List.of(message));
        return request;
    }

    private void givenDispatchable() {
        Credential credential = new Credential("token-xxxxxxxxxxxxxxxxxxxx", "chat_submit", CredentialKind.V3, 0, 110_000);
        DispatchTicket ticket = new DispatchTicket("p1", Collections.emptyMap(), null, null, credential);
        when(catalog.resolve("gpt-4o")).thenReturn(MODEL);
        when(requestBuilder.preparePrompt(any())).thenReturn("hi");
        when(dispatcher.acquire(anyString())).thenReturn(ticket);
        when(requestBuilder.build(eq(ticket), eq("hi"), eq(MODEL), anyString()))
                .thenReturn(new UpstreamRequest("https://arena.ai/x", Collections.emptyMap(), "{}", "e", "p1"));
    }

    private static UpstreamResponse response(int status, String body) throws IOException {
        UpstreamResponse response = mock(UpstreamResponse.class);
        when(response.getStatusCode()).thenReturn(status);
        when(response.openReader()).thenReturn(new StringReader(body));
        when(response.readBody(anyInt())).thenReturn(body);
        return response;
    }

    @Test
    void noActiveProfileRejectedBeforeAnyUpstreamCall() {
        doThrow(new ServiceUnavailableException(DispatcherImpl.NO_PROFILE_MESSAGE)).when(dispatcher).admit(anyString());

        assertThrows(ServiceUnavailableException.class, () -> service.chatCompletions(request(), ClientType.OPENAI));
        assertThrows(ServiceUnavailableException.class, () -> service.chatCompletionsStream(request(), ClientType.OPENAI));
        verifyNoInteractions(upstreamClient, catalog);
        verify(dispatcher, never()).acquire(anyString());
    }

    @Test
    void unknownModelDoesNotConsumeCredential() {
        when(catalog.resolve("gpt-4o")).thenThrow(new ModelNotFoundException("gpt-4o", List.of("claude")));

        assertThrows(ModelNotFoundException.class, () -> service.chatCompletions(request(), ClientType.OPENAI));
        verify(dispatcher, never()).acquire(anyString());
        verifyNoInteractions(upstreamClient);
    }

    @Test
    void blankPromptDoesNotConsumeCredential() {
        when(catalog.resolve("gpt-4o")).thenReturn(MODEL);
        when(requestBuilder.preparePrompt(any())).thenThrow(new BadRequestException("消息内容不能为空"));

        assertThrows(BadRequestException.class, () -> service.chatCompletions(request(), ClientType.OPENAI));
        assertThrows(BadRequestException.class, () -> service.chatCompletionsStream(request(), ClientType.OPENAI));
        verify(dispatcher, never()).acquire(anyString());
        verifyNoInteractions(upstreamClient);
    }

    @Test
    void nonStreamingAggregatesUpstream() throws Exception {
        givenDispatchable();
        UpstreamResponse upstream = response(200, "a0:\"Hel\"\na0:\"lo\"\nad:{\"finishReason\":\"stop\"}\n");
        when(upstreamClient.execute(any())).thenReturn(upstream);

        ChatCompletionResponse result = service.chatCompletions(request(), ClientType.OPENAI);

        assertTrue(result.getId().startsWith("chatcmpl-"));
        assertEquals("gpt-4o", result.getModel());
        assertEquals(1_700_000_000L, result.getCreated());
        assertEquals("Hello", result.getChoices().get(0).getMessage().getContent());
        assertEquals("stop", result.getChoices().get(0).getFinishReason());
        verify(upstream).close();
        verify(registry, never()).recordError(anyString());
    }

    @Test
    void upstreamErrorStatusRecordedAndMapped() throws Exception {
        givenDispatchable();
        UpstreamResponse upstream = response(429, "{\"error\":\"too many\"}");
        when(upstreamClient.execute(any())).thenReturn(upstream);

        UpstreamException e = assertThrows(UpstreamException.class, () -> service.chatCompletions(request(), ClientType.OPENAI));
        assertEquals(429, e.getUpstreamStatus());
        verify(registry).recordError("p1");
        verify(upstream).close();
    }

    @Test
    void errorFrameInNonStreamingModeFails() throws Exception {
        givenDispatchable();
        UpstreamResponse upstream = response(200, "a0:\"x\"\na3:\"blocked\"\n");
        when(upstreamClient.execute(any())).thenReturn(upstream);

        assertThrows(UpstreamException.class, () -> service.chatCompletions(request(), ClientType.OPENAI));
        verify(registry).recordError("p1");
    }

    @Test
    void connectionFailureMappedToUpstreamError() throws Exception {
        givenDispatchable();
        when(upstreamClient.execute(any())).thenThrow(new IOException("connection reset"));

        UpstreamException e = assertThrows(UpstreamException.class, () -> service.chatCompletions(request(), ClientType.OPENAI));
        assertNull(e.getUpstreamStatus());
        verify(registry).recordError("p1");
    }

    @Test
    void streamingRelaysAndClosesUpstream() throws Exception {
        givenDispatchable();
        UpstreamResponse upstream = response(200, "a0:\"Hi\"\nad:{}\n");
        when(upstreamClient.execute(any())).thenReturn(upstream);

        assertNotNull(service.chatCompletionsStream(request(), ClientType.OPENAI));
        verify(upstream).close();
        verify(registry, never()).recordError(anyString());
    }

    @Test
    void clientDisconnectAbortsUpstream() throws Exception {
        List<Runnable> tasks = new ArrayList<>();
        TaskExecutor capturing = tasks::add;
        ArenaServiceImpl deferred = new ArenaServiceImpl(new ArenaProperties(), registry, catalog, dispatcher,
                requestBuilder, upstreamClient, new ObjectMapper(), capturing, new MutableClock(1_700_000_000_000L));
        givenDispatchable();
        UpstreamResponse upstream = response(200, "a0:\"Hel\"\na0:\"lo\"\nad:{}\n");
        when(upstreamClient.execute(any())).thenReturn(upstream);

        SseEmitter emitter = deferred.chatCompletionsStream(request(), ClientType.OPENAI);
        // 客户端在第一个事件之前断开
        emitter.complete();
        tasks.get(0).run();

        verify(upstream).abort();
        verify(upstream).close();
        verify(registry, never()).recordError(anyString());
    }

    @Test
    @SuppressWarnings("unchecked")
    void modelListFallsBackToPlaceholder() {
        when(catalog.listModels()).thenReturn(Collections.emptyList());
        Map<String, Object> models = (Map<String, Object>) service.getModels();
        List<ArenaModelVO> data = (List<ArenaModelVO>) models.get("data");

        assertEquals("list", models.get("object"));
        assertEquals(1, data.size());
        assertEquals(ArenaServiceImpl.PLACEHOLDER_MODEL, data.get(0).getId());
    }

    @Test
    void healthReportsActiveProfiles() {
        when(registry.listActive(anyLong())).thenReturn(Collections.emptyList());
        Map<String, Object> health = service.healthCheck();

        assertEquals("ok", health.get("status"));
        assertEquals(0, health.get("active_profiles"));
    }
}
