package org.arena.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.Credential;
import org.arena.domain.CredentialKind;
import org.arena.domain.DispatchTicket;
import org.arena.domain.ModelCategory;
import org.arena.domain.UpstreamRequest;
import org.arena.domain.dto.ChatCompletionRequest;
import org.arena.domain.exception.BadRequestException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamRequestBuilderImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UpstreamRequestBuilderImpl builder = new UpstreamRequestBuilderImpl(new ArenaProperties(), objectMapper);

    private static ChatCompletionRequest.Message message(String role, Object content) {
        ChatCompletionRequest.Message message = new ChatCompletionRequest.Message();
        message.setRole(role);
        message.setContent(content);
        return message;
    }

    private static ChatCompletionRequest request(ChatCompletionRequest.Message... messages) {
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel("gpt-4o");
        request.setMessages(List.of(messages));
        return request;
    }

    private static DispatchTicket ticket(CredentialKind kind, String authToken) {
        Map<String, String> cookies = new LinkedHashMap<>();
        cookies.put("session", "s1");
        cookies.put("arena-user-id", "user-123");
        Credential credential = new Credential("credential-value-xxxxxxxx", "chat_submit", kind, 0, 110_000);
        return new DispatchTicket("p1", cookies, authToken, "cf-value", credential);
    }

    @Test
    void buildsV3Payload() throws Exception {
        UpstreamRequest upstream = builder.build(ticket(CredentialKind.V3, "jwt"),
                "hello",
                new ArenaModel("gpt-4o", "model-uuid", ModelCategory.TEXT), "eval-1");

        assertEquals("https://arena.ai/nextjs-api/stream/create-evaluation", upstream.getUrl());
        assertEquals("p1", upstream.getProfileId());
        assertEquals("eval-1", upstream.getEvaluationId());

        JsonNode body = objectMapper.readTree(upstream.getBody());
        assertEquals("eval-1", body.get("id").asText());
        assertEquals("direct", body.get("mode").asText());
        assertEquals("model-uuid", body.get("modelAId").asText());
        assertEquals("chat", body.get("modality").asText());
        assertEquals("hello", body.get("userMessage").get("content").asText());
        assertEquals("user-123", body.get("userId").asText());
        assertEquals("credential-value-xxxxxxxx", body.get("recaptchaV3Token").asText());
        assertFalse(body.has("recaptchaV2Token"));
        assertNotEquals(body.get("userMessageId").asText(), body.get("modelAMessageId").asText());

        assertEquals("Bearer jwt", upstream.getHeaders().get("Authorization"));
        assertEquals("session=s1; arena-user-id=user-123; cf_clearance=cf-value", upstream.getHeaders().get("Cookie"));
    }

    @Test
    void v2CredentialNullsV3Field() throws Exception {
        UpstreamRequest upstream = builder.build(ticket(CredentialKind.V2, null),
                "draw a cat",
                new ArenaModel("dall-e-3", "img-uuid", ModelCategory.IMAGE), "eval-2");

        JsonNode body = objectMapper.readTree(upstream.getBody());
        assertEquals("credential-value-xxxxxxxx", body.get("recaptchaV2Token").asText());
        assertTrue(body.get("recaptchaV3Token").isNull());
        assertEquals("image", body.get("modality").asText());
        assertFalse(upstream.getHeaders().containsKey("Authorization"));
    }

    @Test
    void flattensSystemAndMultipleTurns() {
        String prompt = UpstreamRequestBuilderImpl.flattenMessages(List.of(
                message("system", "be brief"),
                message("user", "hi"),
                message("assistant", "hello"),
                message("user", "bye")));

        assertEquals("be brief\n\n<|user|>\nhi\n<|assistant|>\nhello\n<|user|>\nbye", prompt);
    }

    @Test
    void multimodalContentKeepsTextParts() {
        List<Object> parts = new ArrayList<>();
        parts.add(Map.of("type", "text", "text", "describe"));
        parts.add(Map.of("type", "image_url", "image_url", Map.of("url", "https://x/y.png")));
        parts.add(Map.of("type", "text", "text", "this"));

        assertEquals("describe\nthis", UpstreamRequestBuilderImpl.contentText(parts));
    }

    @Test
    void preparePromptFlattensMessages() {
        assertEquals("be brief\n\nhi",
                builder.preparePrompt(request(message("system", "be brief"), message("user", "hi"))));
    }

    @Test
    void blankPromptRejected() {
        assertThrows(BadRequestException.class, () -> builder.preparePrompt(request(message("user", "   "))));
        assertThrows(BadRequestException.class, () -> builder.preparePrompt(request(message("user", null))));
    }

    @Test
    void userIdFallsBackToLongUserCookie() {
        Map<String, String> cookies = new LinkedHashMap<>();
        cookies.put("ph_user_state", "0123456789abcdefghijkl");
        assertEquals("0123456789abcdefghijkl", UpstreamRequestBuilderImpl.extractUserId(cookies));
        assertNull(UpstreamRequestBuilderImpl.extractUserId(Map.of("user", "short")));
    }
}
