package org.arena.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.CredentialKind;
import org.arena.domain.DispatchTicket;
import org.arena.domain.ModelCategory;
import org.arena.domain.UpstreamRequest;
import org.arena.domain.dto.ChatCompletionRequest;
import org.arena.domain.exception.BadRequestException;
import org.arena.domain.exception.ServiceException;
import org.arena.service.IUpstreamRequestBuilder;
import org.arena.utils.Uuid7;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class UpstreamRequestBuilderImpl implements IUpstreamRequestBuilder {

    static final String CREATE_EVALUATION_PATH = "/nextjs-api/stream/create-evaluation";
    static final String USER_ID_COOKIE = "arena-user-id";
    static final String CF_CLEARANCE_COOKIE = "cf_clearance";

    private final ArenaProperties arenaProperties;
    private final ObjectMapper objectMapper;

    public UpstreamRequestBuilderImpl(ArenaProperties arenaProperties, ObjectMapper objectMapper) {
        this.arenaProperties = arenaProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String preparePrompt(ChatCompletionRequest request) {
        String prompt = flattenMessages(request.getMessages());
        if (prompt.isBlank()) {
            throw new BadRequestException("消息内容不能为空");
        }
        return prompt;
    }

    @Override
    public UpstreamRequest build(DispatchTicket ticket, String prompt, ArenaModel model, String evaluationId) {
        Map<String, Object> userMessage = new LinkedHashMap<>();
        userMessage.put("content", prompt);
        userMessage.put("experimental_attachments", Collections.emptyList());
        userMessage.put("metadata", Collections.emptyMap());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", evaluationId);
        payload.put("mode", "direct");
        payload.put("modelAId", model.getId());
        payload.put("userMessageId", Uuid7.next());
        payload.put("modelAMessageId", Uuid7.next());
        payload.put("userMessage", userMessage);
        payload.put("modality", model.getCategory() == ModelCategory.IMAGE ? "image" : "chat");

        String userId = extractUserId(ticket.getCookies());
        if (userId != null) {
            payload.put("userId", userId);
        }
        if (ticket.getCredential().getKind() == CredentialKind.V2) {
            payload.put("recaptchaV2Token", ticket.getCredential().getValue());
            payload.put("recaptchaV3Token", null);
        } else {
            payload.put("recaptchaV3Token", ticket.getCredential().getValue());
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ServiceException("构建上游请求失败: " + e.getMessage());
        }

        String baseUrl = trimTrailingSlash(arenaProperties.getBaseUrl());
        return new UpstreamRequest(baseUrl + CREATE_EVALUATION_PATH, buildHeaders(ticket, baseUrl),
                body, evaluationId, ticket.getProfileId());
    }

    /**
     * 构建请求头
     */
    private Map<String, String> buildHeaders(DispatchTicket ticket, String baseUrl) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "*/*");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("Content-Type", "application/json");
        headers.put("Origin", baseUrl);
        headers.put("Referer", baseUrl + "/?mode=direct");
        headers.put("User-Agent", arenaProperties.getUserAgent());
        headers.put("sec-fetch-dest", "empty");
        headers.put("sec-fetch-mode", "cors");
        headers.put("sec-fetch-site", "same-origin");
        String cookie = cookieHeader(ticket);
        if (!cookie.isEmpty()) {
            headers.put("Cookie", cookie);
        }
        if (ticket.getAuthToken() != null && !ticket.getAuthToken().isBlank()) {
            headers.put("Authorization", "Bearer " + ticket.getAuthToken());
        }
        return headers;
    }

    static String cookieHeader(DispatchTicket ticket) {
        Map<String, String> jar = new LinkedHashMap<>(ticket.getCookies());
        if (ticket.getCfClearance() != null && !ticket.getCfClearance().isBlank()) {
            jar.putIfAbsent(CF_CLEARANCE_COOKIE, ticket.getCfClearance());
        }
        List<String> parts = new ArrayList<>();
        jar.forEach((name, value) -> parts.add(name + "=" + value));
        return String.join("; ", parts);
    }

    /**
     * 把 OpenAI 的多轮消息压平成上游的单条输入：system 在前，多轮对话用 {@code <|role|>} 分隔
     */
    static String flattenMessages(List<ChatCompletionRequest.Message> messages) {
        List<String> systemParts = new ArrayList<>();
        List<ChatCompletionRequest.Message> turns = new ArrayList<>();
        for (ChatCompletionRequest.Message message : messages) {
            if ("system".equals(message.getRole())) {
                String text = contentText(message.getContent());
                if (!text.isEmpty()) {
                    systemParts.add(text);
                }
            } else {
                turns.add(message);
            }
        }

        String conversation;
        if (turns.size() == 1) {
            conversation = contentText(turns.get(0).getContent());
        } else {
            List<String> blocks = new ArrayList<>();
            for (ChatCompletionRequest.Message turn : turns) {
                blocks.add("<|" + turn.getRole() + "|>\n" + contentText(turn.getContent()));
            }
            conversation = String.join("\n", blocks);
        }

        if (systemParts.isEmpty()) {
            return conversation;
        }
        String system = String.join("\n", systemParts);
        return conversation.isEmpty() ? system : system + "\n\n" + conversation;
    }

    static String contentText(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String) {
            return (String) content;
        }
        if (content instanceof List) {
            List<String> texts = new ArrayList<>();
            for (Object item : (List<?>) content) {
                if (item instanceof Map) {
                    Map<?, ?> part = (Map<?, ?>) item;
                    if ("text".equals(part.get("type")) && part.get("text") != null) {
                        texts.add(String.valueOf(part.get("text")));
                    }
                } else if (item instanceof String) {
                    texts.add((String) item);
                }
            }
            return String.join("\n", texts);
        }
        return String.valueOf(content);
    }

    static String extractUserId(Map<String, String> cookies) {
        String userId = cookies.get(USER_ID_COOKIE);
        if (userId != null && !userId.isEmpty()) {
            return userId;
        }
        for (Map.Entry<String, String> entry : cookies.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).contains("user") && entry.getValue().length() > 20) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
