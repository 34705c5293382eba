package org.arena.service;

import org.arena.domain.dto.ChatCompletionRequest;
import org.arena.domain.vo.ChatCompletionResponse;
import org.arena.stream.ClientType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

public interface IArenaService {

    SseEmitter chatCompletionsStream(ChatCompletionRequest request, ClientType clientType);

    ChatCompletionResponse chatCompletions(ChatCompletionRequest request, ClientType clientType);

    Object getModels();

    Map<String, Object> healthCheck();

}
