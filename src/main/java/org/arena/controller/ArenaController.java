package org.arena.controller;

import lombok.extern.slf4j.Slf4j;
import org.arena.domain.dto.ChatCompletionRequest;
import org.arena.service.IArenaService;
import org.arena.service.IExtensionService;
import org.arena.stream.ClientType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
public class ArenaController {

    @Autowired
    private IArenaService arenaService;

    @Autowired
    private IExtensionService extensionService;

    @PostMapping("/v1/chat/completions")
    public Object chatCompletions(@Validated @RequestBody ChatCompletionRequest request,
                                  @RequestHeader(value = "User-Agent", required = false) String userAgent) {
        ClientType clientType = ClientType.detect(userAgent);
        log.info("收到聊天请求，模型: {}, 消息数: {}, 流式: {}, 客户端: {}",
            request.getModel(), request.getMessages().size(), request.getStream(), clientType);

        if (Boolean.TRUE.equals(request.getStream())) {
            return arenaService.chatCompletionsStream(request, clientType);
        } else {
            return arenaService.chatCompletions(request, clientType);
        }
    }

    @GetMapping("/v1/models")
    public Object listModels() {
        return arenaService.getModels();
    }

    @GetMapping("/admin/status")
    public Map<String, Object> adminStatus() {
        return extensionService.status();
    }

    @GetMapping({"/health", "/"})
    public Map<String, Object> health() {
        return arenaService.healthCheck();
    }
}
