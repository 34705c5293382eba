package org.arena.controller;

import lombok.extern.slf4j.Slf4j;
import org.arena.domain.dto.ExtensionPushRequest;
import org.arena.domain.vo.ExtensionPushResponse;
import org.arena.service.IExtensionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 浏览器扩展端点，推送密钥由 ExtensionSecretInterceptor 校验
 */
@Slf4j
@RestController
@RequestMapping("/v1/extension")
public class ExtensionController {

    @Autowired
    private IExtensionService extensionService;

    /**
     * 接收扩展推送的 token、cookies、models
     */
    @PostMapping("/push")
    public ExtensionPushResponse push(@Validated @RequestBody ExtensionPushRequest request) {
        log.debug("收到扩展推送，账号: {}, v3 token: {}",
            request.getProfileId(), request.getV3Tokens() != null ? request.getV3Tokens().size() : 0);
        return extensionService.push(request);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return extensionService.status();
    }
}
