package org.arena.config;

import lombok.Data;
import org.arena.stream.ReasoningMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    private String baseUrl = "https://arena.ai";
    private Integer timeout = 180;

    // 客户端鉴权，为空则不校验
    private List<String> apiKeys = new ArrayList<>();
    // 扩展推送密钥，为空则不校验
    private String extensionSecret;

    // 凭证池配置（秒）
    private Integer poolMax = 10;
    private Integer tokenLifetime = 110;
    private Integer staleAfter = 120;
    private Integer sweepInterval = 15;
    private Integer errorWindow = 300;

    // 模型模糊匹配阈值
    private Double fuzzyThreshold = 0.6;

    private ReasoningMode reasoningMode = ReasoningMode.FIELD;

    // 认证 cookie 名称，过长时浏览器会拆成 .0 / .1 两段
    private String authCookieName = "arena-auth-prod-v1";

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";

    public long tokenLifetimeMillis() {
        return tokenLifetime * 1000L;
    }

    public long staleAfterMillis() {
        return staleAfter * 1000L;
    }

    public long errorWindowMillis() {
        return errorWindow * 1000L;
    }

    public boolean isApiKeyRequired() {
        return apiKeys != null && apiKeys.stream().anyMatch(k -> k != null && !k.isBlank());
    }

    public boolean isExtensionSecretRequired() {
        return extensionSecret != null && !extensionSecret.isBlank();
    }
}
