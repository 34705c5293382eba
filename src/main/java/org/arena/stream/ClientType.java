package org.arena.stream;

import java.util.Locale;

/**
 * 按 User-Agent 识别的客户端类型，Claude 系客户端需要额外的 Anthropic 风格字段
 */
public enum ClientType {
    OPENAI,
    CLAUDE,
    GEMINI,
    CODEX,
    OPENCODE;

    public static ClientType detect(String userAgent) {
        if (userAgent == null) {
            return OPENAI;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (ua.contains("claude") || ua.contains("anthropic")) {
            return CLAUDE;
        }
        if (ua.contains("gemini") || ua.contains("google")) {
            return GEMINI;
        }
        if (ua.contains("codex")) {
            return CODEX;
        }
        if (ua.contains("opencode")) {
            return OPENCODE;
        }
        // NewAPI/OneAPI 等网关使用标准 OpenAI 格式
        return OPENAI;
    }
}
