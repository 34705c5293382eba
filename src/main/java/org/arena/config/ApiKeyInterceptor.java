package org.arena.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.arena.domain.exception.UnauthorizedException;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * API Key 验证拦截器，未配置任何 key 时放行
 */
@Slf4j
public class ApiKeyInterceptor implements HandlerInterceptor {

    private final ArenaProperties arenaProperties;

    public ApiKeyInterceptor(ArenaProperties arenaProperties) {
        this.arenaProperties = arenaProperties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!arenaProperties.isApiKeyRequired() || CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String apiKey = extractApiKey(request);
        if (apiKey == null) {
            log.warn("API key 缺失: {}", request.getRequestURI());
            throw new UnauthorizedException("Missing API Key");
        }
        if (!arenaProperties.getApiKeys().contains(apiKey)) {
            log.warn("无效的 API key: {}, key: {}", request.getRequestURI(), mask(apiKey));
            throw new UnauthorizedException("Invalid API Key");
        }

        log.debug("API key 验证通过: {}, key: {}", request.getRequestURI(), mask(apiKey));
        return true;
    }

    /**
     * 依次从 Authorization、X-API-Key、api_key 参数中读取
     */
    private String extractApiKey(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String key = authHeader.substring(7).trim();
            if (!key.isEmpty()) {
                return key;
            }
        }

        String apiKeyFromHeader = request.getHeader("X-API-Key");
        if (apiKeyFromHeader != null && !apiKeyFromHeader.trim().isEmpty()) {
            return apiKeyFromHeader.trim();
        }

        String apiKeyFromQuery = request.getParameter("api_key");
        if (apiKeyFromQuery != null && !apiKeyFromQuery.trim().isEmpty()) {
            return apiKeyFromQuery.trim();
        }
        return null;
    }

    private static String mask(String apiKey) {
        return "***" + apiKey.substring(Math.max(0, apiKey.length() - 4));
    }
}
