package org.arena.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.arena.domain.exception.UnauthorizedException;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 扩展推送密钥校验，在请求体解析之前执行；未配置密钥时放行
 */
@Slf4j
public class ExtensionSecretInterceptor implements HandlerInterceptor {

    static final String SECRET_HEADER = "X-Extension-Secret";

    private final ArenaProperties arenaProperties;

    public ExtensionSecretInterceptor(ArenaProperties arenaProperties) {
        this.arenaProperties = arenaProperties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!arenaProperties.isExtensionSecretRequired() || CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String secret = request.getHeader(SECRET_HEADER);
        byte[] expected = arenaProperties.getExtensionSecret().getBytes(StandardCharsets.UTF_8);
        byte[] actual = secret != null ? secret.getBytes(StandardCharsets.UTF_8) : new byte[0];
        // 定长比较
        if (!MessageDigest.isEqual(expected, actual)) {
            log.warn("扩展推送密钥错误: {}, 来源: {}", request.getRequestURI(), request.getRemoteAddr());
            throw new UnauthorizedException("扩展推送密钥无效");
        }
        return true;
    }
}
