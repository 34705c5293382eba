package org.arena.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.arena.domain.exception.ModelNotFoundException;
import org.arena.domain.exception.ServiceException;
import org.arena.domain.exception.UpstreamException;
import org.arena.utils.SseUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 所有失败都以 OpenAI 风格的 {"error": {...}} 返回
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleModelNotFound(ModelNotFoundException ex, HttpServletRequest request) {
        log.warn("模型不存在: {}, 路径: {}", ex.getRequestedModel(), request.getRequestURI());
        return respond(ex.getStatus(), SseUtils.errorBody(ex.getMessage(), ex.getType(), ex.getStatus().value(),
                Collections.singletonMap("available_models", ex.getAvailableModels())));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamException ex) {
        Map<String, Object> extra = ex.getUpstreamStatus() != null
                ? Collections.singletonMap("upstream_status", ex.getUpstreamStatus())
                : Collections.emptyMap();
        return respond(ex.getStatus(), SseUtils.errorBody(ex.getMessage(), ex.getType(), ex.getStatus().value(), extra));
    }

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<Map<String, Object>> handleService(ServiceException ex, HttpServletRequest request) {
        log.warn("请求失败[{}]: {}, 路径: {}", ex.getStatus().value(), ex.getMessage(), request.getRequestURI());
        return respond(ex.getStatus(), SseUtils.errorBody(ex.getMessage(), ex.getType(), ex.getStatus().value()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("请求参数校验失败: {}, 路径: {}", message, request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, SseUtils.errorBody(message, "invalid_request_error", 400));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("请求体无法解析, 路径: {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, SseUtils.errorBody("Invalid JSON", "invalid_request_error", 400));
    }

    /**
     * SSE 超时时响应已经是 text/event-stream，不再写入 JSON 错误体
     */
    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public void handleAsyncTimeout(AsyncRequestTimeoutException ex, HttpServletRequest request, HttpServletResponse response) {
        log.debug("异步请求超时, 路径: {}", request.getRequestURI());
        if (!response.isCommitted()) {
            response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
        }
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("未处理的异常, 路径: {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, SseUtils.errorBody("服务内部错误", "server_error", 500));
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, Map<String, Object> body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
