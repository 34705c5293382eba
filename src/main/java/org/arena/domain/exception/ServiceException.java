package org.arena.domain.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务异常基类，携带对外的 HTTP 状态码和 OpenAI 风格的错误类型
 */
@Getter
public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String type;

    public ServiceException(String message) {
        this(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", message);
    }

    public ServiceException(HttpStatus status, String type, String message) {
        super(message);
        this.status = status;
        this.type = type;
    }

    public ServiceException(HttpStatus status, String type, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.type = type;
    }
}
