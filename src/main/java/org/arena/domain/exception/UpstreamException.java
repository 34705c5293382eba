package org.arena.domain.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 上游返回非 2xx，或流中出现错误帧。已消耗的凭证不会重放，重试由调用方决定
 */
@Getter
public class UpstreamException extends ServiceException {

    // 上游 HTTP 状态码，错误帧时为 null
    private final Integer upstreamStatus;

    public UpstreamException(String message) {
        this(message, null, null);
    }

    public UpstreamException(String message, Integer upstreamStatus) {
        this(message, upstreamStatus, null);
    }

    public UpstreamException(String message, Integer upstreamStatus, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "upstream_error", message, cause);
        this.upstreamStatus = upstreamStatus;
    }
}
