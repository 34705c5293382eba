package org.arena.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * 没有活跃账号，或所有候选账号的凭证池都已耗尽
 */
public class ServiceUnavailableException extends ServiceException {

    public ServiceUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", message);
    }
}
