package org.arena.domain;

import lombok.Getter;
import lombok.ToString;

/**
 * 一次性的防自动化凭证，被取走或过期后即销毁
 */
@Getter
@ToString(exclude = "value")
public class Credential {

    private final String value;
    private final String action;
    private final CredentialKind kind;
    private final long mintedAt;
    private final long expiresAt;

    public Credential(String value, String action, CredentialKind kind, long mintedAt, long lifetimeMillis) {
        this.value = value;
        this.action = action;
        this.kind = kind;
        this.mintedAt = mintedAt;
        this.expiresAt = mintedAt + lifetimeMillis;
    }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }
}
