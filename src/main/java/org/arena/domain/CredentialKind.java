package org.arena.domain;

/**
 * reCAPTCHA 凭证类型：V3 进入队列，V2 仅作为单个备用凭证
 */
public enum CredentialKind {
    V3,
    V2
}
