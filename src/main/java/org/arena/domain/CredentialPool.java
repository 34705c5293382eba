package org.arena.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * 单个账号的凭证池：V3 凭证按到达顺序排队（最旧在前），另有一个 V2 备用槽位。
 * <p>
 * 已取出的凭证值会一直记录到其过期为止，扩展重复推送同一凭证时直接丢弃。
 * <p>
 * 非线程安全，所有调用都必须持有所属 {@link Profile} 的锁。
 */
@Slf4j
public class CredentialPool {

    private final Deque<Credential> queue = new ArrayDeque<>();
    // 已取出的凭证值 -> 过期时间
    private final Map<String, Long> consumed = new HashMap<>();
    private final int maxSize;
    private Credential fallback;

    public CredentialPool(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("凭证池容量必须大于0: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * 加入一个 V3 凭证，已过期或重复的直接丢弃；超出容量时淘汰最旧的
     *
     * @return 是否真正加入
     */
    public boolean offer(Credential credential, long now) {
        if (credential.isExpired(now) || contains(credential.getValue()) || isConsumed(credential.getValue())) {
            return false;
        }
        queue.addLast(credential);
        while (queue.size() > maxSize) {
            Credential evicted = queue.pollFirst();
            log.debug("凭证池已满，淘汰最旧凭证: {}", evicted);
        }
        return true;
    }

    public boolean offerFallback(Credential credential, long now) {
        if (credential.isExpired(now) || isConsumed(credential.getValue())) {
            return false;
        }
        if (fallback != null && fallback.getValue().equals(credential.getValue())) {
            return false;
        }
        fallback = credential;
        return true;
    }

    /**
     * 取出最旧的未过期凭证，V3 用完后才使用 V2 备用凭证
     */
    public Optional<Credential> take(long now) {
        sweepExpired(now);
        Credential credential = queue.pollFirst();
        if (credential == null && fallback != null) {
            credential = fallback;
            fallback = null;
        }
        if (credential != null) {
            consumed.put(credential.getValue(), credential.getExpiresAt());
        }
        return Optional.ofNullable(credential);
    }

    /**
     * @return 被清理的凭证数量
     */
    public int sweepExpired(long now) {
        int removed = 0;
        Iterator<Credential> it = queue.iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (fallback != null && fallback.isExpired(now)) {
            fallback = null;
            removed++;
        }
        consumed.values().removeIf(expiresAt -> now >= expiresAt);
        return removed;
    }

    public int size() {
        return queue.size();
    }

    public boolean hasFallback() {
        return fallback != null;
    }

    public int available() {
        return queue.size() + (fallback != null ? 1 : 0);
    }

    public int getMaxSize() {
        return maxSize;
    }

    private boolean isConsumed(String value) {
        return consumed.containsKey(value);
    }

    private boolean contains(String value) {
        for (Credential c : queue) {
            if (c.getValue().equals(value)) {
                return true;
            }
        }
        return false;
    }
}
