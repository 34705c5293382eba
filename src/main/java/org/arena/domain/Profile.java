package org.arena.domain;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一个上游账号的会话与凭证。
 * <p>
 * 推送合并、取凭证、过期清理互斥执行，锁只在内存操作期间持有，不跨越网络请求。
 */
public class Profile {

    static final String CF_CLEARANCE_COOKIE = "cf_clearance";

    @Getter
    private final String profileId;
    @Getter
    private final long createdAt;
    private final String authCookieName;
    private final ReentrantLock lock = new ReentrantLock();

    // 以下字段均由 lock 保护
    private final CredentialPool pool;
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private final Map<String, String> nextActions = new LinkedHashMap<>();
    private final Deque<Long> errorTimes = new ArrayDeque<>();
    private String authToken;
    private String cfClearance;
    private long lastPushAt;
    private long pushCount;
    private long errorCount;

    public Profile(String profileId, int poolMax, String authCookieName, long now) {
        this.profileId = profileId;
        this.pool = new CredentialPool(poolMax);
        this.authCookieName = authCookieName;
        this.createdAt = now;
    }

    /**
     * 合并一次推送。即使没有任何新凭证也会刷新 lastPushAt
     */
    public PushOutcome merge(ProfilePush push, long now) {
        lock.lock();
        try {
            lastPushAt = now;
            pushCount++;

            // 空值不覆盖已有的非空 cookie
            push.getCookies().forEach((name, value) -> {
                if (name == null || name.isEmpty()) {
                    return;
                }
                if (value != null && !value.isEmpty()) {
                    cookies.put(name, value);
                } else {
                    cookies.putIfAbsent(name, "");
                }
            });

            push.getNextActions().forEach((name, hash) -> {
                if (notBlank(name) && notBlank(hash)) {
                    nextActions.put(name, hash);
                }
            });

            String auth = notBlank(push.getAuthToken()) ? push.getAuthToken() : authFromCookies();
            if (notBlank(auth)) {
                authToken = auth;
            }
            String cf = notBlank(push.getCfClearance()) ? push.getCfClearance() : cookies.get(CF_CLEARANCE_COOKIE);
            if (notBlank(cf)) {
                cfClearance = cf;
            }

            pool.sweepExpired(now);
            int accepted = 0;
            for (Credential credential : push.getCredentials()) {
                if (pool.offer(credential, now)) {
                    accepted++;
                }
            }
            if (push.getFallback() != null && pool.offerFallback(push.getFallback(), now)) {
                accepted++;
            }
            return new PushOutcome(accepted, pool.size(), pool.hasFallback());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 原子地取出一个凭证，连同会话材料副本一起返回
     */
    public Optional<DispatchTicket> take(long now) {
        lock.lock();
        try {
            return pool.take(now).map(credential -> new DispatchTicket(
                    profileId, Collections.unmodifiableMap(nonEmptyCookies()), authToken, cfClearance, credential));
        } finally {
            lock.unlock();
        }
    }

    public int sweepExpired(long now) {
        lock.lock();
        try {
            return pool.sweepExpired(now);
        } finally {
            lock.unlock();
        }
    }

    public void recordError(long now) {
        lock.lock();
        try {
            errorCount++;
            errorTimes.addLast(now);
        } finally {
            lock.unlock();
        }
    }

    public long getLastPushAt() {
        lock.lock();
        try {
            return lastPushAt;
        } finally {
            lock.unlock();
        }
    }

    public ProfileSnapshot snapshot(long now, long errorWindowMillis) {
        lock.lock();
        try {
            pool.sweepExpired(now);
            while (!errorTimes.isEmpty() && now - errorTimes.peekFirst() > errorWindowMillis) {
                errorTimes.pollFirst();
            }
            return ProfileSnapshot.builder()
                    .profileId(profileId)
                    .createdAt(createdAt)
                    .lastPushAt(lastPushAt)
                    .pushCount(pushCount)
                    .errorCount(errorCount)
                    .recentErrors(errorTimes.size())
                    .queueSize(pool.size())
                    .hasFallback(pool.hasFallback())
                    .hasAuth(notBlank(authToken))
                    .hasCfClearance(notBlank(cfClearance))
                    .cookieNames(new ArrayList<>(cookies.keySet()))
                    .nextActionNames(new ArrayList<>(nextActions.keySet()))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private String authFromCookies() {
        String whole = cookies.get(authCookieName);
        if (notBlank(whole)) {
            return whole;
        }
        String first = cookies.get(authCookieName + ".0");
        if (notBlank(first)) {
            String second = cookies.get(authCookieName + ".1");
            return first + (second != null ? second : "");
        }
        return null;
    }

    private Map<String, String> nonEmptyCookies() {
        Map<String, String> result = new LinkedHashMap<>();
        cookies.forEach((k, v) -> {
            if (notBlank(v)) {
                result.put(k, v);
            }
        });
        return result;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
