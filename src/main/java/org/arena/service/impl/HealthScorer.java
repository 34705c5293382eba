package org.arena.service.impl;

import org.arena.config.ArenaProperties;
import org.arena.domain.ProfileSnapshot;
import org.springframework.stereotype.Component;

/**
 * 账号健康度：凭证越多、推送越新、认证材料越全越高，近期错误越多越低。
 * 权重只是调度偏好，不是精确契约
 */
@Component
public class HealthScorer {

    static final double TOKEN_WEIGHT = 10.0;
    static final double FRESHNESS_WEIGHT = 30.0;
    static final double AUTH_WEIGHT = 15.0;
    static final double CF_WEIGHT = 5.0;
    static final double ERROR_PENALTY = 20.0;

    private final ArenaProperties arenaProperties;

    public HealthScorer(ArenaProperties arenaProperties) {
        this.arenaProperties = arenaProperties;
    }

    public double score(ProfileSnapshot snapshot, long now) {
        double staleAfter = arenaProperties.staleAfterMillis();
        long age = Math.max(0, now - snapshot.getLastPushAt());
        double freshness = snapshot.getLastPushAt() > 0 ? Math.max(0.0, 1.0 - age / staleAfter) : 0.0;

        double score = Math.min(snapshot.available(), arenaProperties.getPoolMax() + 1) * TOKEN_WEIGHT
                + freshness * FRESHNESS_WEIGHT;
        if (snapshot.isHasAuth()) {
            score += AUTH_WEIGHT;
        }
        if (snapshot.isHasCfClearance()) {
            score += CF_WEIGHT;
        }
        return score - snapshot.getRecentErrors() * ERROR_PENALTY;
    }
}
