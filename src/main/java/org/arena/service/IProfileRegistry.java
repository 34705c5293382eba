package org.arena.service;

import org.arena.domain.DispatchTicket;
import org.arena.domain.ProfileSnapshot;
import org.arena.domain.PushResult;
import org.arena.domain.ScoredProfile;
import org.arena.domain.dto.ExtensionPushRequest;

import java.util.List;
import java.util.Optional;

public interface IProfileRegistry {

    /**
     * 合并一次推送；未携带 profile_id 时分配新 ID 并在结果中返回
     */
    PushResult ingestPush(ExtensionPushRequest payload);

    /**
     * 活跃账号，按健康度从高到低排序
     */
    List<ScoredProfile> listActive(long now);

    /**
     * 全部账号（含已过期的），用于状态展示
     */
    List<ScoredProfile> listAll(long now);

    double healthScore(ProfileSnapshot snapshot, long now);

    Optional<DispatchTicket> take(String profileId);

    void recordError(String profileId);

    int sweepExpired();

    int getPoolMax();
}
