package org.arena.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.arena.domain.ProfileSnapshot;
import org.arena.domain.PushResult;
import org.arena.domain.ScoredProfile;
import org.arena.domain.dto.ExtensionPushRequest;
import org.arena.domain.vo.ExtensionPushResponse;
import org.arena.domain.vo.ProfileStatusVO;
import org.arena.service.IExtensionService;
import org.arena.service.IModelCatalog;
import org.arena.service.IProfileRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ExtensionServiceImpl implements IExtensionService {

    private final IProfileRegistry profileRegistry;
    private final IModelCatalog modelCatalog;
    private final Clock clock;

    public ExtensionServiceImpl(IProfileRegistry profileRegistry,
                                IModelCatalog modelCatalog,
                                Clock clock) {
        this.profileRegistry = profileRegistry;
        this.modelCatalog = modelCatalog;
        this.clock = clock;
    }

    @Override
    public ExtensionPushResponse push(ExtensionPushRequest request) {
        PushResult result = profileRegistry.ingestPush(request);
        if (result.isNeedTokens()) {
            log.debug("账号[{}]凭证不足，池中 {} 个", result.getProfileId(), result.getQueueSize());
        }
        return new ExtensionPushResponse("ok", result.getProfileId(), profileRegistry.getPoolMax(),
                result.isNeedTokens(), result.getQueueSize());
    }

    @Override
    public Map<String, Object> status() {
        long now = clock.millis();
        List<ProfileStatusVO> profiles = new ArrayList<>();
        int active = 0;
        for (ScoredProfile scored : profileRegistry.listAll(now)) {
            if (scored.isActive()) {
                active++;
            }
            profiles.add(toStatus(scored, now));
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("active", active > 0);
        status.put("active_profiles", active);
        status.put("pool_max", profileRegistry.getPoolMax());
        status.put("models", modelCatalog.listModels().size());
        status.put("profiles", profiles);
        return status;
    }

    private ProfileStatusVO toStatus(ScoredProfile scored, long now) {
        ProfileSnapshot snapshot = scored.getSnapshot();
        ProfileStatusVO vo = new ProfileStatusVO();
        vo.setProfileId(snapshot.getProfileId());
        vo.setActive(scored.isActive());
        vo.setHealth(Math.round(scored.getHealth() * 10) / 10.0);
        vo.setLastPushAgo(snapshot.getLastPushAt() > 0 ? Math.round((now - snapshot.getLastPushAt()) / 100.0) / 10.0 : null);
        vo.setV3Tokens(snapshot.getQueueSize());
        vo.setHasV2(snapshot.isHasFallback());
        vo.setHasAuth(snapshot.isHasAuth());
        vo.setHasCf(snapshot.isHasCfClearance());
        vo.setPushCount(snapshot.getPushCount());
        vo.setErrorCount(snapshot.getErrorCount());
        vo.setRecentErrors(snapshot.getRecentErrors());
        vo.setNextActions(snapshot.getNextActionNames());
        vo.setCookies(snapshot.getCookieNames());
        return vo;
    }
}
