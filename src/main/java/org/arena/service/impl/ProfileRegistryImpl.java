package org.arena.service.impl;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.arena.config.ArenaProperties;
import org.arena.domain.ArenaModel;
import org.arena.domain.Credential;
import org.arena.domain.CredentialKind;
import org.arena.domain.DispatchTicket;
import org.arena.domain.ModelCategory;
import org.arena.domain.Profile;
import org.arena.domain.ProfilePush;
import org.arena.domain.ProfileSnapshot;
import org.arena.domain.PushOutcome;
import org.arena.domain.PushResult;
import org.arena.domain.ScoredProfile;
import org.arena.domain.dto.ExtensionPushRequest;
import org.arena.service.IModelCatalog;
import org.arena.service.IProfileRegistry;
import org.arena.utils.Uuid7;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class ProfileRegistryImpl implements IProfileRegistry {

    // 过短的 token 不可能是有效的 reCAPTCHA 凭证
    static final int MIN_TOKEN_LENGTH = 20;
    static final String DEFAULT_ACTION = "chat_submit";

    private static final Comparator<ScoredProfile> BY_HEALTH = Comparator
            .comparingDouble(ScoredProfile::getHealth).reversed()
            .thenComparing(Comparator.comparingLong((ScoredProfile p) -> p.getSnapshot().getLastPushAt()).reversed())
            .thenComparing(ScoredProfile::getProfileId);

    private final ArenaProperties arenaProperties;
    private final IModelCatalog modelCatalog;
    private final HealthScorer healthScorer;
    private final Clock clock;

    // profileId -> 账号，单个账号内部自行加锁
    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();

    private ScheduledExecutorService sweepScheduler;

    public ProfileRegistryImpl(ArenaProperties arenaProperties,
                               IModelCatalog modelCatalog,
                               HealthScorer healthScorer,
                               Clock clock) {
        this.arenaProperties = arenaProperties;
        this.modelCatalog = modelCatalog;
        this.healthScorer = healthScorer;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        int interval = arenaProperties.getSweepInterval();
        sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "arena-credential-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweepScheduler.scheduleAtFixedRate(this::safeSweep, interval, interval, TimeUnit.SECONDS);
        log.info("凭证清理任务已启动，间隔 {} 秒，凭证有效期 {} 秒，账号过期阈值 {} 秒",
                interval, arenaProperties.getTokenLifetime(), arenaProperties.getStaleAfter());
    }

    @PreDestroy
    public void stop() {
        if (sweepScheduler != null) {
            sweepScheduler.shutdownNow();
        }
    }

    @Override
    public PushResult ingestPush(ExtensionPushRequest payload) {
        long now = clock.millis();
        String requestedId = payload.getProfileId();
        boolean assigned = requestedId == null || requestedId.isBlank();
        String profileId = assigned ? Uuid7.next() : requestedId.trim();

        boolean[] created = {false};
        Profile profile = profiles.computeIfAbsent(profileId, id -> {
            created[0] = true;
            return new Profile(id, arenaProperties.getPoolMax(), arenaProperties.getAuthCookieName(), now);
        });
        if (created[0]) {
            log.info("新账号接入[账号: {}]{}", profileId, assigned ? "，ID 由服务端分配" : "");
        }

        PushOutcome outcome = profile.merge(toProfilePush(payload, now), now);

        List<ArenaModel> models = toModels(payload.getModels());
        if (!models.isEmpty()) {
            modelCatalog.register(profileId, models);
        }

        boolean needTokens = outcome.getQueueSize() < arenaProperties.getPoolMax() / 2;
        log.debug("收到推送[账号: {}]，新增凭证 {}，池中 {}，需要补充: {}",
                profileId, outcome.getAccepted(), outcome.getQueueSize(), needTokens);
        return new PushResult(profileId, created[0], outcome.getAccepted(), outcome.getQueueSize(), needTokens);
    }

    @Override
    public List<ScoredProfile> listActive(long now) {
        List<ScoredProfile> result = new ArrayList<>();
        for (ScoredProfile profile : listAll(now)) {
            if (profile.isActive()) {
                result.add(profile);
            }
        }
        return result;
    }

    @Override
    public List<ScoredProfile> listAll(long now) {
        List<ScoredProfile> result = new ArrayList<>();
        for (Profile profile : profiles.values()) {
            ProfileSnapshot snapshot = profile.snapshot(now, arenaProperties.errorWindowMillis());
            result.add(new ScoredProfile(snapshot, healthScore(snapshot, now), isActive(snapshot.getLastPushAt(), now)));
        }
        result.sort(BY_HEALTH);
        return result;
    }

    @Override
    public double healthScore(ProfileSnapshot snapshot, long now) {
        return healthScorer.score(snapshot, now);
    }

    @Override
    public Optional<DispatchTicket> take(String profileId) {
        Profile profile = profiles.get(profileId);
        if (profile == null) {
            return Optional.empty();
        }
        return profile.take(clock.millis());
    }

    @Override
    public void recordError(String profileId) {
        Profile profile = profiles.get(profileId);
        if (profile != null) {
            profile.recordError(clock.millis());
        }
    }

    @Override
    public int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Profile profile : profiles.values()) {
            removed += profile.sweepExpired(now);
            if (!isActive(profile.getLastPushAt(), now)) {
                modelCatalog.unregister(profile.getProfileId());
            }
        }
        if (removed > 0) {
            log.debug("清理过期凭证 {} 个", removed);
        }
        return removed;
    }

    @Override
    public int getPoolMax() {
        return arenaProperties.getPoolMax();
    }

    private void safeSweep() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            log.error("定时清理凭证失败", e);
        }
    }

    private boolean isActive(long lastPushAt, long now) {
        return lastPushAt > 0 && now - lastPushAt < arenaProperties.staleAfterMillis();
    }

    private ProfilePush toProfilePush(ExtensionPushRequest payload, long now) {
        long lifetime = arenaProperties.tokenLifetimeMillis();
        ProfilePush.ProfilePushBuilder builder = ProfilePush.builder()
                .authToken(payload.getAuthToken())
                .cfClearance(payload.getCfClearance());
        payload.getCookies().forEach((name, value) -> {
            if (name != null) {
                builder.cookie(name, value != null ? value : "");
            }
        });
        if (payload.getNextActions() != null) {
            payload.getNextActions().forEach((name, hash) -> {
                if (name != null && hash != null) {
                    builder.nextAction(name, hash);
                }
            });
        }

        if (payload.getV3Tokens() != null) {
            for (ExtensionPushRequest.TokenItem item : payload.getV3Tokens()) {
                if (item.getToken().length() < MIN_TOKEN_LENGTH) {
                    continue;
                }
                long age = item.getAgeMs() != null ? item.getAgeMs() : 0L;
                if (age >= lifetime) {
                    continue;
                }
                String action = item.getAction() != null && !item.getAction().isBlank() ? item.getAction() : DEFAULT_ACTION;
                builder.credential(new Credential(item.getToken(), action, CredentialKind.V3, now - age, lifetime));
            }
        }

        ExtensionPushRequest.TokenItem v2 = payload.getV2Token();
        if (v2 != null) {
            long age = v2.getAgeMs() != null ? v2.getAgeMs() : 0L;
            if (age < lifetime) {
                builder.fallback(new Credential(v2.getToken(), "v2", CredentialKind.V2, now - age, lifetime));
            }
        }
        return builder.build();
    }

    static List<ArenaModel> toModels(List<ExtensionPushRequest.ModelItem> items) {
        List<ArenaModel> models = new ArrayList<>();
        if (items == null) {
            return models;
        }
        for (ExtensionPushRequest.ModelItem item : items) {
            if (item == null) {
                continue;
            }
            String name = item.getPublicName() != null && !item.getPublicName().isBlank() ? item.getPublicName() : item.getName();
            if (name == null || name.isBlank()) {
                continue;
            }
            String id = item.getId() != null && !item.getId().isBlank() ? item.getId() : name;
            models.add(new ArenaModel(name, id, categoryOf(item)));
        }
        return models;
    }

    private static ModelCategory categoryOf(ExtensionPushRequest.ModelItem item) {
        if (item.getCategory() != null) {
            for (ModelCategory category : ModelCategory.values()) {
                if (category.getValue().equals(item.getCategory().toLowerCase(Locale.ROOT))) {
                    return category;
                }
            }
        }
        ExtensionPushRequest.Capabilities caps = item.getCapabilities();
        if (caps != null) {
            if (caps.getOutputCapabilities() != null && caps.getOutputCapabilities().contains("image")) {
                return ModelCategory.IMAGE;
            }
            if (caps.getInputCapabilities() != null && caps.getInputCapabilities().contains("image")) {
                return ModelCategory.VISION;
            }
        }
        return ModelCategory.TEXT;
    }
}
