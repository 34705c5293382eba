package org.arena.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.arena.domain.DispatchTicket;
import org.arena.domain.ScoredProfile;
import org.arena.domain.exception.ServiceUnavailableException;
import org.arena.service.IDispatcher;
import org.arena.service.IProfileRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class DispatcherImpl implements IDispatcher {

    static final String NO_PROFILE_MESSAGE = "扩展未连接，请在安装了扩展的浏览器中打开 arena.ai";
    static final String EXHAUSTED_MESSAGE = "所有账号的凭证均已用尽，请稍后重试";

    private final IProfileRegistry profileRegistry;
    private final Clock clock;

    public DispatcherImpl(IProfileRegistry profileRegistry, Clock clock) {
        this.profileRegistry = profileRegistry;
        this.clock = clock;
    }

    @Override
    public void admit(String requestId) {
        if (profileRegistry.listActive(clock.millis()).isEmpty()) {
            log.warn("拒绝请求[请求: {}]：没有活跃账号", requestId);
            throw new ServiceUnavailableException(NO_PROFILE_MESSAGE);
        }
    }

    @Override
    public DispatchTicket acquire(String requestId) {
        List<ScoredProfile> candidates = profileRegistry.listActive(clock.millis());
        if (candidates.isEmpty()) {
            log.warn("拒绝请求[请求: {}]：没有活跃账号", requestId);
            throw new ServiceUnavailableException(NO_PROFILE_MESSAGE);
        }

        for (ScoredProfile candidate : candidates) {
            Optional<DispatchTicket> ticket = profileRegistry.take(candidate.getProfileId());
            if (ticket.isPresent()) {
                log.info("分配账号[请求: {}, 账号: {}]，健康度 {}，凭证类型 {}",
                        requestId, candidate.getProfileId(), candidate.getHealth(),
                        ticket.get().getCredential().getKind());
                return ticket.get();
            }
            log.debug("账号凭证已耗尽，尝试下一个[请求: {}, 账号: {}]", requestId, candidate.getProfileId());
        }

        log.warn("拒绝请求[请求: {}]：{} 个活跃账号的凭证均已耗尽", requestId, candidates.size());
        throw new ServiceUnavailableException(EXHAUSTED_MESSAGE);
    }
}
