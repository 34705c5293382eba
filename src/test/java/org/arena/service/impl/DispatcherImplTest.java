package org.arena.service.impl;

import org.arena.MutableClock;
import org.arena.domain.Credential;
import org.arena.domain.CredentialKind;
import org.arena.domain.DispatchTicket;
import org.arena.domain.ProfileSnapshot;
import org.arena.domain.ScoredProfile;
import org.arena.domain.exception.ServiceUnavailableException;
import org.arena.service.IProfileRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class DispatcherImplTest {

    private IProfileRegistry registry;
    private DispatcherImpl dispatcher;

    @BeforeEach
    void setUp() {
        registry = mock(IProfileRegistry.class);
        dispatcher = new DispatcherImpl(registry, new MutableClock(1_000_000L));
    }

    private static ScoredProfile scored(String id, double health) {
        ProfileSnapshot snapshot = ProfileSnapshot.builder().profileId(id).lastPushAt(1L).queueSize(1).build();
        return new ScoredProfile(snapshot, health, true);
    }

    private static DispatchTicket ticket(String id) {
        Credential credential = new Credential("token-xxxxxxxxxxxxxxxxxxxx", "chat_submit", CredentialKind.V3, 0, 110_000);
        return new DispatchTicket(id, Collections.emptyMap(), null, null, credential);
    }

    @Test
    void admitRejectsWhenNoActiveProfile() {
        when(registry.listActive(anyLong())).thenReturn(Collections.emptyList());

        ServiceUnavailableException e = assertThrows(ServiceUnavailableException.class, () -> dispatcher.admit("req"));
        assertEquals(DispatcherImpl.NO_PROFILE_MESSAGE, e.getMessage());
        verify(registry, never()).take(anyString());
    }

    @Test
    void acquireFallsThroughExhaustedProfiles() {
        when(registry.listActive(anyLong())).thenReturn(List.of(scored("best", 90), scored("second", 50)));
        when(registry.take("best")).thenReturn(Optional.empty());
        when(registry.take("second")).thenReturn(Optional.of(ticket("second")));

        assertEquals("second", dispatcher.acquire("req").getProfileId());
        verify(registry).take("best");
    }

    @Test
    void acquirePrefersHealthiest() {
        when(registry.listActive(anyLong())).thenReturn(List.of(scored("best", 90), scored("second", 50)));
        when(registry.take("best")).thenReturn(Optional.of(ticket("best")));

        assertEquals("best", dispatcher.acquire("req").getProfileId());
        verify(registry, never()).take("second");
    }

    @Test
    void acquireFailsWhenAllExhausted() {
        when(registry.listActive(anyLong())).thenReturn(List.of(scored("a", 10), scored("b", 5)));
        when(registry.take(anyString())).thenReturn(Optional.empty());

        ServiceUnavailableException e = assertThrows(ServiceUnavailableException.class, () -> dispatcher.acquire("req"));
        assertEquals(DispatcherImpl.EXHAUSTED_MESSAGE, e.getMessage());
    }
}
