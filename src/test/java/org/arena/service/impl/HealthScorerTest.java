package org.arena.service.impl;

import org.arena.config.ArenaProperties;
import org.arena.domain.ProfileSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealthScorerTest {

    private final HealthScorer scorer = new HealthScorer(new ArenaProperties());

    private static ProfileSnapshot.ProfileSnapshotBuilder base() {
        return ProfileSnapshot.builder().profileId("p").lastPushAt(100_000L).queueSize(2);
    }

    @Test
    void moreCredentialsScoreHigher() {
        assertTrue(scorer.score(base().queueSize(5).build(), 100_000L) > scorer.score(base().build(), 100_000L));
    }

    @Test
    void credentialContributionIsCapped() {
        double atCap = scorer.score(base().queueSize(11).build(), 100_000L);
        double beyond = scorer.score(base().queueSize(50).build(), 100_000L);
        assertEquals(atCap, beyond);
    }

    @Test
    void authAndCfClearanceAddScore() {
        double plain = scorer.score(base().build(), 100_000L);
        double withAuth = scorer.score(base().hasAuth(true).build(), 100_000L);
        double withBoth = scorer.score(base().hasAuth(true).hasCfClearance(true).build(), 100_000L);
        assertEquals(HealthScorer.AUTH_WEIGHT, withAuth - plain, 1e-9);
        assertEquals(HealthScorer.CF_WEIGHT, withBoth - withAuth, 1e-9);
    }

    @Test
    void olderPushAndRecentErrorsScoreLower() {
        ProfileSnapshot snapshot = base().build();
        assertTrue(scorer.score(snapshot, 160_000L) < scorer.score(snapshot, 100_000L));
        assertTrue(scorer.score(base().recentErrors(2).build(), 100_000L) < scorer.score(snapshot, 100_000L));
    }
}
