package org.arena.domain;

import lombok.Value;

@Value
public class ScoredProfile {

    ProfileSnapshot snapshot;
    double health;
    boolean active;

    public String getProfileId() {
        return snapshot.getProfileId();
    }
}
