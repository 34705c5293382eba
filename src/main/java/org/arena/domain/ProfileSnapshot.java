package org.arena.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProfileSnapshot {

    String profileId;
    long createdAt;
    long lastPushAt;
    long pushCount;
    long errorCount;
    int recentErrors;
    int queueSize;
    boolean hasFallback;
    boolean hasAuth;
    boolean hasCfClearance;
    List<String> cookieNames;
    List<String> nextActionNames;

    public int available() {
        return queueSize + (hasFallback ? 1 : 0);
    }
}
