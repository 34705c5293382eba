package org.arena.domain;

import lombok.Value;

@Value
public class PushResult {

    String profileId;
    boolean newProfile;
    int accepted;
    int queueSize;
    boolean needTokens;
}
