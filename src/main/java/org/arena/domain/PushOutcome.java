package org.arena.domain;

import lombok.Value;

@Value
public class PushOutcome {

    int accepted;
    int queueSize;
    boolean hasFallback;
}
