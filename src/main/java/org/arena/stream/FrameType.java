package org.arena.stream;

public enum FrameType {
    TEXT_DELTA,
    REASONING_DELTA,
    ATTACHMENT,
    HEARTBEAT,
    TERMINAL,
    ERROR
}
