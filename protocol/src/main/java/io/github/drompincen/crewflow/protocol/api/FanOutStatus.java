package io.github.drompincen.crewflow.protocol.api;

public enum FanOutStatus {
    /** No created message had a direct recipient. */
    NONE,
    DISPATCHED,
    /** The chain exhausted its hop budget; recipients were not woken. */
    HOP_LIMIT,
    FAILED
}
