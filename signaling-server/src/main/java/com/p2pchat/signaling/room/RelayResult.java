package com.p2pchat.signaling.room;

public enum RelayResult {
    DELIVERED,
    NO_PEER
}
