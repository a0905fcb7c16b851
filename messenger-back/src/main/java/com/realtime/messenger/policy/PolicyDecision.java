package com.realtime.messenger.policy;

public enum PolicyDecision {
    ALLOWED, BLOCKED;

    public boolean allowed() {
        return this == ALLOWED;
    }
}
