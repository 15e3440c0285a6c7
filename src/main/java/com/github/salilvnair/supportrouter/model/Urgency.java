package com.github.salilvnair.supportrouter.model;

public enum Urgency {
    NONE,
    HIGH,
    CRITICAL;

    public boolean isUrgent() {
        return this != NONE;
    }
}
