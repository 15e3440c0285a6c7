package com.github.salilvnair.supportrouter.model;

public enum ReplySource {
    PATTERN,
    KNOWLEDGE,
    REMOTE_MODEL,
    ESCALATION,
    FALLBACK
}
