package com.github.salilvnair.supportrouter.audit;

public enum AuditStage {
    STEP_ENTER,
    STEP_EXIT,
    STEP_ERROR,
    SESSION_LOADED,
    INPUT_FLAGGED,
    MESSAGE_CLASSIFIED,
    PATTERN_MATCHED,
    KNOWLEDGE_MATCHED,
    KNOWLEDGE_GROUNDING,
    FACTS_EXTRACTED,
    FAULT_TRIAGED,
    LEAD_SCORED,
    LEAD_THRESHOLD_CROSSED,
    ESCALATION_DECIDED,
    REMOTE_MODEL_SKIPPED,
    REMOTE_MODEL_REPLY,
    REMOTE_MODEL_FAILED,
    RESPONSE_ASSEMBLED,
    SESSION_COMMITTED,
    PIPELINE_FAILED,
    CASCADE_COMPLETED;

    public String value() {
        return name();
    }
}
