package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.SessionBootstrapStep;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.escalation.EscalationState;
import com.github.salilvnair.supportrouter.memory.ConversationMemory;
import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@RequiredArgsConstructor
@Component
@SessionBootstrapStep
public class LoadSessionStep implements CascadeStep {

    private final ConversationMemory memory;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        SessionSnapshot snapshot = memory.snapshot(session.getSessionId());
        session.setSnapshot(snapshot);
        session.setEscalationState(snapshot.escalated()
                ? EscalationState.ESCALATED
                : snapshot.escalationState());
        session.setNormalizedText(TextNormalizer.normalize(session.getMessage().text()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnCount", snapshot.turnCount());
        payload.put("leadScore", snapshot.leadScore());
        payload.put("escalated", snapshot.escalated());
        payload.put("escalationState", snapshot.escalationState().name());
        payload.put("historySize", session.getMessage().history().size());
        audit.audit(AuditStage.SESSION_LOADED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }
}
