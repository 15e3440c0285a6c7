package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.response.FollowupSuggester;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.fault.FaultTriage;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.model.RouterAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@Component
@MustRunAfter(RemoteModelStep.class)
public class ResponseAssemblyStep implements CascadeStep {

    private final FollowupSuggester followupSuggester;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        session.offerReply(session.getTenant().templates().fallback(), ReplySource.FALLBACK);

        RouterAction action = selectAction(session);
        session.setAction(action);
        FaultTriage triage = session.getFaultTriage();
        session.setSuggestedFollowups(followupSuggester.suggest(
                session.getIntent(), action, triage == null ? List.of() : triage.missingFacts()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("replySource", session.getReplySource().name());
        payload.put("action", action.name());
        payload.put("followups", session.getSuggestedFollowups().size());
        audit.audit(AuditStage.RESPONSE_ASSEMBLED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }

    static RouterAction selectAction(RouterSession session) {
        if (session.isEscalated() || session.isAlreadyEscalated()) {
            return RouterAction.ESCALATE;
        }
        if (session.getReplySource() == ReplySource.FALLBACK) {
            return RouterAction.COLLECT_INFO;
        }
        if (session.getPatternMatch() != null && session.getPatternMatch().isEmergency()) {
            return RouterAction.COLLECT_INFO;
        }
        if (session.getFaultTriage() != null && session.getFaultTriage().urgency().requiresEscalation()) {
            return RouterAction.COLLECT_INFO;
        }
        int leadScore = session.getLeadScore() == null
                ? session.getSnapshot().leadScore()
                : session.getLeadScore().value();
        if (leadScore >= session.thresholds().leadNotifyThreshold()) {
            return RouterAction.BOOK_CALL;
        }
        Intent intent = session.getIntent();
        if (intent == Intent.FAULT_REPORT || intent == Intent.COMPLAINT) {
            return RouterAction.COLLECT_INFO;
        }
        return RouterAction.NONE;
    }
}
