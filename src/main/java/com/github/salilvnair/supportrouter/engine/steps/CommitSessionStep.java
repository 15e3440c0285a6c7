package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.escalation.EscalationDecision;
import com.github.salilvnair.supportrouter.lead.LeadScore;
import com.github.salilvnair.supportrouter.memory.ConversationMemory;
import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.memory.SessionUpdate;
import com.github.salilvnair.supportrouter.model.RouterResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only step that writes to conversation memory. Everything before it works on the snapshot,
 * so a failure anywhere earlier leaves the session untouched.
 */
@RequiredArgsConstructor
@Component
@TerminalStep
public class CommitSessionStep implements CascadeStep {

    private final ConversationMemory memory;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        SessionSnapshot snapshot = session.getSnapshot();
        LeadScore leadScore = session.getLeadScore();
        int leadValue = leadScore == null ? snapshot.leadScore() : leadScore.value();
        EscalationDecision decision = session.getEscalationDecision();

        SessionSnapshot committed = memory.update(session.getSessionId(), SessionUpdate.builder()
                .leadScore(leadValue)
                .newFacts(session.getExtractedFacts())
                .escalated(decision.escalated())
                .escalationState(session.getEscalationState())
                .escalatedCategory(decision.rule() == null ? null : decision.rule().name())
                .sentiment(session.getSentiment())
                .consecutiveAngryTurns(session.getConsecutiveAngryTurns())
                .consecutiveFrustratedTurns(session.getConsecutiveFrustratedTurns())
                .highValueHit(leadScore != null && leadScore.highValueHit())
                .build());

        RouterResult result = RouterResult.builder()
                .replyText(session.getReplyText())
                .intent(session.getIntent())
                .confidence(Math.max(0d, Math.min(1d, session.getConfidence())))
                .sentiment(session.getSentiment())
                .leadScore(committed.leadScore())
                .action(session.getAction())
                .suggestedFollowups(session.getSuggestedFollowups())
                .replySource(session.getReplySource())
                .build();
        session.setResult(result);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnCount", committed.turnCount());
        payload.put("leadScore", committed.leadScore());
        payload.put("escalationState", committed.escalationState().name());
        payload.put("action", result.action().name());
        payload.put("replySource", result.replySource().name());
        payload.put("pendingNotifications", session.getPendingNotifications().size());
        audit.audit(AuditStage.SESSION_COMMITTED, session.getSessionId(), payload);
        return new StepResult.Stop(result);
    }
}
