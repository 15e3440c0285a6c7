package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.escalation.BuiltInEscalationRules;
import com.github.salilvnair.supportrouter.escalation.EscalationContext;
import com.github.salilvnair.supportrouter.escalation.EscalationDecision;
import com.github.salilvnair.supportrouter.escalation.EscalationEngine;
import com.github.salilvnair.supportrouter.escalation.EscalationRule;
import com.github.salilvnair.supportrouter.escalation.EscalationState;
import com.github.salilvnair.supportrouter.fault.FaultTriage;
import com.github.salilvnair.supportrouter.fault.FaultUrgency;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.notification.NotificationType;
import com.github.salilvnair.supportrouter.notification.RouterNotification;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates the tenant's rules for this turn and moves the escalation state. An escalation keeps a
 * reply that an earlier step already produced, so an emergency still gets its emergency number.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(LeadScoringStep.class)
public class EscalationStep implements CascadeStep {

    private final EscalationEngine escalationEngine;
    private final AuditService audit;
    private final Clock clock;

    @Override
    public StepResult execute(RouterSession session) {
        EscalationContext context = context(session);
        EscalationState current = session.getEscalationState();
        EscalationDecision decision = escalationEngine.evaluate(
                session.getTenant().escalationRules(), current, context);
        session.setEscalationDecision(decision);

        switch (decision.outcome()) {
            case ALREADY_ESCALATED -> session.offerReply(
                    session.getTenant().templates().escalatedSession(), ReplySource.ESCALATION);
            case ESCALATE -> {
                EscalationRule rule = decision.rule();
                String reply = rule.responseTemplate() != null
                        ? rule.responseTemplate()
                        : session.getTenant().templates().escalation();
                session.offerReply(reply, ReplySource.ESCALATION);
                session.addNotification(notification(session, NotificationType.ESCALATION, rule, context));
            }
            case NOTIFY -> session.addNotification(
                    notification(session, NotificationType.ADVISORY, decision.rule(), context));
            case NONE -> {
            }
        }

        session.setEscalationState(escalationEngine.nextState(current, decision, session.hasReply()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("outcome", decision.outcome().name());
        payload.put("rule", decision.rule() == null ? null : decision.rule().name());
        payload.put("from", current.name());
        payload.put("to", session.getEscalationState().name());
        payload.put("categories", context.categories());
        audit.audit(AuditStage.ESCALATION_DECIDED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }

    private EscalationContext context(RouterSession session) {
        Set<String> categories = new LinkedHashSet<>();
        // a weakly classified intent is not a category rules may act on
        if (session.getConfidence() >= session.thresholds().confidenceFloor()) {
            categories.add(session.getIntent().wireValue());
        }
        MatchResult pattern = session.getPatternMatch();
        if (pattern != null) {
            categories.add(pattern.category());
            if (pattern.urgency() == Urgency.CRITICAL) {
                categories.add(BuiltInEscalationRules.CRITICAL_FAULT_CATEGORY);
            }
        }
        FaultTriage triage = session.getFaultTriage();
        if (triage != null) {
            if (triage.urgency() == FaultUrgency.CRITICAL) {
                categories.add(BuiltInEscalationRules.CRITICAL_FAULT_CATEGORY);
            }
            else if (triage.urgency() == FaultUrgency.HIGH) {
                categories.add(BuiltInEscalationRules.URGENT_FAULT_CATEGORY);
            }
        }
        int leadScore = session.getLeadScore() == null
                ? session.getSnapshot().leadScore()
                : session.getLeadScore().value();
        return new EscalationContext(
                session.getNormalizedText(),
                session.getSentiment(),
                session.getConsecutiveAngryTurns(),
                session.getConsecutiveFrustratedTurns(),
                session.turnCount(),
                leadScore,
                categories
        );
    }

    private RouterNotification notification(RouterSession session,
                                            NotificationType type,
                                            EscalationRule rule,
                                            EscalationContext context) {
        Set<String> targets = rule.notifyTargets().isEmpty()
                ? session.getTenant().notifyTargets()
                : rule.notifyTargets();
        return RouterNotification.builder()
                .type(type)
                .tenantId(session.getTenant().tenantId())
                .sessionId(session.getSessionId())
                .priority(rule.priority())
                .category(rule.name())
                .summary(summary(session, rule, context))
                .notifyTargets(targets)
                .createdAt(clock.instant())
                .build();
    }

    private String summary(RouterSession session, EscalationRule rule, EscalationContext context) {
        Map<String, String> facts = session.currentFacts();
        FaultTriage triage = session.getFaultTriage();
        return "Reason: " + rule.name()
                + " | Turns: " + context.turnCount()
                + " | Intent: " + session.getIntent().wireValue()
                + (triage == null ? "" : " | Fault: " + triage.category().wireValue() + "/" + triage.urgency().name())
                + " | Sentiment: " + context.sentiment().wireValue()
                + " | Lead score: " + context.leadScore()
                + " | Known facts: " + (facts.isEmpty() ? "-" : facts);
    }
}
