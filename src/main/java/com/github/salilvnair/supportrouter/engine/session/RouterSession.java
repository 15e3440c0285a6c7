package com.github.salilvnair.supportrouter.engine.session;

import com.github.salilvnair.supportrouter.classifier.Classification;
import com.github.salilvnair.supportrouter.engine.model.StepTiming;
import com.github.salilvnair.supportrouter.escalation.EscalationDecision;
import com.github.salilvnair.supportrouter.escalation.EscalationState;
import com.github.salilvnair.supportrouter.fault.FaultTriage;
import com.github.salilvnair.supportrouter.guard.GuardVerdict;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeMatch;
import com.github.salilvnair.supportrouter.lead.LeadScore;
import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.model.RouterAction;
import com.github.salilvnair.supportrouter.model.RouterResult;
import com.github.salilvnair.supportrouter.model.Sentiment;
import com.github.salilvnair.supportrouter.notification.RouterNotification;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import com.github.salilvnair.supportrouter.tenant.CascadeThresholds;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request scratch state shared by the cascade steps. Nothing here outlives the request;
 * the session itself only changes when {@code CommitSessionStep} calls the memory component.
 */
@Getter
@Setter
public class RouterSession {

    private final IncomingMessage message;
    private final TenantRuntime tenant;

    private SessionSnapshot snapshot;
    private String normalizedText;
    private GuardVerdict guardVerdict = GuardVerdict.clean();

    private Classification classification;
    private Intent intent = Intent.UNKNOWN;
    private double confidence;
    private Sentiment sentiment = Sentiment.NEUTRAL;
    private int consecutiveAngryTurns;
    private int consecutiveFrustratedTurns;

    private MatchResult patternMatch;
    private KnowledgeMatch knowledgeMatch;
    private List<String> groundingSnippets = List.of();
    private final Map<String, String> extractedFacts = new LinkedHashMap<>();
    private FaultTriage faultTriage;

    private LeadScore leadScore;
    private EscalationDecision escalationDecision = EscalationDecision.none();
    private EscalationState escalationState = EscalationState.LOCAL;

    private String replyText;
    private ReplySource replySource;
    private boolean remoteModelFailed;
    private RouterAction action;
    private List<String> suggestedFollowups = List.of();

    private final List<RouterNotification> pendingNotifications = new ArrayList<>();
    private final List<StepTiming> stepTimings = new ArrayList<>();
    private RouterResult result;

    public RouterSession(IncomingMessage message, TenantRuntime tenant) {
        this.message = message;
        this.tenant = tenant;
    }

    public String getSessionId() {
        return message.sessionId();
    }

    public CascadeThresholds thresholds() {
        return tenant.thresholds();
    }

    public boolean hasReply() {
        return replyText != null;
    }

    /** Sets the reply unless an earlier source already supplied one. */
    public boolean offerReply(String text, ReplySource source) {
        if (replyText != null || text == null || text.isBlank()) {
            return false;
        }
        this.replyText = text;
        this.replySource = source;
        return true;
    }

    public boolean isAlreadyEscalated() {
        return snapshot != null && snapshot.escalated();
    }

    public boolean isEscalated() {
        return escalationDecision.escalated();
    }

    public int turnCount() {
        return (snapshot == null ? 0 : snapshot.turnCount()) + 1;
    }

    /** Known facts as they will be after this turn commits. */
    public Map<String, String> currentFacts() {
        Map<String, String> facts = new LinkedHashMap<>(snapshot == null ? Map.of() : snapshot.knownFacts());
        facts.putAll(extractedFacts);
        return facts;
    }

    public void addNotification(RouterNotification notification) {
        pendingNotifications.add(notification);
    }
}
