package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.engine.response.FollowupSuggester;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.escalation.EscalationDecision;
import com.github.salilvnair.supportrouter.escalation.EscalationState;
import com.github.salilvnair.supportrouter.lead.LeadScore;
import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.model.RouterAction;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import com.github.salilvnair.supportrouter.support.RouterFixtures;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.supportrouter.support.RouterFixtures.NOW;
import static com.github.salilvnair.supportrouter.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;

class ResponseAssemblyStepTest {

    private final TenantRuntime tenant = RouterFixtures.acmeRuntime();
    private RouterSession session;

    @BeforeEach
    void setUp() {
        session = new RouterSession(IncomingMessage.of("text", SESSION_ID, TENANT_ACME), tenant);
        session.setSnapshot(SessionSnapshot.fresh(SESSION_ID, NOW));
    }

    @Test
    void missingReplyFallsBackAndCollectsInfo() {
        ResponseAssemblyStep step = new ResponseAssemblyStep(new FollowupSuggester(), mock(AuditService.class));

        step.execute(session);

        assertEquals(tenant.templates().fallback(), session.getReplyText());
        assertEquals(ReplySource.FALLBACK, session.getReplySource());
        assertEquals(RouterAction.COLLECT_INFO, session.getAction());
        assertFalse(session.getSuggestedFollowups().isEmpty());
    }

    @Test
    void existingReplyIsKept() {
        ResponseAssemblyStep step = new ResponseAssemblyStep(new FollowupSuggester(), mock(AuditService.class));
        session.offerReply("Svar", ReplySource.KNOWLEDGE);

        step.execute(session);

        assertEquals("Svar", session.getReplyText());
        assertEquals(RouterAction.NONE, session.getAction());
    }

    @Test
    void escalationWinsOverEverything() {
        session.offerReply("Svar", ReplySource.KNOWLEDGE);
        session.setLeadScore(new LeadScore(5, 5, true));
        session.setEscalationDecision(EscalationDecision.alreadyEscalated());

        assertEquals(RouterAction.ESCALATE, ResponseAssemblyStep.selectAction(session));
    }

    @Test
    void escalatedSnapshotEscalates() {
        session.setSnapshot(SessionSnapshot.fresh(SESSION_ID, NOW).toBuilder()
                .escalated(true)
                .escalationState(EscalationState.ESCALATED)
                .build());
        session.offerReply("Svar", ReplySource.PATTERN);

        assertEquals(RouterAction.ESCALATE, ResponseAssemblyStep.selectAction(session));
    }

    @Test
    void emergencyCollectsInfoEvenForHotLead() {
        session.offerReply("Ring jouren", ReplySource.PATTERN);
        session.setPatternMatch(new MatchResult("water_leak", Intent.FAULT_REPORT, "Ring jouren", 0.95, 1, Urgency.CRITICAL));
        session.setLeadScore(new LeadScore(5, 5, false));

        assertEquals(RouterAction.COLLECT_INFO, ResponseAssemblyStep.selectAction(session));
    }

    @Test
    void hotLeadBooksCall() {
        session.offerReply("Svar", ReplySource.KNOWLEDGE);
        session.setLeadScore(new LeadScore(4, 4, true));

        assertEquals(RouterAction.BOOK_CALL, ResponseAssemblyStep.selectAction(session));
    }

    @Test
    void faultReportCollectsInfo() {
        session.offerReply("Svar", ReplySource.REMOTE_MODEL);
        session.setIntent(Intent.FAULT_REPORT);

        assertEquals(RouterAction.COLLECT_INFO, ResponseAssemblyStep.selectAction(session));
    }
}
