package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.escalation.RulePriority;
import com.github.salilvnair.supportrouter.lead.LeadScore;
import com.github.salilvnair.supportrouter.lead.LeadScorer;
import com.github.salilvnair.supportrouter.notification.NotificationType;
import com.github.salilvnair.supportrouter.notification.RouterNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(FaultTriageStep.class)
public class LeadScoringStep implements CascadeStep {

    private final LeadScorer leadScorer;
    private final AuditService audit;
    private final Clock clock;

    @Override
    public StepResult execute(RouterSession session) {
        int patternHint = session.getPatternMatch() == null
                ? LeadScorer.MIN_SCORE
                : session.getPatternMatch().leadScoreHint();
        int previous = session.getSnapshot().leadScore();
        LeadScore score = leadScorer.score(
                session.getMessage().text(),
                session.getSnapshot(),
                session.getIntent(),
                patternHint,
                session.thresholds()
        );
        session.setLeadScore(score);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previous", previous);
        payload.put("computed", score.computed());
        payload.put("value", score.value());
        payload.put("highValueHit", score.highValueHit());
        audit.audit(AuditStage.LEAD_SCORED, session.getSessionId(), payload);

        if (leadScorer.crossesNotifyThreshold(previous, score.value(), session.thresholds())) {
            log.info("Lead threshold reached sessionId={} tenant={} leadScore={}",
                    session.getSessionId(), session.getTenant().tenantId(), score.value());
            session.addNotification(RouterNotification.builder()
                    .type(NotificationType.LEAD_THRESHOLD)
                    .tenantId(session.getTenant().tenantId())
                    .sessionId(session.getSessionId())
                    .priority(RulePriority.MEDIUM)
                    .category(session.getIntent().wireValue())
                    .summary("Lead score " + previous + " -> " + score.value()
                            + ", intent " + session.getIntent().wireValue())
                    .notifyTargets(session.getTenant().notifyTargets())
                    .createdAt(clock.instant())
                    .build());
            audit.audit(AuditStage.LEAD_THRESHOLD_CROSSED, session.getSessionId(), Map.of("leadScore", score.value()));
        }
        return new StepResult.Continue();
    }
}
