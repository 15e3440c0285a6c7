package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A pattern match overrides the classifier's intent and confidence. Escalated sessions only
 * honour emergency categories; everything else goes to the escalated-session reply.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(ClassificationStep.class)
public class PatternMatchStep implements CascadeStep {

    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        Optional<MatchResult> match = session.getTenant().patternMatcher().match(session.getMessage().text());
        if (match.isEmpty()) {
            return new StepResult.Continue();
        }
        MatchResult result = match.get();
        if (session.isAlreadyEscalated() && !result.isEmergency()) {
            return new StepResult.Continue();
        }

        session.setPatternMatch(result);
        session.setIntent(result.intent());
        session.setConfidence(result.confidence());
        boolean answered = result.confidence() >= session.thresholds().confidenceFloor()
                && session.offerReply(result.responseTemplate(), ReplySource.PATTERN);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("category", result.category());
        payload.put("intent", result.intent().wireValue());
        payload.put("urgency", result.urgency().name());
        payload.put("confidence", result.confidence());
        payload.put("answered", answered);
        audit.audit(AuditStage.PATTERN_MATCHED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }
}
