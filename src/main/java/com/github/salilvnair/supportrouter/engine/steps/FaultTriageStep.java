package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.fault.FaultCategory;
import com.github.salilvnair.supportrouter.fault.FaultTriage;
import com.github.salilvnair.supportrouter.fault.FaultTriageService;
import com.github.salilvnair.supportrouter.memory.FactExtractor;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Grades fault reports. A recognised fault category becomes the session's {@code issue_category}
 * unless an emergency pattern already named the issue.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(FactExtractionStep.class)
public class FaultTriageStep implements CascadeStep {

    private final FaultTriageService faultTriageService;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        MatchResult pattern = session.getPatternMatch();
        Optional<FaultTriage> triage = faultTriageService.triage(
                session.getMessage().text(),
                session.getIntent(),
                pattern,
                session.currentFacts()
        );
        if (triage.isEmpty()) {
            return new StepResult.Continue();
        }
        FaultTriage faultTriage = triage.get();
        session.setFaultTriage(faultTriage);
        if (session.getIntent() != Intent.FAULT_REPORT && session.getIntent() != Intent.COMPLAINT) {
            session.setIntent(Intent.FAULT_REPORT);
        }
        if ((pattern == null || !pattern.isEmergency()) && faultTriage.category() != FaultCategory.OTHER) {
            session.getExtractedFacts().put(FactExtractor.ISSUE_CATEGORY, faultTriage.category().wireValue());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("category", faultTriage.category().wireValue());
        payload.put("urgency", faultTriage.urgency().name());
        payload.put("missingFacts", faultTriage.missingFacts());
        audit.audit(AuditStage.FAULT_TRIAGED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }
}
