package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.memory.FactExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@RequiredArgsConstructor
@Component
@MustRunAfter(KnowledgeLookupStep.class)
public class FactExtractionStep implements CascadeStep {

    private final FactExtractor factExtractor;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        Map<String, String> facts = factExtractor.extract(
                session.getMessage().text(),
                session.getIntent(),
                session.getPatternMatch()
        );
        if (!facts.isEmpty()) {
            session.getExtractedFacts().putAll(facts);
            // values can be personal data, only the keys are audited
            audit.audit(AuditStage.FACTS_EXTRACTED, session.getSessionId(), Map.of("keys", facts.keySet()));
        }
        return new StepResult.Continue();
    }
}
