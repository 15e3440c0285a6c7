package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.guard.GuardVerdict;
import com.github.salilvnair.supportrouter.guard.InputGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(LoadSessionStep.class)
public class InputGuardStep implements CascadeStep {

    private final InputGuard inputGuard;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        GuardVerdict verdict = inputGuard.inspect(session.getMessage().text());
        session.setGuardVerdict(verdict);
        if (verdict.flagged()) {
            log.warn("Input flagged reason={} sessionId={} tenant={}",
                    verdict.reason(), session.getSessionId(), session.getTenant().tenantId());
            audit.audit(AuditStage.INPUT_FLAGGED, session.getSessionId(), Map.of("reason", verdict.reason()));
        }
        return new StepResult.Continue();
    }
}
