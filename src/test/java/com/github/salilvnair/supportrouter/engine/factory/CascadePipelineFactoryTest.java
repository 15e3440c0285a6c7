package com.github.salilvnair.supportrouter.engine.factory;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterException;
import com.github.salilvnair.supportrouter.engine.model.StepTiming;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadePipeline;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.SessionBootstrapStep;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.RouterAction;
import com.github.salilvnair.supportrouter.model.RouterResult;
import com.github.salilvnair.supportrouter.support.RouterFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.salilvnair.supportrouter.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static com.github.salilvnair.supportrouter.support.TestConstants.TEXT_GREETING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CascadePipelineFactoryTest {

    @Test
    void initBuildsDagOrderedPipeline() {
        List<String> calls = new ArrayList<>();
        CascadePipelineFactory factory = new CascadePipelineFactory(
                List.of(
                        new FinalAnnotatedStep(calls),
                        new LateStep(calls),
                        new EarlyStep(calls),
                        new BootstrapAnnotatedStep(calls)
                ),
                auditNoop());

        factory.init();
        CascadePipeline pipeline = factory.create();
        RouterSession session = newSession();
        RouterResult result = pipeline.execute(session);

        assertEquals(List.of("bootstrap", "early", "late", "terminal"), calls);
        assertEquals(RouterAction.NONE, result.action());
        assertEquals(4, session.getStepTimings().size());
    }

    @Test
    void initThrowsWhenNoTerminalStepExists() {
        CascadePipelineFactory factory = new CascadePipelineFactory(
                List.of(new BootstrapAnnotatedStep(new ArrayList<>())),
                auditNoop());

        SupportRouterException e = assertThrows(SupportRouterException.class, factory::init);

        assertEquals(SupportRouterErrorCode.MISSING_TERMINAL_STEP, e.getCode());
    }

    @Test
    void initThrowsWhenDependencyIsMissing() {
        List<String> calls = new ArrayList<>();
        CascadePipelineFactory factory = new CascadePipelineFactory(
                List.of(new BootstrapAnnotatedStep(calls), new LateStep(calls), new FinalAnnotatedStep(calls)),
                auditNoop());

        SupportRouterException e = assertThrows(SupportRouterException.class, factory::init);

        assertEquals(SupportRouterErrorCode.MISSING_DEPENDENT_STEP, e.getCode());
    }

    @Test
    void initThrowsOnCycle() {
        List<String> calls = new ArrayList<>();
        CascadePipelineFactory factory = new CascadePipelineFactory(
                List.of(
                        new BootstrapAnnotatedStep(calls),
                        new PingStep(),
                        new PongStep(),
                        new FinalAnnotatedStep(calls)
                ),
                auditNoop());

        SupportRouterException e = assertThrows(SupportRouterException.class, factory::init);

        assertEquals(SupportRouterErrorCode.MISSING_DAG_CYCLE, e.getCode());
    }

    @Test
    void everyStepRecordsItsTimingInOrder() {
        List<String> calls = new ArrayList<>();
        AuditService audit = auditNoop();
        CascadePipelineFactory factory = new CascadePipelineFactory(
                List.of(new FinalAnnotatedStep(calls), new BootstrapAnnotatedStep(calls)),
                audit);
        factory.init();
        RouterSession session = newSession();

        factory.create().execute(session);

        assertEquals(List.of("BootstrapAnnotatedStep", "FinalAnnotatedStep"),
                session.getStepTimings().stream().map(StepTiming::getStepName).toList());
        assertTrue(session.getStepTimings().stream().allMatch(StepTiming::isSuccess));
        verify(audit, times(2)).audit(eq(AuditStage.STEP_EXIT), eq(SESSION_ID), anyMap());
    }

    @Test
    void stepFailureIsAuditedAndRethrown() {
        AuditService audit = auditNoop();
        CascadePipelineFactory factory = new CascadePipelineFactory(
                List.of(new ExplodingBootstrapStep(), new FinalAnnotatedStep(new ArrayList<>())),
                audit);
        factory.init();
        RouterSession session = newSession();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> factory.create().execute(session));

        assertEquals("boom", e.getMessage());
        verify(audit).audit(eq(AuditStage.STEP_ERROR), eq(SESSION_ID), anyMap());
        assertFalse(session.getStepTimings().get(0).isSuccess());
        assertTrue(session.getStepTimings().get(0).getError().contains("boom"));
    }

    private AuditService auditNoop() {
        return mock(AuditService.class);
    }

    private RouterSession newSession() {
        return new RouterSession(IncomingMessage.of(TEXT_GREETING, SESSION_ID, TENANT_ACME), RouterFixtures.acmeRuntime());
    }

    @SessionBootstrapStep
    private static final class BootstrapAnnotatedStep implements CascadeStep {
        private final List<String> calls;

        private BootstrapAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(RouterSession session) {
            calls.add("bootstrap");
            return new StepResult.Continue();
        }
    }

    @SessionBootstrapStep
    private static final class ExplodingBootstrapStep implements CascadeStep {
        @Override
        public StepResult execute(RouterSession session) {
            throw new IllegalStateException("boom");
        }
    }

    @MustRunBefore(LateStep.class)
    private static final class EarlyStep implements CascadeStep {
        private final List<String> calls;

        private EarlyStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(RouterSession session) {
            calls.add("early");
            return new StepResult.Continue();
        }
    }

    @MustRunAfter(EarlyStep.class)
    private static final class LateStep implements CascadeStep {
        private final List<String> calls;

        private LateStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(RouterSession session) {
            calls.add("late");
            return new StepResult.Continue();
        }
    }

    @MustRunAfter(PongStep.class)
    private static final class PingStep implements CascadeStep {
        @Override
        public StepResult execute(RouterSession session) {
            return new StepResult.Continue();
        }
    }

    @MustRunAfter(PingStep.class)
    private static final class PongStep implements CascadeStep {
        @Override
        public StepResult execute(RouterSession session) {
            return new StepResult.Continue();
        }
    }

    @TerminalStep
    private static final class FinalAnnotatedStep implements CascadeStep {
        private final List<String> calls;

        private FinalAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(RouterSession session) {
            calls.add("terminal");
            RouterResult result = RouterResult.builder()
                    .replyText("ok")
                    .action(RouterAction.NONE)
                    .build();
            session.setResult(result);
            return new StepResult.Stop(result);
        }
    }
}
