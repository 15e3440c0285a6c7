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
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@RequiredArgsConstructor
@Component
public class CascadePipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(CascadePipelineFactory.class);

    private final List<CascadeStep> discoveredSteps;
    private final AuditService audit;

    private CascadePipeline pipeline;

    // ---------------------------------------------------------------------
    // Init
    // ---------------------------------------------------------------------
    @PostConstruct
    public void init() {
        List<CascadeStep> ordered = orderByDag(discoveredSteps);
        debugPrint(ordered);
        this.pipeline = new CascadePipeline(wrapWithTiming(ordered));
    }

    public CascadePipeline create() {
        return pipeline;
    }

    // ---------------------------------------------------------------------
    // DAG ordering using annotations
    // ---------------------------------------------------------------------
    private List<CascadeStep> orderByDag(List<CascadeStep> steps) {

        Map<Class<?>, CascadeStep> stepByClass = new HashMap<>();
        for (CascadeStep s : steps) {
            if (stepByClass.put(s.getClass(), s) != null) {
                throw new SupportRouterException(
                        SupportRouterErrorCode.DUPLICATE_CASCADE_STEP,
                        "Duplicate CascadeStep bean for class: " + s.getClass().getName()
                );
            }
        }

        Class<?> terminal = exactlyOne(stepByClass.keySet(), TerminalStep.class,
                SupportRouterErrorCode.MISSING_TERMINAL_STEP);
        Class<?> bootstrap = exactlyOne(stepByClass.keySet(), SessionBootstrapStep.class,
                SupportRouterErrorCode.MISSING_BOOTSTRAP_STEP);

        Map<Class<?>, Set<Class<?>>> outgoing = new HashMap<>();
        Map<Class<?>, Set<Class<?>>> incoming = new HashMap<>();

        for (Class<?> c : stepByClass.keySet()) {
            outgoing.put(c, new LinkedHashSet<>());
            incoming.put(c, new LinkedHashSet<>());
        }

        for (Class<?> c : stepByClass.keySet()) {
            MustRunBefore before = c.getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends CascadeStep> b : before.value()) {
                    requirePresent(stepByClass, c, b);
                    addEdge(outgoing, incoming, c, b);
                }
            }
        }

        // A must run after B => B -> A
        for (Class<?> c : stepByClass.keySet()) {
            MustRunAfter after = c.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends CascadeStep> a : after.value()) {
                    requirePresent(stepByClass, c, a);
                    addEdge(outgoing, incoming, a, c);
                }
            }
        }

        // bootstrap first, terminal last
        for (Class<?> c : stepByClass.keySet()) {
            if (!c.equals(bootstrap)) {
                addEdge(outgoing, incoming, bootstrap, c);
            }
            if (!c.equals(terminal)) {
                addEdge(outgoing, incoming, c, terminal);
            }
        }

        List<Class<?>> sorted = topoSort(stepByClass.keySet(), outgoing, incoming);

        return sorted.stream().map(stepByClass::get).toList();
    }

    private Class<?> exactlyOne(Set<Class<?>> classes,
                                Class<? extends java.lang.annotation.Annotation> marker,
                                SupportRouterErrorCode errorCode) {
        List<Class<?>> marked = classes.stream()
                .filter(c -> c.getAnnotation(marker) != null)
                .toList();
        if (marked.size() != 1) {
            throw new SupportRouterException(
                    errorCode,
                    "Exactly ONE @" + marker.getSimpleName() + " required, found: " +
                            marked.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(", "))
            );
        }
        return marked.get(0);
    }

    private void requirePresent(Map<Class<?>, CascadeStep> stepByClass,
                                Class<?> owner,
                                Class<?> dep) {
        if (!stepByClass.containsKey(dep)) {
            throw new SupportRouterException(
                    SupportRouterErrorCode.MISSING_DEPENDENT_STEP,
                    owner.getSimpleName() + " depends on missing step: " + dep.getName()
            );
        }
    }

    private void addEdge(Map<Class<?>, Set<Class<?>>> outgoing,
                         Map<Class<?>, Set<Class<?>>> incoming,
                         Class<?> from,
                         Class<?> to) {
        if (from.equals(to)) return;
        if (outgoing.get(from).add(to)) {
            incoming.get(to).add(from);
        }
    }

    private List<Class<?>> topoSort(Set<Class<?>> nodes,
                                    Map<Class<?>, Set<Class<?>>> outgoing,
                                    Map<Class<?>, Set<Class<?>>> incoming) {

        Map<Class<?>, Integer> indegree = new HashMap<>();
        for (Class<?> n : nodes) {
            indegree.put(n, incoming.get(n).size());
        }

        PriorityQueue<Class<?>> q =
                new PriorityQueue<>(Comparator.comparing(Class::getName));

        indegree.forEach((k, v) -> {
            if (v == 0) q.add(k);
        });

        List<Class<?>> result = new ArrayList<>();

        while (!q.isEmpty()) {
            Class<?> n = q.poll();
            result.add(n);

            for (Class<?> m : outgoing.get(n)) {
                indegree.put(m, indegree.get(m) - 1);
                if (indegree.get(m) == 0) q.add(m);
            }
        }

        if (result.size() != nodes.size()) {
            Set<Class<?>> remaining = new LinkedHashSet<>(nodes);
            result.forEach(remaining::remove);
            throw new SupportRouterException(
                    SupportRouterErrorCode.MISSING_DAG_CYCLE,
                    "CascadeStep DAG cycle or unsatisfied constraints: " +
                            remaining.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(" -> "))
            );
        }

        return result;
    }

    private void debugPrint(List<CascadeStep> ordered) {
        log.info(
                "SupportRouter cascade order: {}",
                ordered.stream()
                        .map(s -> s.getClass().getSimpleName())
                        .collect(Collectors.joining(" -> "))
        );
    }

    // ---------------------------------------------------------------------
    // Timing wrapper
    // ---------------------------------------------------------------------
    private List<CascadeStep> wrapWithTiming(List<CascadeStep> steps) {
        return steps.stream()
                .map(s -> (CascadeStep) new TimingCascadeStep(s, audit))
                .toList();
    }

    private static final class TimingCascadeStep implements CascadeStep {

        private final CascadeStep delegate;
        private final AuditService audit;

        private TimingCascadeStep(CascadeStep delegate, AuditService audit) {
            this.delegate = delegate;
            this.audit = audit;
        }

        @Override
        public StepResult execute(RouterSession session) {
            long start = System.nanoTime();
            String stepName = delegate.getClass().getSimpleName();

            audit.audit(AuditStage.STEP_ENTER, session.getSessionId(), stepPayload(session, stepName, Map.of()));
            try {
                StepResult r = delegate.execute(session);
                long durationMs = elapsedMs(start);
                session.getStepTimings().add(new StepTiming(stepName, durationMs, true, null));
                audit.audit(
                        AuditStage.STEP_EXIT,
                        session.getSessionId(),
                        stepPayload(
                                session,
                                stepName,
                                Map.of(
                                        "outcome", r.getClass().getSimpleName(),
                                        "durationMs", durationMs
                                )
                        )
                );
                return r;
            } catch (RuntimeException e) {
                long durationMs = elapsedMs(start);
                String error = e.getClass().getSimpleName() + ": " + e.getMessage();
                session.getStepTimings().add(new StepTiming(stepName, durationMs, false, error));
                Map<String, Object> errorPayload = new LinkedHashMap<>();
                errorPayload.put("step", stepName);
                errorPayload.put("durationMs", durationMs);
                errorPayload.put("errorType", e.getClass().getSimpleName());
                errorPayload.put("errorMessage", String.valueOf(e.getMessage()));
                if (e instanceof SupportRouterException routerException && routerException.getMetaData() != null) {
                    errorPayload.put("_errorMeta", routerException.getMetaData());
                }
                audit.audit(AuditStage.STEP_ERROR, session.getSessionId(), errorPayload);
                throw e;
            }
        }

        private static long elapsedMs(long startNs) {
            return (System.nanoTime() - startNs) / 1_000_000;
        }

        private Map<String, Object> stepPayload(RouterSession session, String stepName, Map<String, Object> extra) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("step", stepName);
            payload.put("tenantId", session.getMessage().tenantId());
            payload.putAll(extra);

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("intent", session.getIntent().wireValue());
            meta.put("replySource", session.getReplySource() == null ? null : session.getReplySource().name());
            payload.put("_meta", meta);
            return payload;
        }
    }
}
