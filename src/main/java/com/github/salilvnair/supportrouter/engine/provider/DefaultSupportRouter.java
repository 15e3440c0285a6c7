package com.github.salilvnair.supportrouter.engine.provider;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.core.SupportRouter;
import com.github.salilvnair.supportrouter.engine.exception.RequestCancelledException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterException;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.engine.exception.TenantNotFoundException;
import com.github.salilvnair.supportrouter.engine.factory.CascadePipelineFactory;
import com.github.salilvnair.supportrouter.engine.model.StepTiming;
import com.github.salilvnair.supportrouter.engine.response.FollowupSuggester;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.engine.validation.MessageValidator;
import com.github.salilvnair.supportrouter.memory.ConversationMemory;
import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.model.RouterAction;
import com.github.salilvnair.supportrouter.model.RouterResult;
import com.github.salilvnair.supportrouter.notification.NotificationDispatcher;
import com.github.salilvnair.supportrouter.notification.RouterNotification;
import com.github.salilvnair.supportrouter.tenant.TenantRegistry;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates the message, resolves the tenant and runs the cascade under the session lock.
 * <p>
 * Notifications are dispatched after the lock is released and only for committed turns. A step
 * failure is answered with the tenant's fallback reply and commits nothing. A tenant whose
 * configuration does not compile is reported as not found.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultSupportRouter implements SupportRouter {

    private final MessageValidator messageValidator;
    private final TenantRegistry tenantRegistry;
    private final ConversationMemory memory;
    private final CascadePipelineFactory pipelineFactory;
    private final NotificationDispatcher notificationDispatcher;
    private final FollowupSuggester followupSuggester;
    private final AuditService audit;

    @Override
    public RouterResult process(IncomingMessage message) {
        messageValidator.validate(message);
        TenantRuntime tenant = resolveTenant(message.tenantId());
        RouterSession session = new RouterSession(message, tenant);

        RouterResult result;
        try {
            result = memory.withSessionLock(message.sessionId(), () -> run(session));
        }
        finally {
            reportTimings(session);
        }

        if (session.getResult() == result) {
            List<RouterNotification> notifications = List.copyOf(session.getPendingNotifications());
            notificationDispatcher.dispatch(notifications);
        }
        return result;
    }

    @Override
    public void resetSession(String sessionId) {
        memory.reset(sessionId);
    }

    private TenantRuntime resolveTenant(String tenantId) {
        try {
            return tenantRegistry.getOrCreate(tenantId);
        }
        catch (TenantConfigurationException e) {
            log.error("Tenant configuration rejected tenant={} code={} msg={}", tenantId, e.getErrorCode(), e.getMessage());
            throw new TenantNotFoundException(tenantId, e);
        }
    }

    private RouterResult run(RouterSession session) {
        try {
            return pipelineFactory.create().execute(session);
        }
        catch (RequestCancelledException e) {
            log.info("Request cancelled sessionId={} tenant={}", session.getSessionId(), session.getTenant().tenantId());
            throw e;
        }
        catch (RuntimeException e) {
            log.error("Cascade failed, answering with fallback sessionId={} tenant={}",
                    session.getSessionId(), session.getTenant().tenantId(), e);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("errorCode", e instanceof SupportRouterException routerException
                    ? routerException.getErrorCode()
                    : SupportRouterErrorCode.INTERNAL_ERROR.name());
            payload.put("errorType", e.getClass().getSimpleName());
            payload.put("errorMessage", String.valueOf(e.getMessage()));
            audit.audit(AuditStage.PIPELINE_FAILED, session.getSessionId(), payload);
            return fallbackResult(session);
        }
    }

    private void reportTimings(RouterSession session) {
        if (session.getStepTimings().isEmpty()) {
            return;
        }
        Map<String, Long> steps = new LinkedHashMap<>();
        long totalMs = 0;
        for (StepTiming timing : session.getStepTimings()) {
            steps.put(timing.getStepName(), timing.getDurationMs());
            totalMs += timing.getDurationMs();
        }
        boolean failed = session.getStepTimings().stream().anyMatch(t -> !t.isSuccess());
        log.debug("Cascade finished sessionId={} totalMs={} failed={} steps={}", session.getSessionId(), totalMs, failed, steps);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("totalMs", totalMs);
        payload.put("failed", failed);
        payload.put("steps", steps);
        audit.audit(AuditStage.CASCADE_COMPLETED, session.getSessionId(), payload);
    }

    private RouterResult fallbackResult(RouterSession session) {
        SessionSnapshot snapshot = session.getSnapshot() != null
                ? session.getSnapshot()
                : memory.snapshot(session.getSessionId());
        boolean escalated = snapshot.escalated();
        RouterAction action = escalated ? RouterAction.ESCALATE : RouterAction.COLLECT_INFO;
        String reply = escalated
                ? session.getTenant().templates().escalatedSession()
                : session.getTenant().templates().fallback();
        return RouterResult.builder()
                .replyText(reply)
                .intent(session.getIntent())
                .confidence(0d)
                .sentiment(session.getSentiment())
                .leadScore(snapshot.leadScore())
                .action(action)
                .suggestedFollowups(followupSuggester.suggest(session.getIntent(), action))
                .replySource(escalated ? ReplySource.ESCALATION : ReplySource.FALLBACK)
                .build();
    }
}
