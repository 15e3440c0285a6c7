package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.exception.RemoteModelException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.guard.ReplySanitizer;
import com.github.salilvnair.supportrouter.llm.RemoteModelInvoker;
import com.github.salilvnair.supportrouter.model.ReplySource;
import com.github.salilvnair.supportrouter.prompt.PromptComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Last resort before the fallback template. Only runs when nothing local answered, the session is
 * not escalated and the input guard let the message through. A failed call leaves the reply empty.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(EscalationStep.class)
public class RemoteModelStep implements CascadeStep {

    private final RemoteModelInvoker remoteModelInvoker;
    private final PromptComposer promptComposer;
    private final ReplySanitizer replySanitizer;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        String skipReason = skipReason(session);
        if (skipReason != null) {
            if (!session.hasReply()) {
                audit.audit(AuditStage.REMOTE_MODEL_SKIPPED, session.getSessionId(), Map.of("reason", skipReason));
            }
            return new StepResult.Continue();
        }
        if (!remoteModelInvoker.isAvailable()) {
            log.debug("No remote model client configured, falling back sessionId={}", session.getSessionId());
            session.setRemoteModelFailed(true);
            audit.audit(AuditStage.REMOTE_MODEL_SKIPPED, session.getSessionId(), Map.of("reason", "unavailable"));
            return new StepResult.Continue();
        }

        Map<String, String> facts = session.currentFacts();
        try {
            String prompt = promptComposer.compose(
                    session.getTenant(),
                    session.getMessage().text(),
                    facts,
                    session.getGroundingSnippets(),
                    session.getMessage().history(),
                    session.thresholds().historyWindow()
            );
            String raw = remoteModelInvoker.generate(
                    prompt,
                    String.join("\n", session.getGroundingSnippets()),
                    session.getMessage().history()
            );
            String reply = replySanitizer.sanitize(raw);
            if (reply.isEmpty()) {
                throw new RemoteModelException(
                        SupportRouterErrorCode.REMOTE_MODEL_INVALID_RESPONSE,
                        "Remote model reply was empty after sanitizing");
            }
            session.offerReply(reply, ReplySource.REMOTE_MODEL);
            audit.audit(AuditStage.REMOTE_MODEL_REPLY, session.getSessionId(), Map.of(
                    "grounded", !session.getGroundingSnippets().isEmpty(),
                    "replyLength", reply.length(),
                    "sanitized", !reply.equals(raw)
            ));
        }
        catch (RemoteModelException e) {
            log.warn("Remote model failed, using fallback sessionId={} tenant={} code={} msg={}",
                    session.getSessionId(), session.getTenant().tenantId(), e.getErrorCode(), e.getMessage());
            session.setRemoteModelFailed(true);
            audit.audit(AuditStage.REMOTE_MODEL_FAILED, session.getSessionId(), Map.of(
                    "errorCode", e.getErrorCode(),
                    "errorMessage", String.valueOf(e.getMessage())
            ));
        }
        return new StepResult.Continue();
    }

    private static String skipReason(RouterSession session) {
        if (session.hasReply()) {
            return "answered_locally";
        }
        if (session.isEscalated()) {
            return "escalated";
        }
        if (session.getGuardVerdict().flagged()) {
            return "input_flagged";
        }
        return null;
    }
}
