package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.classifier.Classification;
import com.github.salilvnair.supportrouter.classifier.IntentSentimentClassifier;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.model.Sentiment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs before the pattern step so that every turn carries a sentiment and the streak counters the
 * escalation rules need, even when a canned reply ends up answering it.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(InputGuardStep.class)
public class ClassificationStep implements CascadeStep {

    private final IntentSentimentClassifier classifier;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        SessionSnapshot snapshot = session.getSnapshot();
        Classification classification = classifier.classify(
                session.getMessage().text(),
                session.getMessage().history(),
                session.thresholds().historyWindow(),
                snapshot.lastSentiment()
        );
        session.setClassification(classification);
        session.setIntent(classification.intent());
        session.setConfidence(classification.confidence());
        session.setSentiment(classification.sentiment());

        Sentiment sentiment = classification.sentiment();
        session.setConsecutiveAngryTurns(sentiment == Sentiment.ANGRY
                ? snapshot.consecutiveAngryTurns() + 1 : 0);
        session.setConsecutiveFrustratedTurns(sentiment.isAtLeast(Sentiment.FRUSTRATED)
                ? snapshot.consecutiveFrustratedTurns() + 1 : 0);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("intent", classification.intent().wireValue());
        payload.put("confidence", classification.confidence());
        payload.put("sentiment", sentiment.wireValue());
        payload.put("rawSentiment", classification.rawSentiment().wireValue());
        payload.put("consecutiveAngryTurns", session.getConsecutiveAngryTurns());
        audit.audit(AuditStage.MESSAGE_CLASSIFIED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }
}
