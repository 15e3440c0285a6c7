package com.github.salilvnair.supportrouter.engine.steps;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.audit.AuditStage;
import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;
import com.github.salilvnair.supportrouter.engine.pipeline.StepResult;
import com.github.salilvnair.supportrouter.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeCatalogService;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeMatch;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeSearchResult;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.ReplySource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers from the catalog when the best entry clears the confidence floor. Weaker matches are
 * kept as grounding for the remote model.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(PatternMatchStep.class)
public class KnowledgeLookupStep implements CascadeStep {

    private final KnowledgeCatalogService knowledgeCatalogService;
    private final AuditService audit;

    @Override
    public StepResult execute(RouterSession session) {
        if (session.hasReply() || session.isAlreadyEscalated()) {
            return new StepResult.Continue();
        }
        KnowledgeSearchResult search = knowledgeCatalogService.search(session.getMessage().text(), session.getTenant());
        Optional<KnowledgeMatch> match = search.bestMatch();
        if (match.isPresent() && match.get().score() >= session.thresholds().confidenceFloor()) {
            KnowledgeMatch knowledgeMatch = match.get();
            session.setKnowledgeMatch(knowledgeMatch);
            session.offerReply(knowledgeMatch.resolvedAnswer(), ReplySource.KNOWLEDGE);
            session.setConfidence(Math.max(session.getConfidence(), knowledgeMatch.score()));
            if (session.getIntent() == Intent.UNKNOWN) {
                session.setIntent(Intent.GENERAL_INFO);
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("entryId", knowledgeMatch.entry().id());
            payload.put("score", knowledgeMatch.score());
            payload.put("strategy", knowledgeMatch.strategy());
            audit.audit(AuditStage.KNOWLEDGE_MATCHED, session.getSessionId(), payload);
            return new StepResult.Continue();
        }

        List<String> grounding = search.groundingSnippets();
        session.setGroundingSnippets(grounding);
        if (!grounding.isEmpty()) {
            audit.audit(AuditStage.KNOWLEDGE_GROUNDING, session.getSessionId(), Map.of("snippets", grounding.size()));
        }
        return new StepResult.Continue();
    }
}
