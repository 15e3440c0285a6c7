package com.github.salilvnair.supportrouter.knowledge.strategy;

import com.github.salilvnair.supportrouter.engine.exception.RemoteModelException;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeCatalog;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeEntry;
import com.github.salilvnair.supportrouter.llm.RemoteModelInvoker;
import com.github.salilvnair.supportrouter.tenant.CascadeThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Cosine similarity between the query embedding and precomputed entry embeddings.
 * Yields nothing when the catalog has no embeddings or no embedding client is configured.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SemanticLookupStrategy implements KnowledgeLookupStrategy {

    public static final String NAME = "semantic";

    private final RemoteModelInvoker remoteModelInvoker;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ScoredEntry> rank(String normalizedText, KnowledgeCatalog catalog, CascadeThresholds thresholds) {
        if (!catalog.hasEmbeddings() || !remoteModelInvoker.supportsEmbeddings()) {
            return List.of();
        }
        Optional<float[]> query;
        try {
            query = remoteModelInvoker.embed(normalizedText);
        }
        catch (RemoteModelException e) {
            log.warn("Embedding lookup skipped code={} msg={}", e.getErrorCode(), e.getMessage());
            return List.of();
        }
        if (query.isEmpty()) {
            return List.of();
        }
        List<ScoredEntry> scored = new ArrayList<>();
        for (KnowledgeEntry entry : catalog.entries()) {
            if (!entry.hasEmbedding() || entry.embedding().length != query.get().length) {
                continue;
            }
            double similarity = cosine(query.get(), entry.embedding());
            if (similarity >= thresholds.semanticThreshold()) {
                scored.add(new ScoredEntry(entry, Math.min(1.0, similarity)));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredEntry::score).reversed());
        return scored;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
