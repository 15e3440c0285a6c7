package com.github.salilvnair.supportrouter.knowledge;

import com.github.salilvnair.supportrouter.knowledge.strategy.KnowledgeLookupStrategy;
import com.github.salilvnair.supportrouter.knowledge.strategy.ScoredEntry;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Looks a message up in the tenant's catalog. Strategies are tried in {@code @Order}; the first
 * one that returns anything decides. Answers leave this class with placeholders resolved.
 */
@Component
@RequiredArgsConstructor
public class KnowledgeCatalogService {

    private final List<KnowledgeLookupStrategy> strategies;

    /**
     * Ranks the catalog once and derives both the best match and the grounding snippets from
     * that ranking, so each strategy (and any embedding call behind it) runs at most once.
     */
    public KnowledgeSearchResult search(String text, TenantRuntime tenant) {
        KnowledgeCatalog catalog = tenant.catalog();
        if (catalog == null || catalog.isEmpty()) {
            return KnowledgeSearchResult.empty();
        }
        String normalized = TextNormalizer.normalize(text);
        for (KnowledgeLookupStrategy strategy : strategies) {
            List<ScoredEntry> ranked = strategy.rank(normalized, catalog, tenant.thresholds());
            if (!ranked.isEmpty()) {
                return new KnowledgeSearchResult(
                        toMatch(ranked.get(0), strategy.name(), tenant),
                        grounding(ranked, tenant)
                );
            }
        }
        return KnowledgeSearchResult.empty();
    }

    public Optional<KnowledgeMatch> lookup(String text, TenantRuntime tenant) {
        return search(text, tenant).bestMatch();
    }

    /**
     * Resolved answers of the best-ranked entries, used as grounding for the remote model.
     */
    public List<String> groundingSnippets(String text, TenantRuntime tenant) {
        return search(text, tenant).groundingSnippets();
    }

    private static List<String> grounding(List<ScoredEntry> ranked, TenantRuntime tenant) {
        int limit = tenant.thresholds().groundingLimit();
        Set<String> snippets = new LinkedHashSet<>();
        for (ScoredEntry scored : ranked) {
            if (snippets.size() >= limit) {
                break;
            }
            snippets.add(tenant.placeholders().resolve(scored.entry().answerTemplate()));
        }
        return List.copyOf(snippets);
    }

    private static KnowledgeMatch toMatch(ScoredEntry scored, String strategy, TenantRuntime tenant) {
        String answer = tenant.placeholders().resolve(scored.entry().answerTemplate());
        return new KnowledgeMatch(scored.entry(), scored.score(), answer, strategy);
    }
}
