package com.github.salilvnair.supportrouter.knowledge;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one catalog search: the best entry and the grounding snippets, both taken from the
 * same ranking.
 *
 * @param best              top-ranked entry, or {@code null} when no strategy ranked anything
 * @param groundingSnippets resolved answers of the best-ranked entries, at most the grounding limit
 */
public record KnowledgeSearchResult(KnowledgeMatch best, List<String> groundingSnippets) {

    private static final KnowledgeSearchResult EMPTY = new KnowledgeSearchResult(null, List.of());

    public KnowledgeSearchResult {
        groundingSnippets = groundingSnippets == null ? List.of() : List.copyOf(groundingSnippets);
    }

    public static KnowledgeSearchResult empty() {
        return EMPTY;
    }

    public Optional<KnowledgeMatch> bestMatch() {
        return Optional.ofNullable(best);
    }
}
