package com.github.salilvnair.supportrouter.knowledge;

import java.util.Set;

/**
 * One FAQ entry. {@code embedding} is optional and only used by semantic lookup.
 */
public record KnowledgeEntry(
        String id,
        String questionText,
        String answerTemplate,
        Set<String> keywords,
        float[] embedding
) {

    public KnowledgeEntry {
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
