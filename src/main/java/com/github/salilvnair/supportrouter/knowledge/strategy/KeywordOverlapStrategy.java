package com.github.salilvnair.supportrouter.knowledge.strategy;

import com.github.salilvnair.supportrouter.knowledge.KnowledgeCatalog;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeEntry;
import com.github.salilvnair.supportrouter.tenant.CascadeThresholds;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores an entry by the fraction of its keywords found as substrings of the input.
 * An input equal to the entry's question scores 1.0.
 */
@Component
@Order(2)
public class KeywordOverlapStrategy implements KnowledgeLookupStrategy {

    public static final String NAME = "keyword";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ScoredEntry> rank(String normalizedText, KnowledgeCatalog catalog, CascadeThresholds thresholds) {
        if (normalizedText == null || normalizedText.isEmpty() || catalog.isEmpty()) {
            return List.of();
        }
        List<ScoredEntry> scored = new ArrayList<>();
        for (KnowledgeEntry entry : catalog.entries()) {
            double score = score(normalizedText, entry);
            if (score > 0 && score >= thresholds.minKeywordOverlap()) {
                scored.add(new ScoredEntry(entry, score));
            }
        }
        // List.sort is stable, so equal scores keep catalog order
        scored.sort(Comparator.comparingDouble(ScoredEntry::score).reversed());
        return scored;
    }

    double score(String normalizedText, KnowledgeEntry entry) {
        if (entry.questionText() != null
                && stripPunctuation(TextNormalizer.normalize(entry.questionText())).equals(stripPunctuation(normalizedText))) {
            return 1.0;
        }
        if (entry.keywords().isEmpty()) {
            return 0.0;
        }
        long hits = entry.keywords().stream()
                .map(TextNormalizer::normalize)
                .filter(k -> !k.isEmpty() && normalizedText.contains(k))
                .count();
        return (double) hits / entry.keywords().size();
    }

    private static String stripPunctuation(String text) {
        return text.replaceAll("[\\p{Punct}]+$", "").trim();
    }
}
