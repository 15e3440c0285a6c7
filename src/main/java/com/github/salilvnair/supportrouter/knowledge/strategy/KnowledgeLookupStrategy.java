package com.github.salilvnair.supportrouter.knowledge.strategy;

import com.github.salilvnair.supportrouter.knowledge.KnowledgeCatalog;
import com.github.salilvnair.supportrouter.tenant.CascadeThresholds;

import java.util.List;

public interface KnowledgeLookupStrategy {

    String name();

    /**
     * Entries above the strategy's own threshold, best first. Ties keep catalog order.
     */
    List<ScoredEntry> rank(String normalizedText, KnowledgeCatalog catalog, CascadeThresholds thresholds);
}
