package com.github.salilvnair.supportrouter.knowledge;

import java.util.List;

/**
 * Read-only, per-tenant FAQ collection in configuration order.
 */
public final class KnowledgeCatalog {

    private static final KnowledgeCatalog EMPTY = new KnowledgeCatalog(List.of());

    private final List<KnowledgeEntry> entries;
    private final boolean hasEmbeddings;

    public KnowledgeCatalog(List<KnowledgeEntry> entries) {
        this.entries = List.copyOf(entries);
        this.hasEmbeddings = this.entries.stream().anyMatch(KnowledgeEntry::hasEmbedding);
    }

    public static KnowledgeCatalog empty() {
        return EMPTY;
    }

    public List<KnowledgeEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean hasEmbeddings() {
        return hasEmbeddings;
    }
}
