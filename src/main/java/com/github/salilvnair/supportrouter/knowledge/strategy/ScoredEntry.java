package com.github.salilvnair.supportrouter.knowledge.strategy;

import com.github.salilvnair.supportrouter.knowledge.KnowledgeEntry;

public record ScoredEntry(KnowledgeEntry entry, double score) {
}
