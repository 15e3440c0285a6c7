package com.github.salilvnair.supportrouter.knowledge;

/**
 * @param resolvedAnswer the entry's answer with every placeholder substituted
 * @param strategy       name of the lookup strategy that produced the match
 */
public record KnowledgeMatch(KnowledgeEntry entry, double score, String resolvedAnswer, String strategy) {
}
