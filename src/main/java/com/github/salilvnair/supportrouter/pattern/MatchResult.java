package com.github.salilvnair.supportrouter.pattern;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Urgency;

/**
 * @param category         pattern category, unique within a table
 * @param intent           intent the category implies
 * @param responseTemplate reply text with tenant placeholders already resolved
 * @param confidence       fixed confidence of the rule
 * @param leadScoreHint    minimum lead score this category implies
 * @param urgency          {@link Urgency#NONE} unless the category is an emergency
 */
public record MatchResult(
        String category,
        Intent intent,
        String responseTemplate,
        double confidence,
        int leadScoreHint,
        Urgency urgency
) {

    public boolean isEmergency() {
        return urgency.isUrgent();
    }
}
