package com.github.salilvnair.supportrouter.escalation;

import com.github.salilvnair.supportrouter.model.Sentiment;
import com.github.salilvnair.supportrouter.util.KeywordMatcher;

/**
 * Conjunction of the configured conditions. Unset conditions are ignored, but at least one
 * must be set.
 *
 * @param sentimentTurns     consecutive turns the sentiment condition must hold for
 * @param turnCountThreshold fires when the turn count is strictly greater
 * @param leadScoreThreshold fires when the lead score is greater or equal
 */
public record RuleTrigger(
        KeywordMatcher keywords,
        Sentiment sentimentThreshold,
        int sentimentTurns,
        Integer turnCountThreshold,
        Integer leadScoreThreshold,
        String explicitCategory
) {

    public RuleTrigger {
        keywords = keywords == null ? KeywordMatcher.of(null) : keywords;
        sentimentTurns = Math.max(1, sentimentTurns);
    }

    public boolean hasAnyCondition() {
        return !keywords.isEmpty()
                || sentimentThreshold != null
                || turnCountThreshold != null
                || leadScoreThreshold != null
                || explicitCategory != null;
    }

    public boolean matches(EscalationContext context) {
        if (!hasAnyCondition()) {
            return false;
        }
        if (!keywords.isEmpty() && !keywords.matches(context.normalizedText())) {
            return false;
        }
        if (sentimentThreshold != null && context.turnsAtOrAbove(sentimentThreshold) < sentimentTurns) {
            return false;
        }
        if (turnCountThreshold != null && context.turnCount() <= turnCountThreshold) {
            return false;
        }
        if (leadScoreThreshold != null && context.leadScore() < leadScoreThreshold) {
            return false;
        }
        return explicitCategory == null || context.categories().contains(explicitCategory);
    }
}
