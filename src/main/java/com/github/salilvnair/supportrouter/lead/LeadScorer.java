package com.github.salilvnair.supportrouter.lead;

import com.github.salilvnair.supportrouter.memory.SessionSnapshot;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.tenant.CascadeThresholds;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import org.springframework.stereotype.Component;

/**
 * Monotonic 1-5 purchase-intent score. The returned value is {@code max(previous, computed)}.
 * Crossing the notify threshold is reported by the caller, the scorer has no side effects.
 */
@Component
public class LeadScorer {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    public LeadScore score(String text, SessionSnapshot session, Intent intent, int patternHint, CascadeThresholds thresholds) {
        String normalized = TextNormalizer.normalize(text);
        int band = LeadTriggerTable.band(normalized);
        boolean highValueHit = band >= LeadTriggerTable.HIGH_VALUE_BAND;

        int computed = Math.max(band, Math.max(intentBand(intent), patternHint));
        int hits = session.highValueHits() + (highValueHit ? 1 : 0);
        if (highValueHit && hits >= thresholds.repeatBonusHits()) {
            computed += 1;
        }
        computed = clamp(computed);

        int previous = clamp(session.leadScore());
        return new LeadScore(Math.max(previous, computed), computed, highValueHit);
    }

    public boolean crossesNotifyThreshold(int previous, int current, CascadeThresholds thresholds) {
        int threshold = thresholds.leadNotifyThreshold();
        return previous < threshold && current >= threshold;
    }

    private static int intentBand(Intent intent) {
        if (intent == null) {
            return MIN_SCORE;
        }
        return switch (intent) {
            case PRICING_QUESTION, BOOKING_REQUEST -> 4;
            case RENTAL_INQUIRY -> 3;
            case GENERAL_INFO -> 2;
            default -> MIN_SCORE;
        };
    }

    private static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
