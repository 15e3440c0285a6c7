package com.github.salilvnair.supportrouter.classifier;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Sentiment;
import com.github.salilvnair.supportrouter.model.TurnRecord;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword-weighted intent scoring over the message and its trailing user turns, plus an
 * independent sentiment pass.
 * <p>
 * The current message weighs 1.0 and the i-th earlier user turn {@code 0.5^i}. Confidence is the
 * winner's margin over the runner-up, scaled down when the winning score itself is weak.
 */
@Component
@RequiredArgsConstructor
public class IntentSentimentClassifier {

    private static final double DECAY = 0.5d;
    private static final double FULL_STRENGTH_SCORE = 2.0d;

    private final SentimentAnalyzer sentimentAnalyzer;

    public Classification classify(String text, List<TurnRecord> history, int historyWindow, Sentiment previousSentiment) {
        Map<Intent, Double> scores = scoreIntents(text, history, historyWindow);

        Intent best = Intent.UNKNOWN;
        double bestScore = 0;
        double runnerUp = 0;
        for (Map.Entry<Intent, Double> entry : scores.entrySet()) {
            double score = entry.getValue();
            if (score > bestScore) {
                runnerUp = bestScore;
                bestScore = score;
                best = entry.getKey();
            }
            else if (score > runnerUp) {
                runnerUp = score;
            }
        }

        double confidence = 0;
        if (bestScore > 0) {
            double margin = (bestScore - runnerUp) / bestScore;
            double strength = Math.min(1.0, bestScore / FULL_STRENGTH_SCORE);
            confidence = round(margin * strength);
        }

        Sentiment raw = sentimentAnalyzer.analyze(text);
        Sentiment smoothed = raw.smoothedAgainst(previousSentiment);
        return new Classification(best, confidence, smoothed, raw);
    }

    Map<Intent, Double> scoreIntents(String text, List<TurnRecord> history, int historyWindow) {
        List<String> window = new ArrayList<>();
        window.add(TextNormalizer.normalize(text));
        if (history != null) {
            for (int i = history.size() - 1; i >= 0 && window.size() <= historyWindow; i--) {
                TurnRecord turn = history.get(i);
                if (turn != null && turn.isUser()) {
                    window.add(TextNormalizer.normalize(turn.text()));
                }
            }
        }

        // EnumMap iterates in declaration order, which breaks score ties deterministically
        Map<Intent, Double> scores = new EnumMap<>(Intent.class);
        for (Map.Entry<Intent, List<IntentLexicon.WeightedTerm>> entry : IntentLexicon.terms().entrySet()) {
            double total = 0;
            double weight = 1.0;
            for (String turnText : window) {
                for (IntentLexicon.WeightedTerm term : entry.getValue()) {
                    if (term.pattern().matcher(turnText).find()) {
                        total += weight * term.weight();
                    }
                }
                weight *= DECAY;
            }
            if (total > 0) {
                scores.put(entry.getKey(), total);
            }
        }
        return scores;
    }

    private static double round(double value) {
        return Math.round(value * 1000d) / 1000d;
    }
}
