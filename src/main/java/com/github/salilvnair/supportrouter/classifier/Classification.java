package com.github.salilvnair.supportrouter.classifier;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Sentiment;

/**
 * @param rawSentiment sentiment of this message alone, before smoothing against the previous turn
 */
public record Classification(Intent intent, double confidence, Sentiment sentiment, Sentiment rawSentiment) {
}
