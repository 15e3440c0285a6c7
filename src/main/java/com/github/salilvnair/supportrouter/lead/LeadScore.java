package com.github.salilvnair.supportrouter.lead;

/**
 * @param value         session lead score after this turn, never below the previous one
 * @param computed      score this turn earned on its own, bonus included
 * @param highValueHit  whether this turn contained booking, pricing or commit language
 */
public record LeadScore(int value, int computed, boolean highValueHit) {
}
