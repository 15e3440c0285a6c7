package com.github.salilvnair.supportrouter.pattern;

import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.util.TextNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Compiled, immutable pattern table for one tenant. Rules are tried in declaration order and the
 * first match wins. Unmatched input is a normal outcome, never an error.
 */
public final class PatternMatcher {

    private final List<CompiledRule> rules;
    private final int inputLimit;

    private PatternMatcher(List<CompiledRule> rules, int inputLimit) {
        this.rules = rules;
        this.inputLimit = inputLimit;
    }

    /**
     * @param rules        declarations in evaluation order
     * @param replyFor     resolves a rule's reply text
     * @param inputLimit   number of input characters looked at
     */
    public static PatternMatcher compile(List<PatternRule> rules,
                                         Function<PatternRule, String> replyFor,
                                         int inputLimit) {
        Set<String> categories = new HashSet<>();
        List<CompiledRule> compiled = new ArrayList<>(rules.size());
        for (PatternRule rule : rules) {
            if (!categories.add(rule.category())) {
                throw new TenantConfigurationException(
                        SupportRouterErrorCode.DUPLICATE_PATTERN_CATEGORY,
                        "Pattern category declared twice: " + rule.category()
                );
            }
            MatchResult result = new MatchResult(
                    rule.category(),
                    rule.intent(),
                    replyFor.apply(rule),
                    rule.confidence(),
                    rule.leadScoreHint(),
                    rule.urgency()
            );
            compiled.add(new CompiledRule(rule.compile(), result));
        }
        return new PatternMatcher(List.copyOf(compiled), inputLimit);
    }

    public Optional<MatchResult> match(String text) {
        String normalized = TextNormalizer.normalize(text, inputLimit);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (CompiledRule rule : rules) {
            if (rule.pattern().matcher(normalized).find()) {
                return Optional.of(rule.result());
            }
        }
        return Optional.empty();
    }

    public List<String> categories() {
        return rules.stream().map(r -> r.result().category()).toList();
    }

    private record CompiledRule(Pattern pattern, MatchResult result) {
    }
}
