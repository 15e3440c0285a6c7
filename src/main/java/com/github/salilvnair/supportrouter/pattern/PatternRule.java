package com.github.salilvnair.supportrouter.pattern;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.tenant.ResponseTemplateKey;

import java.util.regex.Pattern;

/**
 * Uncompiled pattern declaration. Becomes a {@link MatchResult} template once the tenant's
 * reply texts are known.
 */
public record PatternRule(
        String category,
        Intent intent,
        String regex,
        ResponseTemplateKey template,
        double confidence,
        int leadScoreHint,
        Urgency urgency
) {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    Pattern compile() {
        return Pattern.compile(regex, FLAGS);
    }
}
