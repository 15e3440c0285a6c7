package com.github.salilvnair.supportrouter.guard;

import com.github.salilvnair.supportrouter.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flags messages that try to steer the remote model. Flagged messages may still be answered
 * locally but are never forwarded.
 */
@Component
public class InputGuard {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Map<String, Pattern> INJECTION_PATTERNS = build();

    public GuardVerdict inspect(String text) {
        String normalized = TextNormalizer.normalize(text);
        for (Map.Entry<String, Pattern> entry : INJECTION_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(normalized).find()) {
                return GuardVerdict.flagged(entry.getKey());
            }
        }
        return GuardVerdict.clean();
    }

    private static Map<String, Pattern> build() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("ignore_instructions", Pattern.compile(
                "(ignore|disregard|forget) (all |any )?(the )?(previous|prior|above|earlier) (instructions|rules|prompts?)"
                        + "|(ignorera|glöm) (alla )?(tidigare|föregående|ovanstående) (instruktioner|regler)", FLAGS));
        patterns.put("role_override", Pattern.compile(
                "\\b(you are now|from now on you are|act as|pretend (to be|you are)|du är nu|låtsas att du är|agera som)\\b", FLAGS));
        patterns.put("prompt_extraction", Pattern.compile(
                "(system ?prompt|your instructions|dina instruktioner|reveal your|visa din prompt)", FLAGS));
        patterns.put("jailbreak", Pattern.compile("\\b(jailbreak|dan mode|developer mode)\\b", FLAGS));
        patterns.put("control_tokens", Pattern.compile("(<\\|[a-z_]+\\|>|\\[/?inst]|<</?sys>>)", FLAGS));
        return Collections.unmodifiableMap(patterns);
    }
}
