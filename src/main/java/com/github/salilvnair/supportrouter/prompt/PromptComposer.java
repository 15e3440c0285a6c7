package com.github.salilvnair.supportrouter.prompt;

import com.github.salilvnair.supportrouter.engine.exception.RemoteModelException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.model.TurnRecord;
import com.github.salilvnair.supportrouter.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.supportrouter.tenant.TenantProfile;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the system prompt for the remote model from the tenant profile, known facts, grounding
 * snippets and recent history. Without grounding the prompt tells the model to defer to staff
 * instead of answering from its own knowledge.
 */
@Component
public class PromptComposer {

    static final String TEMPLATE_LOCATION = "supportrouter/prompts/remote-model.txt";

    private final ThymeleafTemplateRenderer renderer;
    private final String template;

    public PromptComposer(ThymeleafTemplateRenderer renderer) {
        this.renderer = renderer;
        this.template = loadTemplate();
    }

    public String compose(TenantRuntime tenant,
                          String message,
                          Map<String, String> knownFacts,
                          List<String> grounding,
                          List<TurnRecord> history,
                          int historyWindow) {
        TenantProfile profile = tenant.profile();
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("companyName", profile.companyName());
        vars.put("toneStyle", profile.toneStyle() == null ? "" : profile.toneStyle());
        vars.put("phone", profile.phone());
        vars.put("email", profile.email());
        vars.put("profileLines", profileLines(profile));
        vars.put("factLines", knownFacts.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .toList());
        vars.put("hasGrounding", !grounding.isEmpty());
        vars.put("groundingLines", grounding);
        vars.put("historyLines", historyLines(history, historyWindow));
        vars.put("message", message);
        try {
            return renderer.render(template, vars).trim();
        }
        catch (RuntimeException e) {
            throw new RemoteModelException(
                    SupportRouterErrorCode.PROMPT_RENDER_FAILED,
                    "Failed to render remote model prompt: " + e.getMessage(), e);
        }
    }

    private static List<String> profileLines(TenantProfile profile) {
        List<String> lines = new ArrayList<>();
        addLine(lines, "Företag", profile.companyName());
        addLine(lines, "Telefon", profile.phone());
        addLine(lines, "Jourtelefon", profile.effectiveEmergencyPhone());
        addLine(lines, "E-post", profile.email());
        addLine(lines, "Webbplats", profile.website());
        addLine(lines, "Orter", profile.locations());
        addLine(lines, "Öppettider", profile.businessHours());
        addLine(lines, "Svarstid", profile.responseTime());
        addLine(lines, "Tjänster", profile.services());
        addLine(lines, "Priser", profile.pricing());
        addLine(lines, "Bokning", profile.bookingLink());
        return lines;
    }

    private static void addLine(List<String> lines, String label, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(label + ": " + value.trim());
        }
    }

    private static List<String> historyLines(List<TurnRecord> history, int window) {
        if (history == null || history.isEmpty() || window <= 0) {
            return List.of();
        }
        List<TurnRecord> tail = history.subList(Math.max(0, history.size() - window), history.size());
        return tail.stream()
                .map(t -> (t.isUser() ? "Kund: " : "Assistent: ") + t.text())
                .toList();
    }

    private static String loadTemplate() {
        ClassPathResource resource = new ClassPathResource(TEMPLATE_LOCATION);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Missing prompt template " + TEMPLATE_LOCATION, e);
        }
    }
}
