package com.github.salilvnair.supportrouter.knowledge;

import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.tenant.TenantProfile;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {name}} placeholders with tenant profile values in a single pass.
 * Substituted values are never scanned again, so a value containing braces stays literal.
 */
public final class PlaceholderResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final Map<String, String> values;

    public PlaceholderResolver(TenantProfile profile) {
        this.values = Map.copyOf(profile.placeholders());
    }

    public static Set<String> placeholdersIn(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Rejects templates that reference a placeholder the profile does not define or leaves blank.
     *
     * @param template the template text
     * @param origin   where the template came from, used in the error message
     */
    public void validate(String template, String origin) {
        validateKnown(template, origin);
        for (String name : placeholdersIn(template)) {
            if (values.get(name).isEmpty()) {
                throw new TenantConfigurationException(
                        SupportRouterErrorCode.TENANT_CONFIG_INVALID,
                        origin + " references {" + name + "} but the tenant profile leaves it empty"
                );
            }
        }
    }

    /**
     * Rejects only unknown placeholders. Used for the built-in reply defaults, where a blank profile
     * field is allowed.
     */
    public void validateKnown(String template, String origin) {
        for (String name : placeholdersIn(template)) {
            if (!values.containsKey(name)) {
                throw new TenantConfigurationException(
                        SupportRouterErrorCode.UNKNOWN_PLACEHOLDER,
                        origin + " references unknown placeholder {" + name + "}"
                );
            }
        }
    }

    public String resolve(String template) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 32);
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                throw new TenantConfigurationException(
                        SupportRouterErrorCode.UNKNOWN_PLACEHOLDER,
                        "Unknown placeholder {" + name + "}"
                );
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
