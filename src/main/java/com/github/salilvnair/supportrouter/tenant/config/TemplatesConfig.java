package com.github.salilvnair.supportrouter.tenant.config;

import com.github.salilvnair.supportrouter.tenant.ResponseTemplateKey;
import lombok.Getter;
import lombok.Setter;

/**
 * Optional reply overrides. Unset fields fall back to {@link ResponseTemplateKey#defaultTemplate()}.
 */
@Getter
@Setter
public class TemplatesConfig {
    private String greeting;
    private String gratitude;
    private String goodbye;
    private String contact;
    private String hours;
    private String howToReport;
    private String fireGas;
    private String waterLeak;
    private String lockout;
    private String powerFailure;
    private String fallback;
    private String escalation;
    private String escalatedSession;

    public String override(ResponseTemplateKey key) {
        return switch (key) {
            case GREETING -> greeting;
            case GRATITUDE -> gratitude;
            case GOODBYE -> goodbye;
            case CONTACT -> contact;
            case HOURS -> hours;
            case HOW_TO_REPORT -> howToReport;
            case FIRE_GAS -> fireGas;
            case WATER_LEAK -> waterLeak;
            case LOCKOUT -> lockout;
            case POWER_FAILURE -> powerFailure;
            case FALLBACK -> fallback;
            case ESCALATION -> escalation;
            case ESCALATED_SESSION -> escalatedSession;
        };
    }
}
