package com.github.salilvnair.supportrouter.tenant.config;

import com.github.salilvnair.supportrouter.escalation.RulePriority;
import com.github.salilvnair.supportrouter.model.Sentiment;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class EscalationRuleConfig {
    private String name;
    private List<String> keywords = new ArrayList<>();
    private Sentiment sentimentThreshold;
    private int sentimentTurns = 1;
    private Integer turnCountThreshold;
    private Integer leadScoreThreshold;
    private String explicitCategory;
    private RulePriority priority = RulePriority.MEDIUM;
    private boolean autoEscalate = true;
    private List<String> notifyTargets = new ArrayList<>();
    private String responseTemplate;
}
