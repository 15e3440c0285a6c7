package com.github.salilvnair.supportrouter.tenant.config;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class KnowledgeEntryConfig {
    private String id;
    private String question;
    private String answer;
    private List<String> keywords = new ArrayList<>();
    private float[] embedding;
}
