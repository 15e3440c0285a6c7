package com.github.salilvnair.supportrouter.engine.model;

import lombok.*;

@Getter
@AllArgsConstructor
public class StepTiming {
    private final String stepName;
    private final long durationMs;
    private final boolean success;
    private final String error;
}
