package com.github.salilvnair.supportrouter.engine.pipeline;

import com.github.salilvnair.supportrouter.model.RouterResult;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(RouterResult result) implements StepResult {}
}
