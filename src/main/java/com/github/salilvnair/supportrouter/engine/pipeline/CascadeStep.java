package com.github.salilvnair.supportrouter.engine.pipeline;

import com.github.salilvnair.supportrouter.engine.session.RouterSession;

public interface CascadeStep {
    StepResult execute(RouterSession session);
}
