package com.github.salilvnair.supportrouter.engine.pipeline;

import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterException;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.model.RouterResult;

import java.util.List;

public final class CascadePipeline {

    private final List<CascadeStep> steps;

    public CascadePipeline(List<CascadeStep> steps) {
        this.steps = steps;
    }

    public RouterResult execute(RouterSession session) {
        for (CascadeStep step : steps) {
            StepResult r = step.execute(session);
            if (r instanceof StepResult.Stop stop) {
                return stop.result();
            }
        }
        // CommitSessionStep must have set the result
        if (session.getResult() == null) {
            throw new SupportRouterException(
                    SupportRouterErrorCode.PIPELINE_NO_FINAL_RESULT
            );
        }
        return session.getResult();
    }

    public List<CascadeStep> steps() {
        return steps;
    }
}
