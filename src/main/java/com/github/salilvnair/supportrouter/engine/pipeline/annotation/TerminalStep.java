package com.github.salilvnair.supportrouter.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the single step that runs last and produces the result.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}
