package com.github.salilvnair.supportrouter.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the single step that loads session state. Every other step runs after it.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SessionBootstrapStep {
}
