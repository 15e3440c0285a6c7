package com.github.salilvnair.supportrouter.engine.pipeline.annotation;

import com.github.salilvnair.supportrouter.engine.pipeline.CascadeStep;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunAfter {
    Class<? extends CascadeStep>[] value();
}
