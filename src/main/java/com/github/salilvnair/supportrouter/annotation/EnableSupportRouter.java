package com.github.salilvnair.supportrouter.annotation;

import com.github.salilvnair.supportrouter.config.SupportRouterAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(SupportRouterAutoConfiguration.class)
public @interface EnableSupportRouter {
}
