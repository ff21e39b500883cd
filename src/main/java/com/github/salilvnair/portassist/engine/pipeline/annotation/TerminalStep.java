package com.github.salilvnair.portassist.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the one step that always runs last and produces the response.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}
