package com.github.salilvnair.portassist.annotation;

import com.github.salilvnair.portassist.config.PortAssistAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PortAssistAutoConfiguration.class)
public @interface EnablePortAssist {
}
