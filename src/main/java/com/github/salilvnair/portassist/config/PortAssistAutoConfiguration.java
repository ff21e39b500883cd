package com.github.salilvnair.portassist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;
import java.time.ZoneId;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ComponentScan(basePackages = "com.github.salilvnair.portassist")
public class PortAssistAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock portAssistClock(PortAssistConfig config) {
        return Clock.system(ZoneId.of(config.getZoneId()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper portAssistObjectMapper() {
        return new ObjectMapper();
    }
}
