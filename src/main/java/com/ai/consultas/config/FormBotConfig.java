package com.ai.consultas.config;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Locale;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FormBotProperties.class)
public class FormBotConfig {

    /**
     * Clock in the fixed offset the date wheel uses for "now".
     */
    @Bean
    public Clock formClock(FormBotProperties properties) {
        return Clock.system(ZoneOffset.of(properties.getTimezoneOffset()));
    }

    @Bean
    public Locale formLocale(FormBotProperties properties) {
        return Locale.forLanguageTag(properties.getLocale());
    }
}
