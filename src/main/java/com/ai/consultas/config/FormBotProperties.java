package com.ai.consultas.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Settings of the form-filling conversation core ({@code app.form.*}).
 */
@Validated
@ConfigurationProperties(prefix = "app.form")
public class FormBotProperties {

    /** Hex SHA-256 digest of the shared secret users must send after /auth. */
    @NotBlank
    private String authHash;

    @Min(1)
    private int pageSize = 5;

    /** Offset of the zone the date wheel starts from, e.g. -04:00. */
    @NotBlank
    private String timezoneOffset = "-04:00";

    /** Language tag used for month labels on the date wheel. */
    @NotBlank
    private String locale = "es";

    @NotNull
    private Duration drainInterval = Duration.ofSeconds(5);

    public String getAuthHash() {
        return authHash;
    }

    public void setAuthHash(String authHash) {
        this.authHash = authHash;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public String getTimezoneOffset() {
        return timezoneOffset;
    }

    public void setTimezoneOffset(String timezoneOffset) {
        this.timezoneOffset = timezoneOffset;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public Duration getDrainInterval() {
        return drainInterval;
    }

    public void setDrainInterval(Duration drainInterval) {
        this.drainInterval = drainInterval;
    }
}
