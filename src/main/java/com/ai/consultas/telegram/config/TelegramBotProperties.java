package com.ai.consultas.telegram.config;

import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.telegram")
public class TelegramBotProperties {

    public enum Mode {
        POLLING,
        WEBHOOK
    }

    private boolean enabled;

    @NotNull
    private Mode mode = Mode.POLLING;

    @NotNull
    private final Credentials bot = new Credentials();

    @NotNull
    private final Webhook webhook = new Webhook();

    private final List<String> allowedUpdates = new ArrayList<>(List.of("message", "callback_query"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Credentials getBot() {
        return bot;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public List<String> getAllowedUpdates() {
        return allowedUpdates;
    }

    public static class Credentials {

        private String token;

        private String username;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }
    }

    public static class Webhook {

        private String externalUrl;

        private String path = "/telegram/update";

        private String secretToken;

        public String getExternalUrl() {
            return externalUrl;
        }

        public void setExternalUrl(String externalUrl) {
            this.externalUrl = externalUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getSecretToken() {
            return secretToken;
        }

        public void setSecretToken(String secretToken) {
            this.secretToken = secretToken;
        }
    }
}
