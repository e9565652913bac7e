package com.ai.consultas.telegram.bot;

import com.ai.consultas.telegram.config.TelegramBotProperties;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/**
 * Starts and stops update delivery: a long-polling session, or webhook
 * registration with Telegram.
 */
public class TelegramBotLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotLifecycle.class);

    private final TelegramBotProperties properties;
    private final TelegramLongPollingBotAdapter pollingBot;
    private final TelegramWebhookBotAdapter webhookBot;

    private BotSession botSession;
    private volatile boolean running;

    private TelegramBotLifecycle(TelegramBotProperties properties,
                                 TelegramLongPollingBotAdapter pollingBot,
                                 TelegramWebhookBotAdapter webhookBot) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.pollingBot = pollingBot;
        this.webhookBot = webhookBot;
    }

    public static TelegramBotLifecycle forPolling(TelegramBotProperties properties,
                                                  TelegramLongPollingBotAdapter pollingBot) {
        return new TelegramBotLifecycle(properties, Objects.requireNonNull(pollingBot, "pollingBot"), null);
    }

    public static TelegramBotLifecycle forWebhook(TelegramBotProperties properties,
                                                  TelegramWebhookBotAdapter webhookBot) {
        return new TelegramBotLifecycle(properties, null, Objects.requireNonNull(webhookBot, "webhookBot"));
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            if (pollingBot != null) {
                TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
                botSession = botsApi.registerBot(pollingBot);
                log.info("Telegram long polling started for @{}", pollingBot.getBotUsername());
            } else {
                registerWebhook();
                log.info("Telegram webhook registered at {}", resolveWebhookUrl());
            }
            running = true;
        } catch (TelegramApiException ex) {
            throw new IllegalStateException("Failed to register Telegram bot", ex);
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (botSession != null) {
                botSession.stop();
                botSession = null;
            } else {
                webhookBot.execute(new DeleteWebhook());
            }
            log.info("Telegram transport stopped");
        } catch (TelegramApiException ex) {
            log.warn("Failed to delete Telegram webhook: {}", ex.getMessage());
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void registerWebhook() throws TelegramApiException {
        String webhookUrl = resolveWebhookUrl();
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalStateException("Webhook URL must be configured (app.telegram.webhook.external-url)");
        }

        SetWebhook.SetWebhookBuilder builder = SetWebhook.builder().url(webhookUrl);

        List<String> allowedUpdates = properties.getAllowedUpdates();
        if (allowedUpdates != null && !allowedUpdates.isEmpty()) {
            builder.allowedUpdates(List.copyOf(allowedUpdates));
        }

        String secretToken = properties.getWebhook().getSecretToken();
        if (StringUtils.isNotBlank(secretToken)) {
            builder.secretToken(secretToken);
        }

        webhookBot.setWebhook(builder.build());
    }

    String resolveWebhookUrl() {
        String externalUrl = properties.getWebhook().getExternalUrl();
        String path = properties.getWebhook().getPath();
        if (StringUtils.isBlank(externalUrl)) {
            return null;
        }
        if (StringUtils.isBlank(path)) {
            return externalUrl;
        }
        if (externalUrl.endsWith("/")) {
            return path.startsWith("/") ? externalUrl + path.substring(1) : externalUrl + path;
        }
        return path.startsWith("/") ? externalUrl + path : externalUrl + '/' + path;
    }
}
