package com.ai.consultas.telegram.config;

import com.ai.consultas.telegram.bot.TelegramBotLifecycle;
import com.ai.consultas.telegram.bot.TelegramLongPollingBotAdapter;
import com.ai.consultas.telegram.bot.TelegramWebhookBotAdapter;
import com.ai.consultas.telegram.service.TelegramUpdateHandler;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.bots.DefaultBotOptions;

import java.util.List;

/**
 * Telegram transport wiring. Long polling by default; {@code app.telegram.mode=webhook}
 * switches to the webhook adapter served by {@code TelegramWebhookController}.
 */
@Configuration
@EnableConfigurationProperties(TelegramBotProperties.class)
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
public class TelegramBotConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DefaultBotOptions telegramBotOptions(TelegramBotProperties properties) {
        if (StringUtils.isBlank(properties.getBot().getToken())) {
            throw new IllegalStateException("Telegram bot token must be configured (app.telegram.bot.token)");
        }
        DefaultBotOptions options = new DefaultBotOptions();
        List<String> allowedUpdates = properties.getAllowedUpdates();
        if (!allowedUpdates.isEmpty()) {
            options.setAllowedUpdates(List.copyOf(allowedUpdates));
        }
        return options;
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.telegram", name = "mode", havingValue = "polling", matchIfMissing = true)
    public TelegramLongPollingBotAdapter telegramLongPollingBotAdapter(
            DefaultBotOptions telegramBotOptions,
            TelegramBotProperties properties,
            TelegramUpdateHandler updateHandler) {
        return new TelegramLongPollingBotAdapter(telegramBotOptions, properties, updateHandler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.telegram", name = "mode", havingValue = "polling", matchIfMissing = true)
    public TelegramBotLifecycle telegramPollingLifecycle(
            TelegramBotProperties properties,
            TelegramLongPollingBotAdapter longPollingBot) {
        return TelegramBotLifecycle.forPolling(properties, longPollingBot);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.telegram", name = "mode", havingValue = "webhook")
    public TelegramWebhookBotAdapter telegramWebhookBotAdapter(
            DefaultBotOptions telegramBotOptions,
            TelegramBotProperties properties,
            TelegramUpdateHandler updateHandler) {
        return new TelegramWebhookBotAdapter(telegramBotOptions, properties, updateHandler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.telegram", name = "mode", havingValue = "webhook")
    public TelegramBotLifecycle telegramWebhookLifecycle(
            TelegramBotProperties properties,
            TelegramWebhookBotAdapter webhookBot) {
        return TelegramBotLifecycle.forWebhook(properties, webhookBot);
    }
}
