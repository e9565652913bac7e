package com.ai.consultas.telegram.bot;

import com.ai.consultas.telegram.config.TelegramBotProperties;
import com.ai.consultas.telegram.service.TelegramUpdateHandler;
import java.util.Objects;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.bots.TelegramWebhookBot;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;

public class TelegramWebhookBotAdapter extends TelegramWebhookBot {

    private final TelegramBotProperties properties;
    private final TelegramUpdateHandler updateHandler;

    public TelegramWebhookBotAdapter(
            DefaultBotOptions options,
            TelegramBotProperties properties,
            TelegramUpdateHandler updateHandler) {
        super(options, properties.getBot().getToken());
        this.properties = Objects.requireNonNull(properties, "properties");
        this.updateHandler = Objects.requireNonNull(updateHandler, "updateHandler");
    }

    @Override
    public String getBotUsername() {
        return properties.getBot().getUsername();
    }

    @Override
    public String getBotPath() {
        return properties.getWebhook().getPath();
    }

    /**
     * Replies are sent through the API as the session produces them, so the
     * webhook response itself never carries a method.
     */
    @Override
    public BotApiMethod<?> onWebhookUpdateReceived(Update update) {
        updateHandler.handle(update, this);
        return null;
    }
}
