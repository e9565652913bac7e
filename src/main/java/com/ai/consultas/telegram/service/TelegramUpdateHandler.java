package com.ai.consultas.telegram.service;

import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.bots.AbsSender;

public interface TelegramUpdateHandler {

    /**
     * Handles one update; replies go out through {@code sender}.
     */
    void handle(Update update, AbsSender sender);
}
