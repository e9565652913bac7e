package com.ai.consultas.telegram.service;

import com.ai.consultas.conversation.SessionRouter;
import com.ai.consultas.dto.CommandName;
import com.ai.consultas.dto.InboundEvent;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.MaybeInaccessibleMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.bots.AbsSender;

/**
 * Turns Telegram updates into {@link InboundEvent}s and routes them. Runs on
 * whatever thread the transport delivers the update on.
 */
@Component
public class TelegramUpdateDispatcher implements TelegramUpdateHandler {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateDispatcher.class);

    private static final String COMMAND_PREFIX = "/";

    private final SessionRouter router;

    public TelegramUpdateDispatcher(SessionRouter router) {
        this.router = router;
    }

    @Override
    public void handle(Update update, AbsSender sender) {
        if (update == null) {
            return;
        }
        try {
            Optional<InboundEvent> event = translate(update, sender);
            if (event.isPresent()) {
                router.dispatch(event.get());
            } else {
                log.debug("Ignoring unsupported update {}", update.getUpdateId());
            }
        } catch (RuntimeException ex) {
            log.error("Failed to process Telegram update {}: {}", update.getUpdateId(), ex.getMessage(), ex);
        }
    }

    Optional<InboundEvent> translate(Update update, AbsSender sender) {
        if (update.hasMessage()) {
            return fromMessage(update.getMessage(), sender);
        }
        if (update.hasCallbackQuery()) {
            return fromCallback(update.getCallbackQuery(), sender);
        }
        return Optional.empty();
    }

    private Optional<InboundEvent> fromMessage(Message message, AbsSender sender) {
        if (message.getFrom() == null || message.getChatId() == null) {
            return Optional.empty();
        }
        long userId = message.getFrom().getId();
        TelegramReplyChannel channel = new TelegramReplyChannel(sender, message.getChatId(), null);

        String text = message.hasText() ? message.getText() : null;
        if (text != null && text.startsWith(COMMAND_PREFIX)) {
            Optional<CommandName> command = CommandName.fromName(commandName(text));
            if (command.isEmpty()) {
                log.debug("Unknown command '{}' from user {}", text, userId);
                return Optional.empty();
            }
            return Optional.of(InboundEvent.command(userId, command.get(), channel));
        }
        return Optional.of(InboundEvent.text(userId, text, channel));
    }

    private Optional<InboundEvent> fromCallback(CallbackQuery callback, AbsSender sender) {
        if (callback.getFrom() == null) {
            return Optional.empty();
        }
        long userId = callback.getFrom().getId();
        MaybeInaccessibleMessage message = callback.getMessage();
        long chatId = message != null && message.getChatId() != null ? message.getChatId() : userId;
        Integer messageId = message != null ? message.getMessageId() : null;
        TelegramReplyChannel channel = new TelegramReplyChannel(sender, chatId, callback.getId());
        return Optional.of(InboundEvent.callback(userId, callback.getData(), messageId, channel));
    }

    /**
     * "/registrar@SomeBot extra" -> "registrar".
     */
    static String commandName(String text) {
        String first = text.trim().split("\\s+", 2)[0].substring(COMMAND_PREFIX.length());
        int at = first.indexOf('@');
        return at >= 0 ? first.substring(0, at) : first;
    }
}
