package com.ai.consultas.telegram.service;

import com.ai.consultas.conversation.ReplyChannel;
import com.ai.consultas.dto.InlineKeyboard;
import com.ai.consultas.dto.KeyboardButton;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageReplyMarkup;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * {@link ReplyChannel} for one Telegram chat. API failures are logged and
 * swallowed here so they never reach a conversation session.
 */
public class TelegramReplyChannel implements ReplyChannel {

    private static final Logger log = LoggerFactory.getLogger(TelegramReplyChannel.class);

    private final AbsSender sender;
    private final String chatId;
    private final String callbackQueryId;

    public TelegramReplyChannel(AbsSender sender, long chatId, String callbackQueryId) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.chatId = String.valueOf(chatId);
        this.callbackQueryId = callbackQueryId;
    }

    @Override
    public void sendText(String text) {
        try {
            sender.execute(SendMessage.builder().chatId(chatId).text(text).build());
        } catch (TelegramApiException ex) {
            log.warn("Failed to send message to chat {}: {}", chatId, ex.getMessage());
        }
    }

    @Override
    public Integer sendKeyboard(String text, InlineKeyboard keyboard) {
        try {
            Message sent = sender.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .replyMarkup(toMarkup(keyboard))
                    .build());
            return sent != null ? sent.getMessageId() : null;
        } catch (TelegramApiException ex) {
            log.warn("Failed to send keyboard to chat {}: {}", chatId, ex.getMessage());
            return null;
        }
    }

    @Override
    public void editKeyboard(Integer messageId, InlineKeyboard keyboard) {
        if (messageId == null) {
            return;
        }
        try {
            sender.execute(EditMessageReplyMarkup.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .replyMarkup(toMarkup(keyboard))
                    .build());
        } catch (TelegramApiException ex) {
            log.warn("Failed to edit keyboard of message {} in chat {}: {}", messageId, chatId, ex.getMessage());
        }
    }

    @Override
    public void answerCallback() {
        if (callbackQueryId == null) {
            return;
        }
        try {
            sender.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
        } catch (TelegramApiException ex) {
            log.debug("Failed to answer callback {}: {}", callbackQueryId, ex.getMessage());
        }
    }

    static InlineKeyboardMarkup toMarkup(InlineKeyboard keyboard) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (List<KeyboardButton> row : keyboard.getRows()) {
            List<InlineKeyboardButton> buttons = new ArrayList<>(row.size());
            for (KeyboardButton button : row) {
                buttons.add(InlineKeyboardButton.builder()
                        .text(button.getLabel().isEmpty() ? " " : button.getLabel())
                        .callbackData(button.getToken())
                        .build());
            }
            rows.add(buttons);
        }
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }
}
