package com.ai.consultas.conversation;

import com.ai.consultas.dto.InlineKeyboard;

/**
 * Reply capability handed over with every inbound event. Implementations
 * belong to the transport and must not throw; failures are theirs to log.
 */
public interface ReplyChannel {

    void sendText(String text);

    /**
     * Sends a message carrying an inline keyboard.
     *
     * @return identity of the sent message, or null when it could not be sent
     */
    Integer sendKeyboard(String text, InlineKeyboard keyboard);

    void editKeyboard(Integer messageId, InlineKeyboard keyboard);

    /**
     * Acknowledges the button press being handled. No-op for non-callback events.
     */
    void answerCallback();
}
