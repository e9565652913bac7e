package com.ai.consultas.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ai.consultas.dto.InlineKeyboard;

/**
 * Holds replies back until {@link #flush()}, so a handler can run where
 * transport I/O must not happen. Keyboards cannot be deferred: their message
 * id is needed at once, so they are reported as not sent.
 */
class DeferredReplyChannel implements ReplyChannel {

    private static final Logger log = LoggerFactory.getLogger(DeferredReplyChannel.class);

    private final ReplyChannel target;
    private final List<Runnable> pending = new ArrayList<>();

    DeferredReplyChannel(ReplyChannel target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public void sendText(String text) {
        pending.add(() -> target.sendText(text));
    }

    @Override
    public Integer sendKeyboard(String text, InlineKeyboard keyboard) {
        log.debug("Keyboard '{}' not sent from a deferred reply", text);
        return null;
    }

    @Override
    public void editKeyboard(Integer messageId, InlineKeyboard keyboard) {
        pending.add(() -> target.editKeyboard(messageId, keyboard));
    }

    @Override
    public void answerCallback() {
        pending.add(target::answerCallback);
    }

    /**
     * Sends everything held so far, in order, through the real channel.
     */
    void flush() {
        List<Runnable> replies = new ArrayList<>(pending);
        pending.clear();
        for (Runnable reply : replies) {
            reply.run();
        }
    }
}
