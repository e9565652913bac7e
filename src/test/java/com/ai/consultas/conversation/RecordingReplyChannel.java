package com.ai.consultas.conversation;

import java.util.ArrayList;
import java.util.List;

import com.ai.consultas.dto.InlineKeyboard;

/**
 * Reply channel that remembers everything sent through it. Keyboard messages
 * get ids counting up from 100.
 */
class RecordingReplyChannel implements ReplyChannel {

    static final class SentKeyboard {
        final int messageId;
        final String text;
        final InlineKeyboard keyboard;

        SentKeyboard(int messageId, String text, InlineKeyboard keyboard) {
            this.messageId = messageId;
            this.text = text;
            this.keyboard = keyboard;
        }
    }

    static final class Edit {
        final Integer messageId;
        final InlineKeyboard keyboard;

        Edit(Integer messageId, InlineKeyboard keyboard) {
            this.messageId = messageId;
            this.keyboard = keyboard;
        }
    }

    final List<String> texts = new ArrayList<>();
    final List<SentKeyboard> keyboards = new ArrayList<>();
    final List<Edit> edits = new ArrayList<>();
    int callbackAnswers;
    boolean failKeyboards;

    private int nextMessageId = 100;

    @Override
    public void sendText(String text) {
        texts.add(text);
    }

    @Override
    public Integer sendKeyboard(String text, InlineKeyboard keyboard) {
        if (failKeyboards) {
            return null;
        }
        SentKeyboard sent = new SentKeyboard(nextMessageId++, text, keyboard);
        keyboards.add(sent);
        return sent.messageId;
    }

    @Override
    public void editKeyboard(Integer messageId, InlineKeyboard keyboard) {
        edits.add(new Edit(messageId, keyboard));
    }

    @Override
    public void answerCallback() {
        callbackAnswers++;
    }

    SentKeyboard lastKeyboard() {
        return keyboards.get(keyboards.size() - 1);
    }

    String lastText() {
        return texts.get(texts.size() - 1);
    }

    void clear() {
        texts.clear();
        keyboards.clear();
        edits.clear();
        callbackAnswers = 0;
    }
}
