package com.ai.consultas.selector;

import com.ai.consultas.dto.InlineKeyboard;

/**
 * Result of feeding one button token to a selector.
 * <ul>
 *   <li>{@code IGNORED}: stale, out of bounds or no-op press; nothing to update</li>
 *   <li>{@code UPDATED}: the keyboard changed and should replace the displayed one</li>
 *   <li>{@code COMPLETED}: a terminal value was chosen; keyboard is the frozen summary</li>
 * </ul>
 */
public final class SelectorOutcome {

    public enum Type {
        IGNORED,
        UPDATED,
        COMPLETED
    }

    private static final SelectorOutcome IGNORED = new SelectorOutcome(Type.IGNORED, null, null);

    private final Type type;
    private final InlineKeyboard keyboard;
    private final String value;

    private SelectorOutcome(Type type, InlineKeyboard keyboard, String value) {
        this.type = type;
        this.keyboard = keyboard;
        this.value = value;
    }

    public static SelectorOutcome ignored() {
        return IGNORED;
    }

    public static SelectorOutcome updated(InlineKeyboard keyboard) {
        return new SelectorOutcome(Type.UPDATED, keyboard, null);
    }

    public static SelectorOutcome completed(String value, InlineKeyboard frozenKeyboard) {
        return new SelectorOutcome(Type.COMPLETED, frozenKeyboard, value);
    }

    public Type getType() {
        return type;
    }

    public InlineKeyboard getKeyboard() {
        return keyboard;
    }

    public String getValue() {
        return value;
    }

    public boolean isCompleted() {
        return type == Type.COMPLETED;
    }
}
