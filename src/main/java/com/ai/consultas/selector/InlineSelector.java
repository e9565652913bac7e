package com.ai.consultas.selector;

import com.ai.consultas.dto.InlineKeyboard;

/**
 * Base for reusable inline-keyboard selectors.
 * <p>
 * Cycle: {@code IDLE -> ACTIVE (render) -> COMPLETE (terminal choice) -> IDLE (reset)}.
 * Every reset bumps the generation so that keyboards rendered before the reset
 * can be told apart from the live one. Not thread-safe; the owning session
 * serializes access.
 */
public abstract class InlineSelector {

    /** Leading marker that distinguishes control tokens from literal values. */
    public static final String ACTION_MARKER = "$";

    public static final String NO_OP = ACTION_MARKER + "noop";

    /** Longest token, in UTF-8 bytes, a button can carry back (Telegram callback data limit). */
    public static final int MAX_TOKEN_BYTES = 64;

    private SelectorState state = SelectorState.IDLE;
    private long generation;

    public static boolean isAction(String token) {
        return token != null && token.startsWith(ACTION_MARKER);
    }

    public SelectorState getState() {
        return state;
    }

    public long getGeneration() {
        return generation;
    }

    public boolean isActive() {
        return state == SelectorState.ACTIVE;
    }

    /**
     * Builds the live keyboard and marks the selector active.
     */
    public abstract InlineKeyboard render();

    /**
     * Applies one button token. Never throws for bad input; anything not
     * applicable comes back as {@link SelectorOutcome#ignored()}.
     */
    public abstract SelectorOutcome handleSelectorEvent(String token);

    protected void markActive() {
        state = SelectorState.ACTIVE;
    }

    protected void markComplete() {
        state = SelectorState.COMPLETE;
    }

    protected void rearm() {
        state = SelectorState.IDLE;
        generation++;
    }
}
