package com.ai.consultas.selector;

import java.util.Optional;

/**
 * Buttons of the date wheel with their label and wire token.
 */
public enum DateWheelAction {
    DAY_UP("︿", "day_up"),
    DAY_DOWN("﹀", "day_down"),
    MONTH_UP("︿", "month_up"),
    MONTH_DOWN("﹀", "month_down"),
    HOUR_UP("︿", "hour_up"),
    HOUR_DOWN("﹀", "hour_down"),
    MINUTE_UP("︿", "minute_up"),
    MINUTE_DOWN("﹀", "minute_down"),
    CONFIRM("Confirmar", "date_confirm"),
    NO_OP("", "noop");

    private final String label;
    private final String token;

    DateWheelAction(String label, String token) {
        this.label = label;
        this.token = InlineSelector.ACTION_MARKER + token;
    }

    public String label() {
        return label;
    }

    public String token() {
        return token;
    }

    public boolean isUp() {
        return this == DAY_UP || this == MONTH_UP || this == HOUR_UP || this == MINUTE_UP;
    }

    public static Optional<DateWheelAction> fromToken(String token) {
        if (token == null) return Optional.empty();
        for (DateWheelAction action : values()) {
            if (action.token.equals(token)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
