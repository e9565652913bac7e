package com.ai.consultas.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One inline button: the visible label and the token sent back when pressed.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class KeyboardButton {

    private final String label;
    private final String token;

    private KeyboardButton(String label, String token) {
        this.label = label;
        this.token = token;
    }

    public static KeyboardButton of(String label, String token) {
        return new KeyboardButton(label, token);
    }
}
