package com.ai.consultas.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Transport-neutral inline keyboard: ordered rows of buttons.
 * Selectors build these; the transport adapter converts them to its own markup.
 */
@ToString
@EqualsAndHashCode
public final class InlineKeyboard {

    private final List<List<KeyboardButton>> rows;

    private InlineKeyboard(List<List<KeyboardButton>> rows) {
        List<List<KeyboardButton>> copy = new ArrayList<>(rows.size());
        for (List<KeyboardButton> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<List<KeyboardButton>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<KeyboardButton> row(int index) {
        return rows.get(index);
    }

    public static final class Builder {

        private final List<List<KeyboardButton>> rows = new ArrayList<>();

        private Builder() {
        }

        public Builder row(KeyboardButton... buttons) {
            List<KeyboardButton> row = new ArrayList<>(buttons.length);
            Collections.addAll(row, buttons);
            rows.add(row);
            return this;
        }

        public Builder row(List<KeyboardButton> buttons) {
            rows.add(new ArrayList<>(buttons));
            return this;
        }

        public InlineKeyboard build() {
            return new InlineKeyboard(rows);
        }
    }
}
