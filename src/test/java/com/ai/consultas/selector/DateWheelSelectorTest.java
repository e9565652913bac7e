package com.ai.consultas.selector;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.ai.consultas.dto.InlineKeyboard;
import com.ai.consultas.dto.KeyboardButton;

class DateWheelSelectorTest {

    private static final ZoneOffset OFFSET = ZoneOffset.of("-04:00");
    private static final Locale SPANISH = Locale.forLanguageTag("es");

    /** 2024-01-31 23:59 at -04:00. */
    private static final Clock END_OF_JANUARY = Clock.fixed(Instant.parse("2024-02-01T03:59:00Z"), OFFSET);

    private static DateWheelSelector selector(Clock clock) {
        DateWheelSelector selector = new DateWheelSelector(clock, SPANISH);
        selector.render();
        return selector;
    }

    @Test
    void startsFromTheClockInItsOffset() {
        DateWheelSelector selector = new DateWheelSelector(END_OF_JANUARY, SPANISH);

        assertThat(selector.formatted()).isEqualTo("2024/01/31 23:59:00");
        assertThat(selector.getDaysInMonth()).isEqualTo(31);
    }

    @Test
    void rendersArrowsValuesArrowsAndConfirm() {
        DateWheelSelector selector = new DateWheelSelector(END_OF_JANUARY, SPANISH);

        InlineKeyboard keyboard = selector.render();

        assertThat(selector.isActive()).isTrue();
        assertThat(keyboard.rowCount()).isEqualTo(4);
        assertThat(keyboard.row(0)).extracting(KeyboardButton::getToken).containsExactly(
                DateWheelAction.DAY_UP.token(), DateWheelAction.MONTH_UP.token(),
                DateWheelAction.HOUR_UP.token(), DateWheelAction.MINUTE_UP.token());
        assertThat(keyboard.row(1)).extracting(KeyboardButton::getLabel).containsExactly(
                "31", Month.JANUARY.getDisplayName(TextStyle.SHORT, SPANISH), "23", ":59");
        assertThat(keyboard.row(1)).extracting(KeyboardButton::getToken).containsOnly(InlineSelector.NO_OP);
        assertThat(keyboard.row(2)).extracting(KeyboardButton::getToken).containsExactly(
                DateWheelAction.DAY_DOWN.token(), DateWheelAction.MONTH_DOWN.token(),
                DateWheelAction.HOUR_DOWN.token(), DateWheelAction.MINUTE_DOWN.token());
        assertThat(keyboard.row(3)).containsExactly(KeyboardButton.of("Confirmar", "$date_confirm"));
    }

    @Test
    void monthChangeClampsDayToShorterMonth() {
        DateWheelSelector selector = selector(END_OF_JANUARY);

        SelectorOutcome outcome = selector.handleSelectorEvent(DateWheelAction.MONTH_UP.token());

        assertThat(outcome.getType()).isEqualTo(SelectorOutcome.Type.UPDATED);
        assertThat(selector.getMonth()).isEqualTo(2);
        // 2024 is a leap year
        assertThat(selector.getDay()).isEqualTo(29);
        assertThat(selector.getDaysInMonth()).isEqualTo(29);

        selector.handleSelectorEvent(DateWheelAction.MONTH_UP.token());
        assertThat(selector.getMonth()).isEqualTo(3);
        assertThat(selector.getDay()).isEqualTo(29);
    }

    @Test
    void monthWrapsBothWaysWithoutTouchingTheYear() {
        DateWheelSelector selector = selector(END_OF_JANUARY);

        selector.handleSelectorEvent(DateWheelAction.MONTH_DOWN.token());
        assertThat(selector.getMonth()).isEqualTo(12);
        assertThat(selector.getYear()).isEqualTo(2024);

        selector.handleSelectorEvent(DateWheelAction.MONTH_UP.token());
        assertThat(selector.getMonth()).isEqualTo(1);
        assertThat(selector.getYear()).isEqualTo(2024);
    }

    @Test
    void dayWrapsWithinTheMonth() {
        DateWheelSelector selector = selector(END_OF_JANUARY);

        selector.handleSelectorEvent(DateWheelAction.DAY_UP.token());
        assertThat(selector.getDay()).isEqualTo(1);
        assertThat(selector.getMonth()).isEqualTo(1);

        selector.handleSelectorEvent(DateWheelAction.DAY_DOWN.token());
        assertThat(selector.getDay()).isEqualTo(31);
    }

    @Test
    void hourAndMinuteWrapWithoutCarry() {
        DateWheelSelector selector = selector(END_OF_JANUARY);

        selector.handleSelectorEvent(DateWheelAction.MINUTE_UP.token());
        assertThat(selector.getMinute()).isZero();
        assertThat(selector.getHour()).isEqualTo(23);

        selector.handleSelectorEvent(DateWheelAction.HOUR_UP.token());
        assertThat(selector.getHour()).isZero();
        assertThat(selector.getDay()).isEqualTo(31);

        selector.handleSelectorEvent(DateWheelAction.HOUR_DOWN.token());
        selector.handleSelectorEvent(DateWheelAction.MINUTE_DOWN.token());
        assertThat(selector.formatted()).isEqualTo("2024/01/31 23:59:00");
    }

    @Test
    void confirmCompletesWithFormattedTimestamp() {
        DateWheelSelector selector = selector(END_OF_JANUARY);
        selector.handleSelectorEvent(DateWheelAction.MONTH_UP.token());

        SelectorOutcome outcome = selector.handleSelectorEvent(DateWheelAction.CONFIRM.token());

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getValue()).isEqualTo("2024/02/29 23:59:00");
        assertThat(outcome.getKeyboard().rowCount()).isEqualTo(1);
        assertThat(selector.getState()).isEqualTo(SelectorState.COMPLETE);
        assertThat(selector.handleSelectorEvent(DateWheelAction.DAY_UP.token()).getType())
                .isEqualTo(SelectorOutcome.Type.IGNORED);
    }

    @Test
    void valueButtonsLiteralsAndInactiveStateAreIgnored() {
        DateWheelSelector selector = new DateWheelSelector(END_OF_JANUARY, SPANISH);
        assertThat(selector.handleSelectorEvent(DateWheelAction.DAY_UP.token()).getType())
                .isEqualTo(SelectorOutcome.Type.IGNORED);

        selector.render();
        assertThat(selector.handleSelectorEvent(InlineSelector.NO_OP).getType())
                .isEqualTo(SelectorOutcome.Type.IGNORED);
        assertThat(selector.handleSelectorEvent("$week_up").getType())
                .isEqualTo(SelectorOutcome.Type.IGNORED);
        assertThat(selector.handleSelectorEvent("31").getType())
                .isEqualTo(SelectorOutcome.Type.IGNORED);
        assertThat(selector.formatted()).isEqualTo("2024/01/31 23:59:00");
    }

    @Test
    void resetEitherKeepsOrReloadsValues() {
        DateWheelSelector selector = selector(END_OF_JANUARY);
        selector.handleSelectorEvent(DateWheelAction.HOUR_DOWN.token());
        selector.handleSelectorEvent(DateWheelAction.CONFIRM.token());
        long generation = selector.getGeneration();

        selector.reset(true);
        assertThat(selector.getState()).isEqualTo(SelectorState.IDLE);
        assertThat(selector.getGeneration()).isEqualTo(generation + 1);
        assertThat(selector.formatted()).isEqualTo("2024/01/31 22:59:00");

        selector.reset(false);
        assertThat(selector.formatted()).isEqualTo("2024/01/31 23:59:00");
    }
}
