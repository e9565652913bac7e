package com.ai.consultas.selector;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

import com.ai.consultas.dto.InlineKeyboard;
import com.ai.consultas.dto.KeyboardButton;

/**
 * Date/time picker made of four wrapping counters: day, month, hour and minute.
 * The year is taken from the clock and is not adjustable.
 * <p>
 * Confirming returns {@code yyyy/MM/dd HH:mm:00}.
 */
public class DateWheelSelector extends InlineSelector {

    public static final String TIMESTAMP_PATTERN = "yyyy/MM/dd HH:mm:ss";

    private static final int MONTHS = 12;
    private static final int HOURS = 24;
    private static final int MINUTES = 60;

    private final Clock clock;
    private final Locale locale;

    private int year;
    private int month;
    private int day;
    private int hour;
    private int minute;
    private int daysInMonth;

    public DateWheelSelector(Clock clock) {
        this(clock, Locale.getDefault());
    }

    public DateWheelSelector(Clock clock, Locale locale) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.locale = Objects.requireNonNull(locale, "locale");
        loadNow();
    }

    @Override
    public InlineKeyboard render() {
        InlineKeyboard keyboard = InlineKeyboard.builder()
                .row(button(DateWheelAction.DAY_UP), button(DateWheelAction.MONTH_UP),
                        button(DateWheelAction.HOUR_UP), button(DateWheelAction.MINUTE_UP))
                .row(valueRow())
                .row(button(DateWheelAction.DAY_DOWN), button(DateWheelAction.MONTH_DOWN),
                        button(DateWheelAction.HOUR_DOWN), button(DateWheelAction.MINUTE_DOWN))
                .row(button(DateWheelAction.CONFIRM))
                .build();
        markActive();
        return keyboard;
    }

    @Override
    public SelectorOutcome handleSelectorEvent(String token) {
        if (!isActive() || !isAction(token)) {
            return SelectorOutcome.ignored();
        }
        DateWheelAction action = DateWheelAction.fromToken(token).orElse(DateWheelAction.NO_OP);
        switch (action) {
            case NO_OP:
                return SelectorOutcome.ignored();
            case CONFIRM:
                markComplete();
                return SelectorOutcome.completed(formatted(),
                        InlineKeyboard.builder().row(valueRow()).build());
            case MONTH_UP:
            case MONTH_DOWN:
                adjustMonth(action.isUp());
                break;
            case DAY_UP:
            case DAY_DOWN:
                adjustDay(action.isUp());
                break;
            case HOUR_UP:
            case HOUR_DOWN:
                adjustHour(action.isUp());
                break;
            case MINUTE_UP:
            case MINUTE_DOWN:
                adjustMinute(action.isUp());
                break;
            default:
                return SelectorOutcome.ignored();
        }
        return SelectorOutcome.updated(render());
    }

    /**
     * Re-arms the selector. With {@code persistValues} the counters keep the last
     * confirmed position, otherwise they jump back to the current date and time.
     */
    public void reset(boolean persistValues) {
        rearm();
        if (!persistValues) {
            loadNow();
        }
    }

    /**
     * Month wraps 12 -> 1 and 1 -> 12; the day is clamped down when the new
     * month is shorter and never moved up.
     */
    void adjustMonth(boolean up) {
        if (up) {
            month = month == MONTHS ? 1 : month + 1;
        } else {
            month = month == 1 ? MONTHS : month - 1;
        }
        daysInMonth = YearMonth.of(year, month).lengthOfMonth();
        if (day > daysInMonth) {
            day = daysInMonth;
        }
    }

    void adjustDay(boolean up) {
        if (up) {
            day = day >= daysInMonth ? 1 : day + 1;
        } else {
            day = day <= 1 ? daysInMonth : day - 1;
        }
    }

    void adjustHour(boolean up) {
        hour = Math.floorMod(hour + (up ? 1 : -1), HOURS);
    }

    void adjustMinute(boolean up) {
        minute = Math.floorMod(minute + (up ? 1 : -1), MINUTES);
    }

    public String formatted() {
        return String.format(Locale.ROOT, "%04d/%02d/%02d %02d:%02d:00", year, month, day, hour, minute);
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    public int getHour() {
        return hour;
    }

    public int getMinute() {
        return minute;
    }

    public int getDaysInMonth() {
        return daysInMonth;
    }

    private void loadNow() {
        LocalDateTime now = LocalDateTime.now(clock);
        year = now.getYear();
        month = now.getMonthValue();
        daysInMonth = YearMonth.of(year, month).lengthOfMonth();
        day = now.getDayOfMonth();
        hour = now.getHour();
        minute = now.getMinute();
    }

    private KeyboardButton[] valueRow() {
        return new KeyboardButton[] {
                KeyboardButton.of(pad(day), NO_OP),
                KeyboardButton.of(Month.of(month).getDisplayName(TextStyle.SHORT, locale), NO_OP),
                KeyboardButton.of(pad(hour), NO_OP),
                KeyboardButton.of(":" + pad(minute), NO_OP)
        };
    }

    private static KeyboardButton button(DateWheelAction action) {
        return KeyboardButton.of(action.label(), action.token());
    }

    private static String pad(int value) {
        return String.format(Locale.ROOT, "%02d", value);
    }
}
