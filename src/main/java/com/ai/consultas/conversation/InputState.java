package com.ai.consultas.conversation;

/**
 * Linear data-entry pipeline. Each step accepts exactly one kind of event.
 */
public enum InputState {
    IDLE,
    STUDENT_NAME,
    COURSE_NAME,
    ASSIST_NAME,
    AUX_NAME,
    RECEIVED_DATE,
    START_DATE,
    END_DATE,
    END;

    public boolean expectsText() {
        return this == STUDENT_NAME;
    }

    public boolean expectsListSelection() {
        return this == COURSE_NAME || this == ASSIST_NAME || this == AUX_NAME;
    }

    public boolean expectsDateSelection() {
        return this == RECEIVED_DATE || this == START_DATE || this == END_DATE;
    }

    public boolean expectsSelection() {
        return expectsListSelection() || expectsDateSelection();
    }
}
