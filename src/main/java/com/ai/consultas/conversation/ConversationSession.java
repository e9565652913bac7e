package com.ai.consultas.conversation;

import com.ai.consultas.auth.AuthOutcome;
import com.ai.consultas.auth.AuthState;
import com.ai.consultas.auth.PasswordVerifier;
import com.ai.consultas.component.ResponsePhrases;
import com.ai.consultas.dto.InboundEvent;
import com.ai.consultas.dto.InlineKeyboard;
import com.ai.consultas.selector.DateWheelSelector;
import com.ai.consultas.selector.InlineSelector;
import com.ai.consultas.selector.PaginatedSelector;
import com.ai.consultas.selector.SelectorOutcome;
import com.ai.consultas.service.RecordSink;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One user's dialog: an authentication machine and a data-entry machine
 * evaluated side by side, plus the selectors the entry flow reuses.
 * <p>
 * All event handling runs under a per-session lock, so events of the same user
 * arriving on different transport threads never interleave. Handlers only
 * mutate memory and talk to the reply channel; nothing here blocks on the sink.
 */
public class ConversationSession {

    private static final Logger log = LoggerFactory.getLogger(ConversationSession.class);

    private final long userId;
    private final PasswordVerifier passwordVerifier;
    private final ResponsePhrases phrases;
    private final RecordSink recordSink;

    private final PaginatedSelector courseSelector;
    /** Shared by the assistant and auxiliary steps; re-armed between them. */
    private final PaginatedSelector staffSelector;
    private final DateWheelSelector dateSelector;

    /** Message id of each live keyboard -> the selector (and its generation) that rendered it. */
    private final Map<Integer, PendingSelection> pendingSelections = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private AuthState authState = AuthState.IDLE;
    private InputState inputState = InputState.IDLE;
    private FormRecord record = new FormRecord();

    public ConversationSession(long userId,
                               PasswordVerifier passwordVerifier,
                               ResponsePhrases phrases,
                               RecordSink recordSink,
                               PaginatedSelector courseSelector,
                               PaginatedSelector staffSelector,
                               DateWheelSelector dateSelector) {
        this.userId = userId;
        this.passwordVerifier = passwordVerifier;
        this.phrases = phrases;
        this.recordSink = recordSink;
        this.courseSelector = courseSelector;
        this.staffSelector = staffSelector;
        this.dateSelector = dateSelector;
    }

    public DispatchResult handle(InboundEvent event) {
        lock.lock();
        try {
            switch (event.getKind()) {
                case COMMAND:
                    return handleCommand(event);
                case TEXT:
                    return handleText(event);
                case CALLBACK:
                    return handleCallback(event);
                default:
                    return DispatchResult.IGNORED;
            }
        } finally {
            lock.unlock();
        }
    }

    // Commands

    private DispatchResult handleCommand(InboundEvent event) {
        ReplyChannel reply = event.getReplyChannel();
        switch (event.getCommand()) {
            case START:
                resetEntry();
                authState = AuthState.IDLE;
                reply.sendText(phrases.help());
                return DispatchResult.HANDLED;
            case HELP:
                reply.sendText(phrases.help());
                return DispatchResult.HANDLED;
            case AUTH:
                return handleAuthCommand(reply);
            case LOGOUT:
                return handleLogout(reply);
            case RESTART:
                if (authState != AuthState.AUTHENTICATED) {
                    return DispatchResult.IGNORED;
                }
                resetEntry();
                reply.sendText(phrases.dataReset());
                return DispatchResult.HANDLED;
            case REGISTER:
                return handleRegister(reply);
            default:
                return DispatchResult.IGNORED;
        }
    }

    private DispatchResult handleAuthCommand(ReplyChannel reply) {
        if (authState == AuthState.AUTHENTICATED) {
            reply.sendText(phrases.alreadyAuthenticated());
            return DispatchResult.HANDLED;
        }
        log.info("Auth requested by user {}", userId);
        authState = AuthState.AUTHENTICATING;
        reply.sendText(phrases.askPassword());
        return DispatchResult.HANDLED;
    }

    private DispatchResult handleLogout(ReplyChannel reply) {
        if (authState != AuthState.AUTHENTICATED) {
            return DispatchResult.IGNORED;
        }
        resetEntry();
        authState = AuthState.IDLE;
        log.info("User {} logged out", userId);
        reply.sendText(phrases.loggedOut());
        return DispatchResult.LOGGED_OUT;
    }

    private DispatchResult handleRegister(ReplyChannel reply) {
        if (authState != AuthState.AUTHENTICATED) {
            reply.sendText(phrases.authRequired());
            return DispatchResult.HANDLED;
        }
        if (inputState != InputState.IDLE) {
            // half-built entries are discarded, never saved
            resetEntry();
        }
        log.info("Data entry requested by user {}", userId);
        inputState = InputState.STUDENT_NAME;
        reply.sendText(phrases.registerIntro());
        reply.sendText(phrases.askStudentName());
        return DispatchResult.HANDLED;
    }

    // Free text

    private DispatchResult handleText(InboundEvent event) {
        ReplyChannel reply = event.getReplyChannel();
        if (authState == AuthState.AUTHENTICATING) {
            return handleAuthenticating(event.getText(), reply);
        }
        if (authState != AuthState.AUTHENTICATED || inputState == InputState.IDLE) {
            return DispatchResult.IGNORED;
        }
        if (inputState.expectsText()) {
            return handleStudentName(event.getText(), reply);
        }
        if (inputState.expectsSelection()) {
            InlineSelector selector = selectorFor(inputState);
            if (selector != null && !selector.isActive()) {
                // the keyboard for this step never went out; try again
                armStep(inputState, reply);
            } else {
                reply.sendText(phrases.useButtons());
            }
            return DispatchResult.HANDLED;
        }
        return DispatchResult.IGNORED;
    }

    private DispatchResult handleAuthenticating(String text, ReplyChannel reply) {
        AuthOutcome outcome = passwordVerifier.verify(text);
        if (outcome == AuthOutcome.ACCEPTED) {
            authState = AuthState.AUTHENTICATED;
            log.info("Auth completed by user {}", userId);
            reply.sendText(phrases.authCompleted());
        } else {
            log.info("Auth attempt failed by user {}", userId);
            reply.sendText(phrases.authRetry());
        }
        return DispatchResult.HANDLED;
    }

    private DispatchResult handleStudentName(String text, ReplyChannel reply) {
        String name = StringUtils.trimToEmpty(text);
        if (name.isEmpty() || name.length() > FormRecord.MAX_STUDENT_NAME_LENGTH) {
            reply.sendText(phrases.invalidStudentName());
            return DispatchResult.HANDLED;
        }
        record.setStudentName(name);
        advanceTo(InputState.COURSE_NAME, reply);
        return DispatchResult.HANDLED;
    }

    // Button presses

    private DispatchResult handleCallback(InboundEvent event) {
        ReplyChannel reply = event.getReplyChannel();
        reply.answerCallback();
        if (authState != AuthState.AUTHENTICATED || !inputState.expectsSelection()) {
            log.debug("Callback from user {} ignored in state {}/{}", userId, authState, inputState);
            return DispatchResult.IGNORED;
        }
        Integer messageId = event.getSourceMessageId();
        PendingSelection pending = messageId != null ? pendingSelections.get(messageId) : null;
        InlineSelector expected = selectorFor(inputState);
        if (pending == null || !pending.isCurrentFor(expected)) {
            log.debug("Stale selector press from user {} on message {}", userId, messageId);
            return DispatchResult.IGNORED;
        }

        SelectorOutcome outcome = expected.handleSelectorEvent(event.getToken());
        switch (outcome.getType()) {
            case UPDATED:
                reply.editKeyboard(messageId, outcome.getKeyboard());
                return DispatchResult.HANDLED;
            case COMPLETED:
                pendingSelections.remove(messageId);
                reply.editKeyboard(messageId, outcome.getKeyboard());
                acceptSelection(outcome.getValue(), reply);
                return DispatchResult.HANDLED;
            default:
                return DispatchResult.IGNORED;
        }
    }

    private void acceptSelection(String value, ReplyChannel reply) {
        switch (inputState) {
            case COURSE_NAME:
                record.setCourseName(value);
                advanceTo(InputState.ASSIST_NAME, reply);
                break;
            case ASSIST_NAME:
                record.setAssistantName(value);
                advanceTo(InputState.AUX_NAME, reply);
                break;
            case AUX_NAME:
                record.setAuxiliaryName(value);
                advanceTo(InputState.RECEIVED_DATE, reply);
                break;
            case RECEIVED_DATE:
                record.setReceivedDate(value);
                advanceTo(InputState.START_DATE, reply);
                break;
            case START_DATE:
                record.setStartDate(value);
                advanceTo(InputState.END_DATE, reply);
                break;
            case END_DATE:
                record.setEndDate(value);
                inputState = InputState.END;
                completeEntry(reply);
                break;
            default:
                log.warn("Selection '{}' arrived in unexpected state {} for user {}", value, inputState, userId);
        }
    }

    private void completeEntry(ReplyChannel reply) {
        FormRecord completed = record;
        recordSink.enqueue(completed);
        log.info("Consultation entry completed by user {} | student={} course={}",
                userId, completed.getStudentName(), completed.getCourseName());
        reply.sendText(phrases.recordSaved());
        reply.sendText(phrases.recordSummary(completed));
        reply.sendText(phrases.registerAnother());
        resetEntry();
    }

    // Step arming

    private void advanceTo(InputState next, ReplyChannel reply) {
        inputState = next;
        armStep(next, reply);
    }

    private void armStep(InputState step, ReplyChannel reply) {
        switch (step) {
            case COURSE_NAME:
                armList(courseSelector, phrases.selectCourse(), reply);
                break;
            case ASSIST_NAME:
                armList(staffSelector, phrases.selectAssistant(), reply);
                break;
            case AUX_NAME:
                armList(staffSelector, phrases.selectAuxiliary(), reply);
                break;
            case RECEIVED_DATE:
                armDate(false, phrases.selectReceivedDate(), reply);
                break;
            case START_DATE:
                // start is usually close to the received time
                armDate(true, phrases.selectStartDate(), reply);
                break;
            case END_DATE:
                armDate(false, phrases.selectEndDate(), reply);
                break;
            default:
                break;
        }
    }

    private void armList(PaginatedSelector selector, String prompt, ReplyChannel reply) {
        selector.reset();
        try {
            selector.fetchData();
        } catch (RuntimeException e) {
            log.warn("Could not fetch selector data for user {} in state {}", userId, inputState, e);
            selector.reset();
            reply.sendText(phrases.dataUnavailable());
            return;
        }
        if (!selector.hasData()) {
            log.warn("Selector data for state {} is empty", inputState);
            selector.reset();
            reply.sendText(phrases.dataUnavailable());
            return;
        }
        show(selector, selector.render(), prompt, reply);
    }

    private void armDate(boolean persistValues, String prompt, ReplyChannel reply) {
        dateSelector.reset(persistValues);
        show(dateSelector, dateSelector.render(), prompt, reply);
    }

    private void show(InlineSelector selector, InlineKeyboard keyboard, String prompt, ReplyChannel reply) {
        Integer messageId = reply.sendKeyboard(prompt, keyboard);
        if (messageId == null) {
            // nothing on screen to press; leave the step re-armable
            rearm(selector);
            return;
        }
        pendingSelections.put(messageId, new PendingSelection(selector, selector.getGeneration()));
    }

    private void rearm(InlineSelector selector) {
        if (selector instanceof PaginatedSelector) {
            ((PaginatedSelector) selector).reset();
        } else if (selector instanceof DateWheelSelector) {
            ((DateWheelSelector) selector).reset(true);
        }
    }

    private InlineSelector selectorFor(InputState state) {
        switch (state) {
            case COURSE_NAME:
                return courseSelector;
            case ASSIST_NAME:
            case AUX_NAME:
                return staffSelector;
            case RECEIVED_DATE:
            case START_DATE:
            case END_DATE:
                return dateSelector;
            default:
                return null;
        }
    }

    /**
     * Drops the entry in progress: empty record, input back to idle, every
     * selector re-armed and every outstanding keyboard forgotten.
     */
    private void resetEntry() {
        record = new FormRecord();
        inputState = InputState.IDLE;
        courseSelector.reset();
        staffSelector.reset();
        dateSelector.reset(false);
        pendingSelections.clear();
    }

    // Snapshot accessors

    public long getUserId() {
        return userId;
    }

    public AuthState getAuthState() {
        lock.lock();
        try {
            return authState;
        } finally {
            lock.unlock();
        }
    }

    public InputState getInputState() {
        lock.lock();
        try {
            return inputState;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The record in progress. Callers must not mutate it.
     */
    public FormRecord getRecord() {
        lock.lock();
        try {
            return record;
        } finally {
            lock.unlock();
        }
    }

    int pendingSelectionCount() {
        lock.lock();
        try {
            return pendingSelections.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binding of one sent keyboard to the selector state that produced it.
     */
    private static final class PendingSelection {

        private final InlineSelector selector;
        private final long generation;

        private PendingSelection(InlineSelector selector, long generation) {
            this.selector = selector;
            this.generation = generation;
        }

        private boolean isCurrentFor(InlineSelector expected) {
            return selector == expected && selector.getGeneration() == generation;
        }
    }
}
