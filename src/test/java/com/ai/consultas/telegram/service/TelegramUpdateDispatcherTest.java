package com.ai.consultas.telegram.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.bots.AbsSender;

import com.ai.consultas.conversation.SessionRouter;
import com.ai.consultas.dto.CommandName;
import com.ai.consultas.dto.InboundEvent;

@ExtendWith(MockitoExtension.class)
class TelegramUpdateDispatcherTest {

    private static final long USER_ID = 4242L;
    private static final long CHAT_ID = 9000L;

    @Mock
    private SessionRouter router;

    @Mock
    private AbsSender sender;

    @InjectMocks
    private TelegramUpdateDispatcher dispatcher;

    private static User user() {
        User user = new User();
        user.setId(USER_ID);
        user.setFirstName("Ana");
        user.setIsBot(false);
        return user;
    }

    private static Message message(String text) {
        Chat chat = new Chat();
        chat.setId(CHAT_ID);
        chat.setType("private");
        Message message = new Message();
        message.setMessageId(55);
        message.setChat(chat);
        message.setFrom(user());
        message.setText(text);
        return message;
    }

    private static Update messageUpdate(String text) {
        Update update = new Update();
        update.setUpdateId(1);
        update.setMessage(message(text));
        return update;
    }

    private InboundEvent dispatched() {
        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(router).dispatch(captor.capture());
        return captor.getValue();
    }

    @Test
    void slashCommandBecomesCommandEvent() {
        dispatcher.handle(messageUpdate("/registrar@ConsultasBot ahora"), sender);

        InboundEvent event = dispatched();
        assertThat(event.getKind()).isEqualTo(InboundEvent.Kind.COMMAND);
        assertThat(event.getCommand()).isEqualTo(CommandName.REGISTER);
        assertThat(event.getUserId()).isEqualTo(USER_ID);
        assertThat(event.getReplyChannel()).isInstanceOf(TelegramReplyChannel.class);
    }

    @Test
    void englishAliasAndCaseAreAccepted() {
        dispatcher.handle(messageUpdate("/Register"), sender);

        assertThat(dispatched().getCommand()).isEqualTo(CommandName.REGISTER);
    }

    @Test
    void unknownCommandIsDropped() {
        dispatcher.handle(messageUpdate("/settings"), sender);

        verify(router, never()).dispatch(any());
    }

    @Test
    void plainTextBecomesTextEvent() {
        dispatcher.handle(messageUpdate("Ana Pérez"), sender);

        InboundEvent event = dispatched();
        assertThat(event.getKind()).isEqualTo(InboundEvent.Kind.TEXT);
        assertThat(event.getText()).isEqualTo("Ana Pérez");
    }

    @Test
    void nonTextMessageBecomesTextEventWithoutText() {
        dispatcher.handle(messageUpdate(null), sender);

        InboundEvent event = dispatched();
        assertThat(event.getKind()).isEqualTo(InboundEvent.Kind.TEXT);
        assertThat(event.getText()).isNull();
    }

    @Test
    void callbackQueryBecomesCallbackEvent() {
        CallbackQuery callback = new CallbackQuery();
        callback.setId("cb-1");
        callback.setFrom(user());
        callback.setData("Cálculo I");
        callback.setMessage(message(null));
        Update update = new Update();
        update.setUpdateId(2);
        update.setCallbackQuery(callback);

        dispatcher.handle(update, sender);

        InboundEvent event = dispatched();
        assertThat(event.getKind()).isEqualTo(InboundEvent.Kind.CALLBACK);
        assertThat(event.getToken()).isEqualTo("Cálculo I");
        assertThat(event.getSourceMessageId()).isEqualTo(55);
        assertThat(event.getUserId()).isEqualTo(USER_ID);
    }

    @Test
    void updatesWithoutMessageOrCallbackAreIgnored() {
        Update update = new Update();
        update.setUpdateId(3);

        dispatcher.handle(update, sender);
        dispatcher.handle(null, sender);

        verify(router, never()).dispatch(any());
    }

    @Test
    void routingFailureDoesNotEscape() {
        when(router.dispatch(any())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> dispatcher.handle(messageUpdate("hola"), sender)).doesNotThrowAnyException();
    }

    @Test
    void commandNameStripsSlashBotSuffixAndArguments() {
        assertThat(TelegramUpdateDispatcher.commandName("/start")).isEqualTo("start");
        assertThat(TelegramUpdateDispatcher.commandName("/auth@ConsultasBot")).isEqualTo("auth");
        assertThat(TelegramUpdateDispatcher.commandName("/logout now")).isEqualTo("logout");
    }

    @Test
    void callbackWithoutSourceMessageAnswersInThePrivateChat() {
        CallbackQuery callback = new CallbackQuery();
        callback.setId("cb-2");
        callback.setFrom(user());
        callback.setData("Luis");
        Update update = new Update();
        update.setUpdateId(4);
        update.setCallbackQuery(callback);

        dispatcher.handle(update, sender);

        InboundEvent event = dispatched();
        assertThat(event.getKind()).isEqualTo(InboundEvent.Kind.CALLBACK);
        assertThat(event.getToken()).isEqualTo("Luis");
        assertThat(event.getSourceMessageId()).isNull();
    }
}
