package com.ai.consultas.telegram.bot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;

import com.ai.consultas.telegram.config.TelegramBotProperties;

@ExtendWith(MockitoExtension.class)
class TelegramBotLifecycleTest {

    @Mock
    private TelegramWebhookBotAdapter webhookBot;

    private TelegramBotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TelegramBotProperties();
        properties.setEnabled(true);
        properties.setMode(TelegramBotProperties.Mode.WEBHOOK);
        properties.getBot().setToken("token");
        properties.getBot().setUsername("ConsultasBot");
    }

    @Test
    void webhookUrlJoinsBaseAndPath() {
        TelegramBotLifecycle lifecycle = TelegramBotLifecycle.forWebhook(properties, webhookBot);

        properties.getWebhook().setExternalUrl("https://bot.example.com/");
        properties.getWebhook().setPath("/telegram/update");
        assertThat(lifecycle.resolveWebhookUrl()).isEqualTo("https://bot.example.com/telegram/update");

        properties.getWebhook().setExternalUrl("https://bot.example.com");
        properties.getWebhook().setPath("hook");
        assertThat(lifecycle.resolveWebhookUrl()).isEqualTo("https://bot.example.com/hook");

        properties.getWebhook().setPath(" ");
        assertThat(lifecycle.resolveWebhookUrl()).isEqualTo("https://bot.example.com");
    }

    @Test
    void webhookModeRequiresExternalUrl() {
        TelegramBotLifecycle lifecycle = TelegramBotLifecycle.forWebhook(properties, webhookBot);

        assertThatThrownBy(lifecycle::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("external-url");
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    void startRegistersAndStopDeletesTheWebhook() throws Exception {
        properties.getWebhook().setExternalUrl("https://bot.example.com");
        properties.getWebhook().setSecretToken("s3cret");
        TelegramBotLifecycle lifecycle = TelegramBotLifecycle.forWebhook(properties, webhookBot);

        lifecycle.start();

        ArgumentCaptor<SetWebhook> captor = ArgumentCaptor.forClass(SetWebhook.class);
        verify(webhookBot).setWebhook(captor.capture());
        assertThat(captor.getValue().getUrl()).isEqualTo("https://bot.example.com/telegram/update");
        assertThat(captor.getValue().getSecretToken()).isEqualTo("s3cret");
        assertThat(captor.getValue().getAllowedUpdates()).isEqualTo(List.of("message", "callback_query"));
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();

        verify(webhookBot).execute(any(DeleteWebhook.class));
        assertThat(lifecycle.isRunning()).isFalse();
    }
}
