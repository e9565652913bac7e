package com.ai.consultas.conversation;

import com.ai.consultas.auth.PasswordVerifier;
import com.ai.consultas.component.ResponsePhrases;
import com.ai.consultas.config.FormBotProperties;
import com.ai.consultas.selector.DateWheelSelector;
import com.ai.consultas.selector.PaginatedSelector;
import com.ai.consultas.service.RecordSink;
import com.ai.consultas.service.RegistryDataService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;

/**
 * Builds a session with its own selector instances: one course list, one staff
 * list (shared by assistant and auxiliary) and one date wheel.
 */
@Component
public class ConversationSessionFactory {

    private final PasswordVerifier passwordVerifier;
    private final ResponsePhrases phrases;
    private final RecordSink recordSink;
    private final RegistryDataService registryDataService;
    private final Clock clock;
    private final Locale locale;
    private final int pageSize;

    public ConversationSessionFactory(PasswordVerifier passwordVerifier,
                                      ResponsePhrases phrases,
                                      RecordSink recordSink,
                                      RegistryDataService registryDataService,
                                      Clock formClock,
                                      Locale formLocale,
                                      FormBotProperties properties) {
        this.passwordVerifier = passwordVerifier;
        this.phrases = phrases;
        this.recordSink = recordSink;
        this.registryDataService = registryDataService;
        this.clock = formClock;
        this.locale = formLocale;
        this.pageSize = properties.getPageSize();
    }

    public ConversationSession create(long userId) {
        return new ConversationSession(
                userId,
                passwordVerifier,
                phrases,
                recordSink,
                new PaginatedSelector(registryDataService.courseNames(), pageSize),
                new PaginatedSelector(registryDataService.staffNames(), pageSize),
                new DateWheelSelector(clock, locale));
    }
}
