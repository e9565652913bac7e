package com.ai.consultas.conversation;

import com.ai.consultas.dto.CommandName;
import com.ai.consultas.dto.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;

/**
 * Owns the user -> session table and routes every inbound event to its session.
 * <ul>
 *   <li>Only {@code start} creates a session; other events from unknown users are dropped.</li>
 *   <li>Concurrent first contact from one user yields a single session ({@code computeIfAbsent}).</li>
 *   <li>A session is evicted only when it reports a successful logout.</li>
 * </ul>
 */
@Component
public class SessionRouter {

    private static final Logger log = LoggerFactory.getLogger(SessionRouter.class);

    private final Map<Long, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final LongFunction<ConversationSession> sessionFactory;

    @Autowired
    public SessionRouter(ConversationSessionFactory sessionFactory) {
        this(sessionFactory::create);
    }

    SessionRouter(LongFunction<ConversationSession> sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    public DispatchResult dispatch(InboundEvent event) {
        long userId = event.getUserId();
        if (event.isCommand(CommandName.START)) {
            return resolveOrCreate(userId).handle(event);
        }
        if (event.isCommand(CommandName.LOGOUT)) {
            return logout(userId, event);
        }
        ConversationSession session = sessions.get(userId);
        if (session == null) {
            log.debug("Dropping {} from user {} without session", event.getKind(), userId);
            return DispatchResult.IGNORED;
        }
        return session.handle(event);
    }

    public Optional<ConversationSession> find(long userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    public int activeSessions() {
        return sessions.size();
    }

    private ConversationSession resolveOrCreate(long userId) {
        return sessions.computeIfAbsent(userId, id -> {
            log.info("Session created for user {}", id);
            return sessionFactory.apply(id);
        });
    }

    /**
     * Logout and eviction happen atomically with respect to a racing {@code start}
     * for the same user: both go through the map's per-key compute. Replies are
     * held back and sent once the compute has returned.
     */
    private DispatchResult logout(long userId, InboundEvent event) {
        DeferredReplyChannel deferred = new DeferredReplyChannel(event.getReplyChannel());
        InboundEvent held = event.withReplyChannel(deferred);
        DispatchResult[] result = {DispatchResult.IGNORED};
        sessions.computeIfPresent(userId, (id, session) -> {
            result[0] = session.handle(held);
            if (result[0] == DispatchResult.LOGGED_OUT) {
                log.info("Session evicted for user {}", id);
                return null;
            }
            return session;
        });
        deferred.flush();
        return result[0];
    }
}
