package com.ai.consultas.conversation;

/**
 * What a session did with an inbound event. {@code LOGGED_OUT} tells the
 * router the session may be evicted.
 */
public enum DispatchResult {
    HANDLED,
    IGNORED,
    LOGGED_OUT
}
