package com.ai.consultas.auth;

/**
 * Authentication state of one conversation.
 */
public enum AuthState {
    IDLE,
    AUTHENTICATING,
    AUTHENTICATED
}
