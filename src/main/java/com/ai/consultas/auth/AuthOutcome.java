package com.ai.consultas.auth;

/**
 * Result of checking a submitted secret.
 */
public enum AuthOutcome {
    ACCEPTED,
    REJECTED
}
