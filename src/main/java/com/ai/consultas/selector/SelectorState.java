package com.ai.consultas.selector;

/**
 * Lifecycle of a reusable selector: idle until rendered, active while its
 * keyboard is live, complete once a terminal choice was returned.
 */
public enum SelectorState {
    IDLE,
    ACTIVE,
    COMPLETE
}
