package com.ai.consultas.dto;

import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Commands understood by a conversation session. {@code registrar} is the
 * user-facing alias of {@code register}.
 */
public enum CommandName {
    START("start"),
    HELP("help"),
    REGISTER("registrar", "register"),
    RESTART("restart"),
    AUTH("auth"),
    LOGOUT("logout");

    private final String[] aliases;

    CommandName(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolves a bare command name (no leading slash, no bot suffix).
     */
    public static Optional<CommandName> fromName(String name) {
        if (StringUtils.isBlank(name)) return Optional.empty();
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CommandName command : values()) {
            for (String alias : command.aliases) {
                if (alias.equals(normalized)) {
                    return Optional.of(command);
                }
            }
        }
        return Optional.empty();
    }
}
