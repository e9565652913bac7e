package com.ai.consultas.dto;

import java.util.Objects;

import com.ai.consultas.conversation.ReplyChannel;

/**
 * One event delivered by the transport for a single user: a command, a free-text
 * message or an inline button press. Carries the channel used to answer it.
 */
public final class InboundEvent {

    public enum Kind {
        COMMAND,
        TEXT,
        CALLBACK
    }

    private final Kind kind;
    private final long userId;
    private final CommandName command;
    private final String text;
    private final String token;
    private final Integer sourceMessageId;
    private final ReplyChannel replyChannel;

    private InboundEvent(Kind kind, long userId, CommandName command, String text,
                         String token, Integer sourceMessageId, ReplyChannel replyChannel) {
        this.kind = kind;
        this.userId = userId;
        this.command = command;
        this.text = text;
        this.token = token;
        this.sourceMessageId = sourceMessageId;
        this.replyChannel = Objects.requireNonNull(replyChannel, "replyChannel");
    }

    public static InboundEvent command(long userId, CommandName command, ReplyChannel replyChannel) {
        return new InboundEvent(Kind.COMMAND, userId, Objects.requireNonNull(command, "command"),
                null, null, null, replyChannel);
    }

    /**
     * Free-text message. {@code text} is null when the user sent something that is not text.
     */
    public static InboundEvent text(long userId, String text, ReplyChannel replyChannel) {
        return new InboundEvent(Kind.TEXT, userId, null, text, null, null, replyChannel);
    }

    public static InboundEvent callback(long userId, String token, Integer sourceMessageId,
                                        ReplyChannel replyChannel) {
        return new InboundEvent(Kind.CALLBACK, userId, null, null, token, sourceMessageId, replyChannel);
    }

    /**
     * Same event, answered through {@code channel}.
     */
    public InboundEvent withReplyChannel(ReplyChannel channel) {
        return new InboundEvent(kind, userId, command, text, token, sourceMessageId, channel);
    }

    public Kind getKind() {
        return kind;
    }

    public long getUserId() {
        return userId;
    }

    public CommandName getCommand() {
        return command;
    }

    public String getText() {
        return text;
    }

    public String getToken() {
        return token;
    }

    public Integer getSourceMessageId() {
        return sourceMessageId;
    }

    public ReplyChannel getReplyChannel() {
        return replyChannel;
    }

    public boolean isCommand(CommandName name) {
        return kind == Kind.COMMAND && command == name;
    }

    @Override
    public String toString() {
        return "InboundEvent{kind=" + kind + ", userId=" + userId
                + (command != null ? ", command=" + command : "")
                + (token != null ? ", token=" + token + ", message=" + sourceMessageId : "")
                + '}';
    }
}
