package com.questrail.courier.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one inbound request.
 *
 * <p>An absent value means "send nothing back", even when the request carried a
 * reply address.</p>
 */
public final class ProcessResult
{
    private static final ProcessResult NO_REPLY = new ProcessResult(null, null);

    private final byte[] value;
    private final MessageProperties properties;

    private ProcessResult(byte[] value, MessageProperties properties) {
        this.value = value;
        this.properties = properties;
    }

    public static ProcessResult reply(byte[] value, MessageProperties properties) {
        return new ProcessResult(Objects.requireNonNull(value, "value"), properties);
    }

    public static ProcessResult reply(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        return new ProcessResult(envelope.body(), envelope.properties());
    }

    public static ProcessResult noReply() {
        return NO_REPLY;
    }

    public Optional<byte[]> value() {
        return Optional.ofNullable(value);
    }

    public Optional<MessageProperties> properties() {
        return Optional.ofNullable(properties);
    }
}
