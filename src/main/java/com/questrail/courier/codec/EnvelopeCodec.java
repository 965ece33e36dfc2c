package com.questrail.courier.codec;

import com.questrail.courier.api.Envelope;
import com.questrail.courier.api.MessageProperties;

import java.util.Objects;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * Application message ⇄ {@link Envelope}.
 *
 * <p>On the way out the envelope records which serializer produced the body and
 * the runtime type of the message. On the way in the serializer is resolved by
 * name through the {@link SerializerRegistry}; a missing or unknown name falls
 * back to the registry default instead of failing.</p>
 *
 * <p>This class knows nothing about AMQP properties. Mapping metadata onto the
 * wire is {@link WireConvention}'s job.</p>
 */
public final class EnvelopeCodec
{
    /**
     * A decoded message together with the serializer that decoded it, so a
     * reply can be encoded the same way.
     */
    public record Decoded(Object message, Serializer serializer) {}

    private final SerializerRegistry registry;

    public EnvelopeCodec(SerializerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public SerializerRegistry registry() {
        return registry;
    }

    /**
     * @throws SerializationException if the message is {@code null}, the
     *         serializer is not registered, or encoding fails
     */
    public Envelope serialize(Object message, Serializer serializer) {
        Objects.requireNonNull(serializer, "serializer");
        if (message == null) {
            throw new SerializationException("Cannot serialize a null message");
        }

        final String serializerId;
        try {
            serializerId = registry.nameOf(serializer);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Serializer is not registered: " + serializer, e);
        }

        try {
            byte[] body = serializer.toBinary(message);
            return new Envelope(body, new MessageProperties(serializerId, message.getClass().getName()));
        } catch (Exception e) {
            throw new SerializationException(
                    "Failed to serialize " + message.getClass().getName() + " with " + serializerId, e);
        }
    }

    /**
     * @throws DeserializationException if the resolved serializer cannot decode the body
     */
    public Decoded deserialize(byte[] body, MessageProperties properties) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(properties, "properties");

        Serializer serializer = registry.lookup(properties.serializerId());
        try {
            return new Decoded(serializer.fromBinary(body), serializer);
        } catch (Exception e) {
            throw new DeserializationException(
                    "Failed to deserialize " + properties.typeName()
                            + " with " + registry.nameOf(serializer), e);
        }
    }

    public Decoded deserialize(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        return deserialize(envelope.body(), envelope.properties());
    }
}
