package com.questrail.courier.codec;

/**
 * Name-based lookup of {@link Serializer}s.
 */
public interface SerializerRegistry
{
    /**
     * Resolve a serializer by its registered name.
     *
     * <p>Unknown or {@code null} names resolve to {@link #defaultSerializer()}
     * rather than failing.</p>
     */
    Serializer lookup(String name);

    /**
     * Registered name of a serializer.
     *
     * @throws IllegalArgumentException if the serializer is not registered
     */
    String nameOf(Serializer serializer);

    Serializer defaultSerializer();
}
