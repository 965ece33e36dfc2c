package com.questrail.courier.codec;

import java.io.IOException;

/**
 * Serializer
 * -----------------------------------------------------------------------------
 * Turns application messages into bytes and back.
 *
 * <p>A serializer must be self-describing: {@link #fromBinary(byte[])} receives
 * no type hint, because the type name carried in the envelope metadata is
 * diagnostic only.</p>
 *
 * <p>Implementations are shared across threads and must be stateless or
 * thread-safe.</p>
 */
public interface Serializer
{
    byte[] toBinary(Object message) throws IOException;

    Object fromBinary(byte[] bytes) throws IOException;
}
