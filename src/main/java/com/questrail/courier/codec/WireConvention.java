package com.questrail.courier.codec;

import com.questrail.courier.api.MessageProperties;

/**
 * WireConvention
 * -----------------------------------------------------------------------------
 * Where envelope metadata travels in the transport's message properties.
 *
 * <p>Standard convention: {@code content-encoding} carries the serializer id and
 * {@code content-type} carries the message type name.</p>
 *
 * <p>Older producers swapped the two fields. {@link #legacy()} reads and writes
 * that layout so both generations can talk to each other as long as each side is
 * configured consistently.</p>
 */
public final class WireConvention
{
    private static final WireConvention STANDARD = new WireConvention(false);
    private static final WireConvention LEGACY = new WireConvention(true);

    private final boolean swapped;

    private WireConvention(boolean swapped) {
        this.swapped = swapped;
    }

    public static WireConvention standard() {
        return STANDARD;
    }

    public static WireConvention legacy() {
        return LEGACY;
    }

    public static WireConvention of(boolean legacyEncodingSwap) {
        return legacyEncodingSwap ? LEGACY : STANDARD;
    }

    public boolean isLegacy() {
        return swapped;
    }

    public String contentEncoding(MessageProperties properties) {
        return swapped ? properties.typeName() : properties.serializerId();
    }

    public String contentType(MessageProperties properties) {
        return swapped ? properties.serializerId() : properties.typeName();
    }

    public MessageProperties fromWire(String contentEncoding, String contentType) {
        return swapped
                ? new MessageProperties(contentType, contentEncoding)
                : new MessageProperties(contentEncoding, contentType);
    }
}
