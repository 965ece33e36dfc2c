package com.questrail.courier.codec.impl;

import com.questrail.courier.codec.Serializer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * {@link JsonSerializer} output, gzip-compressed.
 */
public final class GzipJsonSerializer implements Serializer
{
    private final JsonSerializer json;

    public GzipJsonSerializer(JsonSerializer json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override
    public byte[] toBinary(Object message) throws IOException {
        byte[] plain = json.toBinary(message);
        ByteArrayOutputStream out = new ByteArrayOutputStream(plain.length / 2 + 32);
        try (OutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(plain);
        }
        return out.toByteArray();
    }

    @Override
    public Object fromBinary(byte[] bytes) throws IOException {
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return json.fromBinary(gzip.readAllBytes());
        }
    }

    @Override
    public String toString() {
        return "GzipJsonSerializer";
    }
}
