package com.questrail.courier.config;

/**
 * Per-channel consumer prefetch.
 */
public record ChannelParameters(int prefetchCount, boolean prefetchIsGlobal)
{
    public ChannelParameters {
        if (prefetchCount < 0) {
            throw new IllegalArgumentException("prefetchCount must be >= 0, was " + prefetchCount);
        }
    }

    public static ChannelParameters defaults() {
        return new ChannelParameters(1, false);
    }
}
