package com.questrail.courier.internal.events;

import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.api.RpcOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * RequesterRequestEvent
 * -----------------------------------------------------------------------------
 * Events originating from callers of the requester.
 */
public sealed interface RequesterRequestEvent extends RequesterEvent
        permits RequesterRequestEvent.RequestSubmitted
{
    /**
     * A caller asked to publish {@link #messages()} and wait for
     * {@link #expectedReplies()} replies.
     */
    final class RequestSubmitted extends RequesterEvent.Base implements RequesterRequestEvent {
        private final List<PublishRequest> messages;
        private final int expectedReplies;
        private final CompletableFuture<RpcOutcome> handle;

        public RequestSubmitted(Instant timestamp,
                                List<PublishRequest> messages,
                                int expectedReplies,
                                CompletableFuture<RpcOutcome> handle) {
            super(timestamp);
            this.messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
            this.expectedReplies = expectedReplies;
            this.handle = Objects.requireNonNull(handle, "handle");
        }

        public List<PublishRequest> messages() {
            return messages;
        }

        public int expectedReplies() {
            return expectedReplies;
        }

        public CompletableFuture<RpcOutcome> handle() {
            return handle;
        }
    }
}
