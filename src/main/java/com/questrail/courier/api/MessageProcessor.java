package com.questrail.courier.api;

import java.util.concurrent.CompletionStage;

/**
 * Pluggable processing capability hosted by the RPC server adapter.
 */
public interface MessageProcessor
{
    /**
     * Process one inbound request.
     *
     * @param delivery the request
     * @return the eventual result; a failed stage (or a synchronous throw) is
     *         routed to {@link #onFailure(Delivery, Throwable)}
     */
    CompletionStage<ProcessResult> process(Delivery delivery);

    /**
     * Build the reply describing why {@link #process(Delivery)} failed. Typically
     * the error is serialized together with some context.
     *
     * @param delivery the request that could not be processed
     * @param error    the failure
     * @return the failure reply
     */
    ProcessResult onFailure(Delivery delivery, Throwable error);
}
