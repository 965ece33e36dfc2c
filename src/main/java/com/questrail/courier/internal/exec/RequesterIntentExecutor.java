package com.questrail.courier.internal.exec;

import com.questrail.courier.internal.state.RequesterIntents;

/**
 * RequesterIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure requester state machine and the impure
 * world of broker channels and caller futures.
 *
 * <h2>Role in the architecture</h2>
 * {@code RequesterIntentExecutor} realizes the intents produced by the
 * {@link com.questrail.courier.internal.state.RequesterStateReducer}. It is the
 * ONLY layer allowed to:
 * <ul>
 *   <li>Publish, acknowledge and declare on the broker channel</li>
 *   <li>Complete caller handles</li>
 *   <li>Report to the observability sink on behalf of the reducer</li>
 * </ul>
 *
 * <h2>Actor-style execution model</h2>
 * {@link #execute(RequesterIntents)} is only ever called from the requester's
 * owner thread. Outcomes that the state machine must learn about (a reply
 * queue becoming bound, a publish failing) are reported back as
 * {@code RequesterEvent}s, never through return values.
 */
public interface RequesterIntentExecutor
{
    /**
     * Execute the supplied intents, in order.
     *
     * <p>A failure executing one intent must not prevent the remaining intents
     * from executing.</p>
     *
     * @param intents immutable, ordered intents
     */
    void execute(RequesterIntents intents);
}
