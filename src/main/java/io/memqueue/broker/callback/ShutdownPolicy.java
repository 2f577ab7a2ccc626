package io.memqueue.broker.callback;

/**
 * What a closing dispatcher does with waves that were queued but not started.
 * The wave already running always completes.
 */
public enum ShutdownPolicy {
    /** Queued waves are discarded and their count logged. */
    DROP_PENDING,
    /** Queued waves run, in order, before the dispatcher exits. */
    DRAIN_PENDING
}
