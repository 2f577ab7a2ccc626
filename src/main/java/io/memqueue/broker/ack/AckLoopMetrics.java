package io.memqueue.broker.ack;

/**
 * Point-in-time view of the ack sequencer.
 *
 * @param pendingBatches        batches in the ledger awaiting retirement
 * @param unackedConsumedEvents entries handed to consumers and not yet retired
 * @param ackedEvents           entries retired since start
 * @param advancements          advancements that retired at least one batch
 * @param pendingCallbackWaves  callback waves accepted but not yet started
 */
public record AckLoopMetrics(int pendingBatches,
                             long unackedConsumedEvents,
                             long ackedEvents,
                             long advancements,
                             int pendingCallbackWaves) {
}
