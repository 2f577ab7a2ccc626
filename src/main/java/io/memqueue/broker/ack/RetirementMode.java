package io.memqueue.broker.ack;

/**
 * How an advancement treats a run of several acknowledged batches at the
 * head of the ledger.
 */
public enum RetirementMode {
    /**
     * The whole acknowledged prefix is retired at once: one deletion report,
     * one aggregate callback and one callback wave, with producer deltas
     * collapsed across the batches.
     */
    COLLAPSED,
    /**
     * Each acknowledged batch is retired on its own, oldest first: one
     * deletion report, aggregate callback and callback wave per batch.
     */
    PER_BATCH
}
