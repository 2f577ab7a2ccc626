package io.memqueue.broker.callback;

public enum DispatchMode {
    /** Waves run on a dedicated thread, decoupled from the ack sequencer. */
    ASYNC,
    /** Waves run on the ack sequencer thread as soon as they are submitted. */
    INLINE
}
