package io.memqueue.broker.ack;

import io.memqueue.broker.callback.AsyncCallbackDispatcher;
import io.memqueue.broker.callback.CallbackDispatcher;
import io.memqueue.broker.callback.InlineCallbackDispatcher;
import io.memqueue.common.util.NamedThreadFactory;
import io.memqueue.config.impl.AckLoopConfig;
import io.memqueue.core.batch.AckBatch;
import io.memqueue.core.batch.BatchList;
import io.memqueue.core.batch.BatchPool;
import io.memqueue.core.entry.AckCallback;
import io.memqueue.core.entry.QueueEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asynchronous acknowledgment sequencer of the memory queue.
 * <p>
 * The run loop hands over every batch it gives to a consumer, in issue
 * order. Consumers may finish batches in any order, but entries are deleted
 * from the shared buffer strictly in issue order: only the contiguous
 * acknowledged prefix of the ledger is ever retired. Each retirement
 * reports its entry count to the run loop and turns the retired entries
 * into producer callbacks, which run on the {@link CallbackDispatcher} so
 * user code never blocks sequencing.
 * <p>
 * The ledger and every producer's {@code lastAck} are touched by the loop
 * thread only; all other threads talk to it through its mailbox.
 *
 * @param <E> event payload type
 */
@Slf4j
public final class AckLoop<E> implements AutoCloseable {

    private final BlockingQueue<AckSignal<E>> mailbox = new LinkedBlockingQueue<>();

    private final RunLoopHandle runLoop;
    private final AckCallback queueAckCallback;
    private final CallbackDispatcher dispatcher;
    private final BatchPool<E> pool;
    private final ProducerAckResolver resolver = new ProducerAckResolver();
    private final RetirementMode retirementMode;
    private final Duration shutdownTimeout;

    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    /* set when run() starts */
    private volatile Thread loopThread;

    /* loop thread only */
    private final BatchList<E> pendingBatches = new BatchList<>();

    /* written by the loop thread, read by metrics() */
    private volatile int pendingBatchCount;
    private volatile long unackedEvents;
    private volatile long ackedEvents;
    private volatile long advancements;

    private AckLoop(final AckLoopConfig config,
                    final RunLoopHandle runLoop,
                    final AckCallback queueAckCallback,
                    final CallbackDispatcher dispatcher) {
        this.runLoop = Objects.requireNonNull(runLoop, "runLoop");
        this.queueAckCallback = queueAckCallback;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.pool = new BatchPool<>(config.getBatchPoolCapacity());
        this.retirementMode = config.getRetirementMode();
        this.shutdownTimeout = config.shutdownTimeout();
        this.executor = Executors.newSingleThreadExecutor(
                new NamedThreadFactory(config.getThreadNamePrefix() + "-loop"));
    }

    /**
     * Creates and starts an ack loop.
     *
     * @param config           sequencer settings
     * @param runLoop          receives deletion counts and backpressure releases
     * @param queueAckCallback optional; receives the total count of every advancement
     */
    public static <E> AckLoop<E> start(final AckLoopConfig config,
                                       final RunLoopHandle runLoop,
                                       final AckCallback queueAckCallback) {
        Objects.requireNonNull(config, "config");

        final CallbackDispatcher dispatcher = switch (config.getDispatchMode()) {
            case ASYNC -> new AsyncCallbackDispatcher(
                    config.getShutdownPolicy(),
                    config.shutdownTimeout(),
                    config.getThreadNamePrefix());
            case INLINE -> new InlineCallbackDispatcher();
        };

        final AckLoop<E> loop = new AckLoop<>(config, runLoop, queueAckCallback, dispatcher);
        loop.executor.execute(loop::run);
        return loop;
    }

    /**
     * Creates a batch over {@code count} entries of {@code buffer} starting at
     * {@code start}. When the consumer calls {@link AckBatch#done()} the batch
     * is acknowledged to this loop.
     */
    public AckBatch<E> newBatch(final List<QueueEntry<E>> buffer, final int start, final int count) {
        return pool.acquire(buffer, start, count, this::batchAcked);
    }

    /**
     * Hands issued batches to the loop. Ownership of the batches moves to the
     * loop; {@code batches} is left empty.
     */
    public void batchesIssued(final BatchList<E> batches) {
        if (batches.isEmpty()) return;

        final BatchList<E> handoff = new BatchList<>();
        handoff.concat(batches);
        post(new AckSignal.NewBatches<>(handoff));
    }

    public AckLoopMetrics metrics() {
        return new AckLoopMetrics(
                pendingBatchCount,
                unackedEvents,
                ackedEvents,
                advancements,
                dispatcher.pendingWaves());
    }

    public int pooledBatches() {
        return pool.available();
    }

    /**
     * Cancels the loop and waits for it and the callback dispatcher to stop.
     * Batches not yet retired are abandoned.
     * <p>
     * When called from an acknowledgment callback, which runs on the loop
     * thread or the dispatcher's runner, the cancellation is only posted.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            mailbox.add(new AckSignal.Shutdown<>());
        }
        if (Thread.currentThread() == loopThread || dispatcher.isCallbackThread()) {
            log.debug("Ack loop close requested from a callback; not waiting");
            executor.shutdown();
            return;
        }
        try {
            if (!stopped.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Ack loop did not stop within {}", shutdownTimeout);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for ack loop shutdown");
        }
        executor.shutdown();
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    private void batchAcked(final AckBatch<E> batch) {
        post(new AckSignal.BatchAcked<>(batch));
    }

    private void post(final AckSignal<E> signal) {
        if (closed.get()) {
            log.debug("Ack loop closed, ignoring {}", signal.getClass().getSimpleName());
            return;
        }
        mailbox.add(signal);
    }

    private void run() {
        loopThread = Thread.currentThread();
        log.info("Ack loop started");
        try {
            while (true) {
                final AckSignal<E> signal = mailbox.take();

                if (signal instanceof AckSignal.Shutdown) {
                    break;
                }
                if (signal instanceof AckSignal.NewBatches<E> newBatches) {
                    final long events = newBatches.batches().eventCount();
                    pendingBatches.concat(newBatches.batches());
                    unackedEvents += events;
                    pendingBatchCount = pendingBatches.size();
                } else if (signal instanceof AckSignal.BatchAcked<E> acked) {
                    acked.batch().markAcked();
                }

                // a batch may be done before it is appended, so check after both signals
                maybeAdvanceBatchPosition();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ack loop interrupted");
        } catch (final RuntimeException e) {
            log.error("Ack loop terminated by a hand-off contract violation", e);
            throw e;
        } finally {
            closed.set(true);
            if (!pendingBatches.isEmpty()) {
                log.info("Ack loop stopping with {} unacknowledged batches", pendingBatches.size());
            }
            dispatcher.close();
            stopped.countDown();
            log.info("Ack loop stopped");
        }
    }

    /**
     * Retires the acknowledged prefix of the ledger, if any.
     */
    private void maybeAdvanceBatchPosition() {
        int retiredBatches = 0;

        if (retirementMode == RetirementMode.PER_BATCH) {
            while (!pendingBatches.isEmpty() && pendingBatches.front().isAcked()) {
                final BatchList<E> single = new BatchList<>();
                single.append(pendingBatches.pop());
                retire(single);
                retiredBatches++;
            }
        } else {
            final BatchList<E> acked = collectAcked();
            retiredBatches = acked.size();
            if (retiredBatches > 0) {
                retire(acked);
            }
        }

        // freeing several batches at once may reopen room for blocked producers
        if (retiredBatches > 1) {
            runLoop.unblockProducers();
        }
    }

    private void retire(final BatchList<E> retired) {
        final int batchCount = retired.size();
        final int count = Math.toIntExact(retired.eventCount());

        if (queueAckCallback != null) {
            try {
                queueAckCallback.onAck(count);
            } catch (final RuntimeException e) {
                log.error("Queue ack callback failed", e);
            }
        }

        final List<Runnable> wave = resolver.resolve(retired);
        if (!wave.isEmpty()) {
            dispatcher.submit(wave);
        }

        while (!retired.isEmpty()) {
            pool.release(retired.pop());
        }

        unackedEvents -= count;
        ackedEvents += count;
        advancements++;
        pendingBatchCount = pendingBatches.size();

        log.debug("ackloop: retired {} batches, returning {} acked events to run loop", batchCount, count);
        runLoop.deleteEntries(count);
    }

    private BatchList<E> collectAcked() {
        final BatchList<E> acked = new BatchList<>();
        while (!pendingBatches.isEmpty() && pendingBatches.front().isAcked()) {
            acked.append(pendingBatches.pop());
        }
        return acked;
    }
}
