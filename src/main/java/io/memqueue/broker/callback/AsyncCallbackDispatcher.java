package io.memqueue.broker.callback;

import io.memqueue.common.fifo.Fifo;
import io.memqueue.common.util.NamedThreadFactory;
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
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs callback waves off the submitting thread, one wave at a time.
 * <p>
 * A coordinator thread owns the backlog. It reads a single mailbox that
 * carries both submissions and wave-completion notices, so it only ever
 * waits in one place. While a wave runs on the runner thread, newly
 * submitted waves go to the backlog; each completion starts the next
 * backlog wave or marks the dispatcher idle.
 */
@Slf4j
public final class AsyncCallbackDispatcher implements CallbackDispatcher {

    private sealed interface Command permits Submit, WaveDone, Close {
    }

    private record Submit(List<Runnable> wave) implements Command {
    }

    private record WaveDone() implements Command {
    }

    private record Close() implements Command {
    }

    private static final Command WAVE_DONE = new WaveDone();
    private static final Command CLOSE = new Close();

    private final BlockingQueue<Command> mailbox = new LinkedBlockingQueue<>();
    private final ShutdownPolicy shutdownPolicy;
    private final Duration shutdownTimeout;

    private final ExecutorService coordinator;
    private final ExecutorService waveRunner;

    private final Object submitLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger pending = new AtomicInteger();
    private final CountDownLatch terminated = new CountDownLatch(1);

    /* set by the wave runner when it starts */
    private volatile Thread runnerThread;

    /* coordinator thread only */
    private final Fifo<List<Runnable>> backlog = new Fifo<>();
    private boolean waveInProgress;
    private boolean closing;

    public AsyncCallbackDispatcher(final ShutdownPolicy shutdownPolicy,
                                   final Duration shutdownTimeout,
                                   final String threadNamePrefix) {
        this.shutdownPolicy = Objects.requireNonNull(shutdownPolicy, "shutdownPolicy");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        this.coordinator = Executors.newSingleThreadExecutor(
                new NamedThreadFactory(threadNamePrefix + "-callback-coordinator"));
        this.waveRunner = Executors.newSingleThreadExecutor(
                new NamedThreadFactory(threadNamePrefix + "-callback-runner"));

        coordinator.execute(this::coordinate);
    }

    @Override
    public void submit(final List<Runnable> wave) {
        Objects.requireNonNull(wave, "wave");
        final List<Runnable> copy = List.copyOf(wave);
        // every accepted wave is queued ahead of CLOSE
        synchronized (submitLock) {
            if (closed.get()) {
                throw new IllegalStateException("dispatcher is closed");
            }
            pending.incrementAndGet();
            mailbox.add(new Submit(copy));
        }
    }

    @Override
    public boolean isCallbackThread() {
        return Thread.currentThread() == runnerThread;
    }

    @Override
    public int pendingWaves() {
        return pending.get();
    }

    /**
     * Stops accepting waves and waits for the dispatcher to finish. Called
     * from a callback, it only requests the shutdown: the runner cannot wait
     * for its own wave.
     */
    @Override
    public void close() {
        synchronized (submitLock) {
            if (closed.compareAndSet(false, true)) {
                mailbox.add(CLOSE);
            }
        }
        if (isCallbackThread()) {
            log.debug("Callback dispatcher close requested from a callback; not waiting");
            return;
        }
        try {
            if (!terminated.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Callback dispatcher did not finish within {}", shutdownTimeout);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for callback dispatcher shutdown");
        }
    }

    /**
     * @return true once the coordinator has exited and no wave is running
     */
    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    private void coordinate() {
        try {
            while (true) {
                final Command command = mailbox.take();

                if (command instanceof Submit submit) {
                    onSubmit(submit.wave());
                } else if (command instanceof WaveDone) {
                    onWaveDone();
                } else {
                    onClose();
                }

                if (closing && !waveInProgress) {
                    absorbLateSubmits();
                    if (!waveInProgress) break;
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Callback coordinator interrupted; {} queued waves abandoned", backlog.size());
        } finally {
            waveRunner.shutdown();
            try {
                if (!waveRunner.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Callback wave still running after {}", shutdownTimeout);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            coordinator.shutdown();
            terminated.countDown();
            log.info("Callback dispatcher stopped");
        }
    }

    private void onSubmit(final List<Runnable> wave) {
        if (closing) {
            // accepted before close() but read after CLOSE
            if (shutdownPolicy == ShutdownPolicy.DROP_PENDING) {
                pending.decrementAndGet();
                log.warn("Dropping callback wave of {} callbacks submitted during shutdown", wave.size());
                return;
            }
        }
        if (waveInProgress) {
            backlog.add(wave);
        } else {
            launch(wave);
        }
    }

    private void onWaveDone() {
        if (backlog.isEmpty()) {
            waveInProgress = false;
        } else {
            launch(backlog.consumeFirst());
        }
    }

    private void onClose() {
        closing = true;
        if (shutdownPolicy == ShutdownPolicy.DROP_PENDING && !backlog.isEmpty()) {
            log.warn("Dropping {} queued callback waves on shutdown", backlog.size());
            pending.addAndGet(-backlog.size());
            backlog.clear();
        }
    }

    /**
     * Applies the shutdown policy to submissions still in the mailbox once
     * the dispatcher is idle and closing.
     */
    private void absorbLateSubmits() {
        Command late;
        while (!waveInProgress && (late = mailbox.poll()) != null) {
            if (late instanceof Submit submit) {
                onSubmit(submit.wave());
            }
        }
    }

    private void launch(final List<Runnable> wave) {
        waveInProgress = true;
        pending.decrementAndGet();
        waveRunner.execute(() -> {
            runnerThread = Thread.currentThread();
            try {
                CallbackRunner.runWave(wave);
            } finally {
                mailbox.add(WAVE_DONE);
            }
        });
    }
}
