package io.cronos.core.sync;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loop on its own thread interleaving two periodic ticks: save every {@code saveInterval} and,
 * when a backup task is given, backup every {@code backupInterval}.
 *
 * <p>Tick failures are logged and retried on the next tick. Cancellation is observed between ticks; a tick in
 * progress always completes. Once {@link SyncState#STOPPED} the loop never runs again.
 */
public final class SyncLoop {
    private static final Logger LOG = LoggerFactory.getLogger(SyncLoop.class);

    private final SyncTask saveTask;
    private final long saveNanos;
    private final SyncTask backupTask;
    private final long backupNanos;
    private final CancellationToken token = new CancellationToken();
    private final CountDownLatch exited = new CountDownLatch(1);
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.RUNNING);
    private final AtomicLong saveTicks = new AtomicLong();
    private final AtomicLong backupTicks = new AtomicLong();

    private SyncLoop(SyncTask saveTask, Duration saveInterval, SyncTask backupTask, Duration backupInterval) {
        this.saveTask = Objects.requireNonNull(saveTask, "saveTask must not be null");
        this.saveNanos = positive(saveInterval, "saveInterval");
        this.backupTask = backupTask;
        this.backupNanos = backupTask == null ? 0 : positive(backupInterval, "backupInterval");
    }

    public static SyncLoop start(SyncTask saveTask, Duration saveInterval, SyncTask backupTask, Duration backupInterval) {
        SyncLoop loop = new SyncLoop(saveTask, saveInterval, backupTask, backupInterval);
        Thread thread = new Thread(loop::run, "cronos-sync");
        thread.setDaemon(true);
        thread.start();
        return loop;
    }

    public SyncState state() {
        return state.get();
    }

    public boolean backupEnabled() {
        return backupTask != null;
    }

    public long saveTicks() {
        return saveTicks.get();
    }

    public long backupTicks() {
        return backupTicks.get();
    }

    public void cancel() {
        if (state.compareAndSet(SyncState.RUNNING, SyncState.STOPPING)) {
            token.cancel("cancelled");
        }
    }

    public void cancelAndJoin() throws InterruptedException {
        cancel();
        exited.await();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return exited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void run() {
        LOG.debug("Sync loop started (save every {} ms, backup {})",
            TimeUnit.NANOSECONDS.toMillis(saveNanos),
            backupTask == null ? "disabled" : "every " + TimeUnit.NANOSECONDS.toMillis(backupNanos) + " ms");
        try {
            long start = System.nanoTime();
            long nextSave = start + saveNanos;
            long nextBackup = start + backupNanos;
            while (!token.isCancelled()) {
                long now = System.nanoTime();
                long wait = nextSave - now;
                if (backupTask != null) {
                    wait = Math.min(wait, nextBackup - now);
                }
                if (wait > 0 && token.await(wait, TimeUnit.NANOSECONDS)) {
                    break;
                }

                now = System.nanoTime();
                if (now - nextSave >= 0) {
                    tick("save", saveTask);
                    saveTicks.incrementAndGet();
                    nextSave = advance(nextSave, saveNanos, now);
                }
                if (token.isCancelled()) {
                    break;
                }
                if (backupTask != null && now - nextBackup >= 0) {
                    tick("backup", backupTask);
                    backupTicks.incrementAndGet();
                    nextBackup = advance(nextBackup, backupNanos, now);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state.set(SyncState.STOPPED);
            exited.countDown();
            LOG.debug("Sync loop stopped");
        }
    }

    private static void tick(String name, SyncTask task) throws InterruptedException {
        try {
            task.run();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOG.warn("Background {} failed, retrying on next tick", name, e);
        }
    }

    // missed ticks are dropped rather than replayed
    private static long advance(long scheduled, long interval, long now) {
        long next = scheduled + interval;
        return next - now > 0 ? next : now + interval;
    }

    private static long positive(Duration interval, String name) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return interval.toNanos();
    }
}
