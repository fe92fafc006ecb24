package io.cronos.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires registered callbacks at each occurrence of their cron schedule.
 *
 * <p>A single dispatcher thread waits on a delay queue of pending fires; every fire is handed to the worker pool,
 * so callbacks run in parallel with each other and with registrations. Triggers registered before
 * {@link #start()} get their next occurrence computed immediately but only start firing once the scheduler runs.
 * A stopped scheduler cannot be restarted.
 */
public final class TriggerScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TriggerScheduler.class);
    private static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);

    private final Clock clock;
    private final ZoneId zone;
    private final ExecutorService workers;
    private final DelayQueue<PendingFire> queue = new DelayQueue<>();
    private final Map<Long, Trigger> triggers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object lifecycle = new Object();

    private volatile boolean running;
    private boolean stopped;
    private Thread dispatcher;

    public TriggerScheduler(Clock clock, ZoneId zone) {
        this(clock, zone, Executors.newCachedThreadPool(workerThreads()));
    }

    TriggerScheduler(Clock clock, ZoneId zone, ExecutorService workers) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
    }

    public TriggerHandle register(CronSchedule schedule, Runnable callback) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        Instant next = schedule.nextAfter(clock.instant(), zone)
            .orElseThrow(() -> new ScheduleException(schedule.expression(), "cron expression never fires: " + schedule));
        Trigger trigger = new Trigger(sequence.incrementAndGet(), schedule, callback, next);
        synchronized (lifecycle) {
            triggers.put(trigger.id, trigger);
            if (running) {
                queue.offer(new PendingFire(trigger.id, next, clock));
            }
        }
        return new TriggerHandle(trigger.id);
    }

    public boolean unregister(TriggerHandle handle) {
        if (handle == null) {
            return false;
        }
        synchronized (lifecycle) {
            queue.removeIf(fire -> fire.triggerId == handle.id());
            return triggers.remove(handle.id()) != null;
        }
    }

    public boolean isRegistered(TriggerHandle handle) {
        return handle != null && triggers.containsKey(handle.id());
    }

    public Optional<Instant> nextFire(TriggerHandle handle) {
        if (handle == null) {
            return Optional.empty();
        }
        Trigger trigger = triggers.get(handle.id());
        return trigger == null ? Optional.empty() : Optional.ofNullable(trigger.next);
    }

    public int size() {
        return triggers.size();
    }

    int pendingFires() {
        return queue.size();
    }

    public boolean isRunning() {
        return running;
    }

    public void start() {
        synchronized (lifecycle) {
            if (running) {
                return;
            }
            if (stopped) {
                throw new IllegalStateException("scheduler has been stopped");
            }
            running = true;
            Instant now = clock.instant();
            for (Trigger trigger : triggers.values()) {
                trigger.next = trigger.schedule.nextAfter(now, zone).orElse(null);
                if (trigger.next != null) {
                    queue.offer(new PendingFire(trigger.id, trigger.next, clock));
                }
            }
            dispatcher = new Thread(this::dispatchLoop, "cronos-trigger-dispatcher");
            dispatcher.setDaemon(true);
            dispatcher.start();
        }
        LOG.debug("Trigger scheduler started with {} triggers", triggers.size());
    }

    public boolean stop(Duration grace) {
        synchronized (lifecycle) {
            if (stopped) {
                return true;
            }
            running = false;
            stopped = true;
            if (dispatcher != null) {
                dispatcher.interrupt();
            }
            queue.clear();
        }
        workers.shutdown();
        try {
            if (workers.awaitTermination(Math.max(1, grace.toMillis()), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOG.warn("Job executions still running after {}; interrupting", grace);
            workers.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            return false;
        }
    }

    @Override
    public void close() {
        stop(DEFAULT_GRACE);
    }

    private void dispatchLoop() {
        while (running) {
            try {
                PendingFire fire = queue.take();
                Trigger trigger = triggers.get(fire.triggerId);
                if (trigger == null) {
                    continue;
                }
                Instant base = clock.instant().isAfter(fire.at) ? clock.instant() : fire.at;
                Instant next = trigger.schedule.nextAfter(base, zone).orElse(null);
                trigger.next = next;
                synchronized (lifecycle) {
                    // unregistered while the next occurrence was computed
                    if (next != null && triggers.containsKey(trigger.id)) {
                        queue.offer(new PendingFire(trigger.id, next, clock));
                    }
                }
                workers.execute(() -> runCallback(trigger));
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
            } catch (RejectedExecutionException e) {
                break;
            }
        }
    }

    private void runCallback(Trigger trigger) {
        try {
            trigger.callback.run();
        } catch (RuntimeException e) {
            LOG.error("Trigger {} ({}) callback failed", trigger.id, trigger.schedule, e);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cronos-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Trigger {
        private final long id;
        private final CronSchedule schedule;
        private final Runnable callback;
        private volatile Instant next;

        private Trigger(long id, CronSchedule schedule, Runnable callback, Instant next) {
            this.id = id;
            this.schedule = schedule;
            this.callback = callback;
            this.next = next;
        }
    }

    private static final class PendingFire implements Delayed {
        private final long triggerId;
        private final Instant at;
        private final Clock clock;

        private PendingFire(long triggerId, Instant at, Clock clock) {
            this.triggerId = triggerId;
            this.at = at;
            this.clock = clock;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(at.toEpochMilli() - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return at.compareTo(((PendingFire) other).at);
        }
    }
}
