package com.ayjx.core.schedule;

import com.ayjx.common.infra.NamedThreads;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs tasks at times chosen by a {@link NextRunCalculator}.
 * <p>
 * Each schedule is a chain of one-shot executions: compute the next fire
 * time, wait for it (or run at once if already due), run the task, compute
 * again. Task failures are logged and do not end the schedule; an
 * interrupted run does, and the schedule is dropped.
 */
@Slf4j
public class TaskScheduler implements AutoCloseable {

    private static final class Entry {
        final long id;
        final NextRunCalculator calculator;
        final ScheduledTask task;
        ZonedDateTime lastTarget;
        ScheduledFuture<?> current;
        boolean cancelled;

        Entry(long id, NextRunCalculator calculator, ScheduledTask task) {
            this.id = id;
            this.calculator = calculator;
            this.task = task;
        }
    }

    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public TaskScheduler() {
        this(Clock.systemDefaultZone(), 4);
    }

    public TaskScheduler(Clock clock, int threads) {
        this.clock = clock;
        this.executor = Executors.newScheduledThreadPool(threads, NamedThreads.daemon("scheduler"));
    }

    /**
     * Register a schedule.
     *
     * @return handle for {@link #remove(long)}
     */
    public long addSchedule(NextRunCalculator calculator, ScheduledTask task) {
        Entry entry = new Entry(nextId.getAndIncrement(), calculator, task);
        entries.put(entry.id, entry);
        arm(entry);
        return entry.id;
    }

    /** Run every {@code every}, the first time one period from now. */
    public long addInterval(Duration every, ScheduledTask task) {
        if (every.isNegative() || every.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + every);
        }
        return addSchedule(now -> Optional.of(now.plus(every)), task);
    }

    /** Run every day at {@code hour:minute:second} local time. */
    public long addDailyAt(int hour, int minute, int second, ScheduledTask task) {
        return addSchedule(DailyAt.of(hour, minute, second), task);
    }

    /**
     * Cancel a schedule, interrupting a run in progress.
     *
     * @return whether the handle was known
     */
    public boolean remove(long id) {
        Entry entry = entries.remove(id);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            entry.cancelled = true;
            if (entry.current != null) {
                entry.current.cancel(true);
            }
        }
        log.debug("[scheduler] removed task {}", id);
        return true;
    }

    public int size() {
        return entries.size();
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public void close() {
        List<Long> ids = new ArrayList<>(entries.keySet());
        for (Long id : ids) {
            remove(id);
        }
        executor.shutdownNow();
        log.info("[scheduler] stopped ({} task(s) cancelled)", ids.size());
    }

    private void arm(Entry entry) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        // never hand the calculator a time before the slot that just fired
        ZonedDateTime base = entry.lastTarget != null && now.isBefore(entry.lastTarget) ? entry.lastTarget : now;
        Optional<ZonedDateTime> next;
        try {
            next = entry.calculator.next(base);
        } catch (RuntimeException e) {
            log.error("[scheduler] task {} next-run calculation failed: {}", entry.id, e.getMessage(), e);
            next = Optional.empty();
        }
        if (next.isEmpty()) {
            entries.remove(entry.id);
            log.debug("[scheduler] task {} has no further runs", entry.id);
            return;
        }
        ZonedDateTime target = next.get();
        long delayMs = Math.max(0, Duration.between(now, target).toMillis());
        synchronized (entry) {
            if (entry.cancelled) {
                return;
            }
            entry.lastTarget = target;
            entry.current = executor.schedule(() -> fire(entry), delayMs, TimeUnit.MILLISECONDS);
        }
    }

    private void fire(Entry entry) {
        synchronized (entry) {
            if (entry.cancelled) {
                return;
            }
        }
        try {
            entry.task.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("[scheduler] task {} failed: {}", entry.id, e.getMessage(), e);
        }
        if (Thread.currentThread().isInterrupted()) {
            retire(entry);
            return;
        }
        arm(entry);
    }

    private void retire(Entry entry) {
        synchronized (entry) {
            entry.cancelled = true;
        }
        if (entries.remove(entry.id, entry)) {
            log.debug("[scheduler] task {} interrupted, schedule dropped", entry.id);
        }
    }
}
