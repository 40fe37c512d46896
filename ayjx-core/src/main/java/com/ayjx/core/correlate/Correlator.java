package com.ayjx.core.correlate;

import com.ayjx.common.infra.NamedThreads;
import com.ayjx.core.event.CorrelationKey;
import com.ayjx.core.event.OneBotEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Table of pending waiters that inbound events are offered to before they
 * reach the plugin pipeline.
 * <p>
 * Every waiter is single-use and carries a timeout; on expiry it is removed
 * and its future completes with {@link Optional#empty()}. An event satisfies
 * at most one waiter: the earliest registered one whose condition matches.
 * Echo waiters only see events carrying an echo token, subject waiters only
 * see events without one, so a reply can never be stolen by a subject wait.
 * <p>
 * All state sits behind one monitor that is never held while a future is
 * completed.
 */
@Slf4j
public class Correlator implements AutoCloseable {

    private static final class Waiter {
        final WaitCondition condition;
        final CompletableFuture<Optional<OneBotEvent>> future = new CompletableFuture<>();
        ScheduledFuture<?> timer;

        Waiter(WaitCondition condition) {
            this.condition = condition;
        }
    }

    private final List<Waiter> waiters = new ArrayList<>();
    private final ScheduledExecutorService timers;
    private final boolean ownsTimers;
    private boolean closed;

    public Correlator() {
        this(Executors.newSingleThreadScheduledExecutor(NamedThreads.daemon("correlator-timer")), true);
    }

    public Correlator(ScheduledExecutorService timers) {
        this(timers, false);
    }

    private Correlator(ScheduledExecutorService timers, boolean ownsTimers) {
        this.timers = timers;
        this.ownsTimers = ownsTimers;
    }

    /**
     * Register a waiter. Cancelling the returned future removes the waiter
     * immediately. After {@link #close()} the future is already resolved
     * with "no answer".
     */
    public CompletableFuture<Optional<OneBotEvent>> expect(WaitCondition condition, Duration timeout) {
        Waiter waiter = new Waiter(condition);
        synchronized (waiters) {
            if (closed) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            try {
                waiter.timer = timers.schedule(() -> expire(waiter), timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("[correlator] timer rejected, resolving waiter immediately");
                return CompletableFuture.completedFuture(Optional.empty());
            }
            waiters.add(waiter);
        }
        waiter.future.whenComplete((event, error) -> {
            if (waiter.future.isCancelled()) {
                remove(waiter);
            }
        });
        return waiter.future;
    }

    /**
     * Block until a matching event arrives or the timeout elapses.
     *
     * @return the event, or empty on timeout
     */
    public Optional<OneBotEvent> await(WaitCondition condition, Duration timeout) throws InterruptedException {
        CompletableFuture<Optional<OneBotEvent>> future = expect(condition, timeout);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            return Optional.empty();
        }
    }

    public CompletableFuture<Optional<OneBotEvent>> waitForReply(String echo, Duration timeout) {
        return expect(new WaitCondition.ForEcho(echo), timeout);
    }

    public CompletableFuture<Optional<OneBotEvent>> waitForMessage(Long groupId, Long userId, Duration timeout) {
        return expect(new WaitCondition.ForSubject(groupId, userId), timeout);
    }

    /**
     * Offer an event to the waiters.
     *
     * @return empty if a waiter consumed the event, otherwise the event
     *         itself for the caller to pass on
     */
    public Optional<OneBotEvent> dispatch(OneBotEvent event) {
        CorrelationKey key = event.correlationKey();
        if (key instanceof CorrelationKey.None) {
            return Optional.of(event);
        }
        while (true) {
            Waiter matched = null;
            synchronized (waiters) {
                Iterator<Waiter> it = waiters.iterator();
                while (it.hasNext()) {
                    Waiter waiter = it.next();
                    if (!waiter.future.isDone() && waiter.condition.matches(key)) {
                        it.remove();
                        matched = waiter;
                        break;
                    }
                }
            }
            if (matched == null) {
                return Optional.of(event);
            }
            matched.timer.cancel(false);
            if (matched.future.complete(Optional.of(event))) {
                return Optional.empty();
            }
            // cancelled by its caller between the scan and here; try the next one
        }
    }

    public int pendingCount() {
        synchronized (waiters) {
            return waiters.size();
        }
    }

    /** Resolve every pending waiter with "no answer". */
    @Override
    public void close() {
        List<Waiter> drained;
        synchronized (waiters) {
            closed = true;
            drained = new ArrayList<>(waiters);
            waiters.clear();
        }
        for (Waiter waiter : drained) {
            waiter.timer.cancel(false);
            waiter.future.complete(Optional.empty());
        }
        if (ownsTimers) {
            timers.shutdownNow();
        }
        if (!drained.isEmpty()) {
            log.debug("[correlator] closed with {} pending waiter(s)", drained.size());
        }
    }

    private void expire(Waiter waiter) {
        if (remove(waiter)) {
            waiter.future.complete(Optional.empty());
        }
    }

    private boolean remove(Waiter waiter) {
        synchronized (waiters) {
            return waiters.remove(waiter);
        }
    }
}
