package com.phillippitts.genesis.service.dialogue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry of detached, in-flight turns. Turns have no result channel back to the poller; this
 * registry exists so shutdown can wait for them.
 */
public final class TurnTracker {

    private static final Logger LOG = LogManager.getLogger(TurnTracker.class);

    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closing = new AtomicBoolean(false);

    /**
     * Tracks a turn until it completes.
     */
    public void track(CompletableFuture<?> turn) {
        inFlight.add(turn);
        turn.whenComplete((ignored, error) -> inFlight.remove(turn));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /** {@code true} once shutdown has begun; no new turns should start. */
    public boolean isClosing() {
        return closing.get();
    }

    /**
     * Stops accepting turns, waits up to {@code grace} for in-flight turns, then cancels the rest.
     *
     * @return number of turns cancelled because they outlived the grace period
     */
    public int shutdown(Duration grace) {
        closing.set(true);
        List<CompletableFuture<?>> pending = List.copyOf(inFlight);
        if (pending.isEmpty()) {
            return 0;
        }
        LOG.info("Waiting up to {}ms for {} in-flight turn(s)", grace.toMillis(), pending.size());
        long deadline = System.nanoTime() + grace.toNanos();
        for (CompletableFuture<?> turn : pending) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                turn.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                LOG.warn("In-flight turns did not finish within {}ms", grace.toMillis());
                break;
            } catch (ExecutionException | CancellationException e) {
                LOG.debug("Turn ended abnormally during shutdown: {}", e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for in-flight turns");
                break;
            }
        }
        int cancelled = 0;
        for (CompletableFuture<?> turn : pending) {
            if (!turn.isDone() && turn.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            LOG.warn("Cancelled {} turn(s) still running after the grace period", cancelled);
        }
        return cancelled;
    }
}
