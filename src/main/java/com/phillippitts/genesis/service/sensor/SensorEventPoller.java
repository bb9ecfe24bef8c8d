package com.phillippitts.genesis.service.sensor;

import com.phillippitts.genesis.domain.SensorEvent;
import com.phillippitts.genesis.service.hardware.HardwareSession;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.util.LogSanitizer;
import com.phillippitts.genesis.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Samples the monitored event keys on a dedicated daemon thread and hands meaningful samples to
 * the dialogue executor.
 *
 * <p><b>Threading:</b> {@link HardwareSession#getData} blocks, so it is only ever called on the
 * poller thread. Delivery to the callback always goes through {@link Executor#execute}; the
 * poller never runs callback code itself. A rejected handoff is logged and counted, and the
 * event is dropped.
 *
 * <p><b>Edge triggering:</b> a key that keeps reporting the same meaningful value is delivered
 * once; it becomes eligible again after it reads as not meaningful or changes value.
 *
 * <p><b>Stopping:</b> the loop exits when {@link #stop(Duration)} sets the stop flag or the health
 * probe reports the link unhealthy. Both are checked once per pass and before each key.
 *
 * @since 1.0
 */
public final class SensorEventPoller {

    private static final Logger LOG = LogManager.getLogger(SensorEventPoller.class);
    private static final String THREAD_NAME = "sensor-event-poller";

    private final HardwareSession session;
    private final List<String> keys;
    private final SensorEventCallback callback;
    private final Executor dispatchExecutor;
    private final BooleanSupplier healthProbe;
    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final DialogueMetrics metrics;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    // Touched only by the poller thread
    private final Map<String, Object> lastDelivered = new HashMap<>();
    private volatile Thread thread;

    public SensorEventPoller(HardwareSession session,
                             List<String> keys,
                             SensorEventCallback callback,
                             Executor dispatchExecutor,
                             BooleanSupplier healthProbe,
                             Duration pollInterval,
                             Duration errorBackoff,
                             DialogueMetrics metrics) {
        this.session = Objects.requireNonNull(session, "session");
        this.keys = List.copyOf(keys);
        this.callback = Objects.requireNonNull(callback, "callback");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.healthProbe = Objects.requireNonNull(healthProbe, "healthProbe");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Starts the poller thread.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Sensor event poller already started");
        }
        Thread t = new Thread(this::pollLoop, THREAD_NAME);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /**
     * Requests the loop to stop and waits for the thread to exit.
     *
     * @param timeout upper bound on the wait
     * @return {@code true} if the thread has exited
     */
    public boolean stop(Duration timeout) {
        stopRequested.set(true);
        Thread t = thread;
        if (t == null || !t.isAlive()) {
            return true;
        }
        if (t == Thread.currentThread()) {
            return false;
        }
        try {
            t.join(timeout.toMillis());
            if (t.isAlive()) {
                LOG.warn("Sensor event poller did not terminate within {}ms; proceeding", timeout.toMillis());
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for sensor event poller to terminate");
            return false;
        }
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public SensorEventCallback callback() {
        return callback;
    }

    private void pollLoop() {
        LOG.info("Sensor event poller started: keys={}, interval={}ms", keys, pollInterval.toMillis());
        while (!stopRequested.get()) {
            try {
                if (!healthProbe.getAsBoolean()) {
                    LOG.warn("Hardware link unhealthy; sensor event poller exiting");
                    break;
                }
                pollOnce();
                TimeUtils.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Sensor event poller interrupted");
                break;
            } catch (RuntimeException e) {
                LOG.error("Sensor event poll loop failed; backing off {}ms", errorBackoff.toMillis(), e);
                if (!backOff()) {
                    break;
                }
            }
        }
        LOG.info("Sensor event poller stopped");
    }

    private void pollOnce() {
        for (String key : keys) {
            if (stopRequested.get()) {
                return;
            }
            pollKey(key);
        }
    }

    private void pollKey(String key) {
        Object value;
        try {
            value = session.getData(key);
        } catch (RuntimeException e) {
            LOG.debug("Failed to read event key {}: {}", key, e.getMessage());
            return;
        }
        if (!MeaningfulEventFilter.isMeaningful(key, value)) {
            lastDelivered.remove(key);
            return;
        }
        if (Objects.equals(lastDelivered.get(key), value)) {
            return;
        }
        lastDelivered.put(key, value);
        dispatch(new SensorEvent(key, value, null));
    }

    private void dispatch(SensorEvent event) {
        LOG.debug("Sensor event {}: {}", event.eventName(), LogSanitizer.preview(event.value()));
        try {
            dispatchExecutor.execute(() -> deliver(event));
            metrics.recordSensorEvent(event.eventName());
        } catch (RejectedExecutionException e) {
            LOG.warn("Dialogue executor rejected sensor event {}; dropping it", event.eventName());
            metrics.recordRejectedHandoff(event.eventName());
        }
    }

    private void deliver(SensorEvent event) {
        try {
            if (callback instanceof AsyncSensorEventCallback async) {
                CompletionStage<?> stage = async.onSensorEventAsync(event);
                if (stage != null) {
                    stage.whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.error("Async sensor callback failed for {}", event.eventName(), error);
                        }
                    });
                }
            } else {
                callback.onSensorEvent(event);
            }
        } catch (RuntimeException e) {
            LOG.error("Sensor callback failed for {}", event.eventName(), e);
        }
    }

    private boolean backOff() {
        try {
            TimeUtils.sleep(errorBackoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
