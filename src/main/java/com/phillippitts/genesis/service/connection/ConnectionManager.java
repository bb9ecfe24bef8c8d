package com.phillippitts.genesis.service.connection;

import com.phillippitts.genesis.config.properties.HardwareProperties;
import com.phillippitts.genesis.domain.ConnectionState;
import com.phillippitts.genesis.exception.HardwareLinkException;
import com.phillippitts.genesis.service.connection.event.ConnectionLostEvent;
import com.phillippitts.genesis.service.connection.event.ConnectionRestoredEvent;
import com.phillippitts.genesis.service.hardware.HardwareLink;
import com.phillippitts.genesis.service.hardware.HardwareSession;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.service.sensor.SensorEventCallback;
import com.phillippitts.genesis.service.sensor.SensorEventPoller;
import com.phillippitts.genesis.util.LogSanitizer;
import com.phillippitts.genesis.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns the hardware link session: connect, health check, reconnect with resubscribe, and
 * disconnect. Every robot command goes through here.
 *
 * <p><b>Threading:</b> handshakes, speech, motion and close run on the hardware executor,
 * never on the caller's thread. The sensor event poller runs on its own thread and hands
 * events to the dialogue executor.
 *
 * <p><b>Gating:</b> while the state is not {@link ConnectionState#CONNECTED}, speech and motion
 * are logged no-ops that complete normally. A command that the robot itself rejects completes
 * its future exceptionally.
 *
 * <p>None of the lifecycle methods throw; connect failures complete with {@code false}.
 *
 * @since 1.0
 */
public class ConnectionManager implements RobotOutput {

    private static final Logger LOG = LogManager.getLogger(ConnectionManager.class);

    private final HardwareLink link;
    private final HardwareProperties props;
    private final Executor hardwareExecutor;
    private final Executor dialogueExecutor;
    private final ApplicationEventPublisher publisher;
    private final DialogueMetrics metrics;

    private final ConnectionStateMachine stateMachine = new ConnectionStateMachine();
    private final Lock pollerLock = new ReentrantLock();
    private final AtomicReference<SensorEventCallback> latestCallback = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Boolean>> pendingConnect = new AtomicReference<>();
    private volatile HardwareSession session;
    private SensorEventPoller poller; // guarded by pollerLock

    public ConnectionManager(HardwareLink link,
                             HardwareProperties props,
                             Executor hardwareExecutor,
                             Executor dialogueExecutor,
                             ApplicationEventPublisher publisher,
                             DialogueMetrics metrics) {
        this.link = Objects.requireNonNull(link, "link");
        this.props = Objects.requireNonNull(props, "props");
        this.hardwareExecutor = Objects.requireNonNull(hardwareExecutor, "hardwareExecutor");
        this.dialogueExecutor = Objects.requireNonNull(dialogueExecutor, "dialogueExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Opens a session on the hardware executor.
     *
     * <p>If an attempt is already in flight its future is returned. If already connected the
     * returned future is complete with {@code true}.
     *
     * @return future completing with whether a session is now available
     */
    public CompletableFuture<Boolean> connect() {
        if (!stateMachine.beginConnect()) {
            CompletableFuture<Boolean> pending = pendingConnect.get();
            if (pending != null && !pending.isDone()) {
                return pending;
            }
            return CompletableFuture.completedFuture(stateMachine.isConnected());
        }
        CompletableFuture<Boolean> attempt = new CompletableFuture<>();
        pendingConnect.set(attempt);
        try {
            hardwareExecutor.execute(() -> attempt.complete(openSession()));
        } catch (RejectedExecutionException e) {
            LOG.warn("Hardware executor rejected connect attempt to {}:{}", props.getHost(), props.getPort());
            stateMachine.connectFailed();
            attempt.complete(false);
        }
        return attempt;
    }

    /**
     * Cheap health read: connected and the session reports alive. A dead session moves the state
     * to DISCONNECTED and publishes a {@link ConnectionLostEvent}.
     */
    public boolean isHealthy() {
        if (!stateMachine.isConnected()) {
            return false;
        }
        HardwareSession current = session;
        boolean alive;
        try {
            alive = current != null && current.isAlive();
        } catch (RuntimeException e) {
            LOG.debug("Session liveness check failed: {}", e.getMessage());
            alive = false;
        }
        if (!alive && stateMachine.disconnected()) {
            LOG.warn("Hardware link session to {} lost", props.getHost());
            publisher.publishEvent(new ConnectionLostEvent(props.getHost(), Instant.now(), "session not alive"));
        }
        return alive;
    }

    /**
     * Tears down any stale session and connects again. Callers re-arm the poller with
     * {@link #resubscribe()} after success.
     *
     * @return future completing with whether the reconnect succeeded
     */
    public CompletableFuture<Boolean> reconnect() {
        LOG.info("Reconnecting to robot at {}:{}", props.getHost(), props.getPort());
        return runOnHardware(this::teardown)
                .thenCompose(ignored -> connect())
                .thenApply(connected -> {
                    if (connected) {
                        publisher.publishEvent(new ConnectionRestoredEvent(props.getHost(), Instant.now()));
                    }
                    return connected;
                })
                .exceptionally(e -> {
                    LOG.warn("Reconnect to {} failed", props.getHost(), e);
                    return false;
                });
    }

    /**
     * Remembers the callback and starts polling the current session for it.
     *
     * @throws HardwareLinkException if not connected
     */
    public void subscribe(SensorEventCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (!stateMachine.isConnected()) {
            throw new HardwareLinkException("Cannot subscribe while " + stateMachine.current(), props.getHost());
        }
        latestCallback.set(callback);
        startPoller(callback);
    }

    /**
     * Re-arms the poller with the most recently subscribed callback.
     *
     * @return {@code true} if a poller was started
     */
    public boolean resubscribe() {
        SensorEventCallback callback = latestCallback.get();
        if (callback == null) {
            LOG.debug("No callback subscribed yet; nothing to re-arm");
            return false;
        }
        if (!stateMachine.isConnected()) {
            LOG.warn("Cannot re-arm sensor event poller while {}", stateMachine.current());
            return false;
        }
        startPoller(callback);
        return true;
    }

    /**
     * Stops the poller (bounded wait) and closes the session.
     */
    public CompletableFuture<Void> disconnect() {
        return runOnHardware(() -> {
            teardown();
            LOG.info("Disconnected from robot at {}", props.getHost());
        });
    }

    @Override
    public CompletableFuture<Void> speak(String text) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        String command = speechCommand(text);
        return command("speak", session -> session.say(command),
                () -> LogSanitizer.truncate(text, LogSanitizer.PREVIEW_CHARS));
    }

    @Override
    public CompletableFuture<Void> moveToPosture(String posture, double speed) {
        if (posture == null || posture.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        return command("moveToPosture", session -> session.goToPosture(posture, speed), () -> posture);
    }

    public ConnectionState state() {
        return stateMachine.current();
    }

    public String host() {
        return props.getHost();
    }

    public boolean isPolling() {
        pollerLock.lock();
        try {
            return poller != null && poller.isRunning();
        } finally {
            pollerLock.unlock();
        }
    }

    /** The callback the poller is (or will be) re-armed with. */
    public SensorEventCallback currentCallback() {
        return latestCallback.get();
    }

    private boolean openSession() {
        LOG.info("Connecting to robot at {}:{}", props.getHost(), props.getPort());
        long start = System.nanoTime();
        try {
            session = link.open(props.getHost(), props.getPort());
            stateMachine.connected();
            LOG.info("Connected to robot at {}:{} in {}ms", props.getHost(), props.getPort(),
                    TimeUtils.elapsedMillis(start));
            return true;
        } catch (RuntimeException e) {
            stateMachine.connectFailed();
            LOG.warn("Failed to connect to robot at {}:{}: {}", props.getHost(), props.getPort(), e.getMessage());
            return false;
        }
    }

    private CompletableFuture<Void> command(String operation,
                                            Consumer<HardwareSession> action,
                                            Supplier<String> detail) {
        if (!stateMachine.isConnected()) {
            LOG.info("Not connected ({}); skipping {}: {}", stateMachine.current(), operation, detail.get());
            return CompletableFuture.completedFuture(null);
        }
        return runOnHardware(() -> {
            HardwareSession current = session;
            if (current == null || !stateMachine.isConnected()) {
                LOG.info("Connection dropped before {} ran; skipping: {}", operation, detail.get());
                return;
            }
            action.accept(current);
        });
    }

    private void startPoller(SensorEventCallback callback) {
        pollerLock.lock();
        try {
            stopPollerLocked();
            SensorEventPoller next = new SensorEventPoller(
                    session,
                    props.getMonitoredEvents(),
                    callback,
                    dialogueExecutor,
                    this::isHealthy,
                    props.pollInterval(),
                    props.errorBackoff(),
                    metrics);
            next.start();
            poller = next;
        } finally {
            pollerLock.unlock();
        }
    }

    private void stopPoller() {
        pollerLock.lock();
        try {
            stopPollerLocked();
        } finally {
            pollerLock.unlock();
        }
    }

    private void stopPollerLocked() {
        if (poller != null) {
            poller.stop(props.pollerJoinTimeout());
            poller = null;
        }
    }

    private void teardown() {
        stopPoller();
        stateMachine.disconnected();
        HardwareSession stale = session;
        session = null;
        if (stale != null) {
            try {
                stale.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing hardware session: {}", e.getMessage());
            }
        }
    }

    private CompletableFuture<Void> runOnHardware(Runnable task) {
        try {
            return CompletableFuture.runAsync(task, hardwareExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new HardwareLinkException("Hardware executor rejected command", props.getHost(), e));
        }
    }

    private String speechCommand(String text) {
        int speed = props.getSpeechSpeed();
        return speed > 0 ? "\\rspd=" + speed + "\\ " + text : text;
    }
}
