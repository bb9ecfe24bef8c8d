package com.phillippitts.genesis.service.hardware;

import com.phillippitts.genesis.exception.HardwareLinkException;
import com.phillippitts.genesis.util.LogSanitizer;
import com.phillippitts.genesis.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for the robot, used when no robot is attached and in tests.
 *
 * <p>Speech and motion are logged and take a simulated amount of time. Event memory values
 * are one-shot: a value queued with {@link #inject(String, Object)} is returned by exactly one
 * {@code getData} call, after which the key reads {@code null} again. Injected values survive
 * reconnects, since they live on the link rather than on a session.
 */
public class SimulatedHardwareLink implements HardwareLink {

    private static final Logger LOG = LogManager.getLogger(SimulatedHardwareLink.class);
    private static final double RECOGNITION_CONFIDENCE = 0.9;

    private final Duration speechTimePerChar;
    private final Duration motionTime;
    private final Map<String, Queue<Object>> memory = new ConcurrentHashMap<>();
    private final List<String> spoken = new CopyOnWriteArrayList<>();
    private final List<String> postures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean refuseConnections = new AtomicBoolean(false);
    private final AtomicInteger sessionsOpened = new AtomicInteger();
    private volatile SimulatedSession current;

    public SimulatedHardwareLink(Duration speechTimePerChar, Duration motionTime) {
        this.speechTimePerChar = speechTimePerChar;
        this.motionTime = motionTime;
    }

    /** Simulated link with instantaneous speech and motion. */
    public SimulatedHardwareLink() {
        this(Duration.ZERO, Duration.ZERO);
    }

    @Override
    public HardwareSession open(String host, int port) {
        if (refuseConnections.get()) {
            throw new HardwareLinkException("Simulated robot refused connection", host + ":" + port);
        }
        SimulatedSession session = new SimulatedSession(host + ":" + port);
        current = session;
        int count = sessionsOpened.incrementAndGet();
        LOG.info("Simulated robot session opened to {}:{} (session #{})", host, port, count);
        return session;
    }

    /** Queues a recognized utterance as the robot's speech recognizer would report it. */
    public void injectUtterance(String text) {
        inject(SensorEventKeys.WORD_RECOGNIZED, List.of(text, RECOGNITION_CONFIDENCE));
    }

    /** Queues a touch on one of the tactile sensors. */
    public void injectTouch(String key) {
        inject(key, 1);
    }

    /** Queues a one-shot value for an event key. */
    public void inject(String key, Object value) {
        memory.computeIfAbsent(key, k -> new ConcurrentLinkedQueue<>()).add(value);
    }

    /** Kills the current session, as if the network dropped. */
    public void dropConnection() {
        SimulatedSession session = current;
        if (session != null) {
            session.alive.set(false);
            LOG.info("Simulated robot connection dropped");
        }
    }

    /** Makes subsequent {@link #open} calls fail until reset. */
    public void setRefuseConnections(boolean refuse) {
        refuseConnections.set(refuse);
    }

    public List<String> spokenLines() {
        return List.copyOf(spoken);
    }

    public List<String> postures() {
        return List.copyOf(postures);
    }

    public int sessionsOpened() {
        return sessionsOpened.get();
    }

    private final class SimulatedSession implements HardwareSession {

        private final String address;
        private final AtomicBoolean alive = new AtomicBoolean(true);

        private SimulatedSession(String address) {
            this.address = address;
        }

        @Override
        public void say(String text) {
            ensureAlive("say");
            LOG.info("[robot] say: {}", LogSanitizer.truncate(text, 200));
            pause(speechTimePerChar.multipliedBy(text.length()));
            spoken.add(text);
            inject(SensorEventKeys.TEXT_DONE, 1);
        }

        @Override
        public void goToPosture(String posture, double speed) {
            ensureAlive("goToPosture");
            LOG.info("[robot] goToPosture: {} (speed {})", posture, speed);
            pause(motionTime);
            postures.add(posture);
        }

        @Override
        public Object getData(String key) {
            ensureAlive("getData");
            Queue<Object> values = memory.get(key);
            return values == null ? null : values.poll();
        }

        @Override
        public boolean isAlive() {
            return alive.get();
        }

        @Override
        public void close() {
            if (alive.compareAndSet(true, false)) {
                LOG.info("Simulated robot session to {} closed", address);
            }
        }

        private void ensureAlive(String operation) {
            if (!alive.get()) {
                throw new HardwareLinkException("Session closed; cannot " + operation, address);
            }
        }

        private void pause(Duration duration) {
            try {
                TimeUtils.sleep(duration);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HardwareLinkException("Interrupted during simulated command", address, e);
            }
        }
    }
}
