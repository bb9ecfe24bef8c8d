package com.phillippitts.genesis.service.sensor;

import com.phillippitts.genesis.domain.SensorEvent;
import com.phillippitts.genesis.service.hardware.HardwareSession;
import com.phillippitts.genesis.service.hardware.SensorEventKeys;
import com.phillippitts.genesis.service.hardware.SimulatedHardwareLink;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.testutil.RejectingExecutor;
import com.phillippitts.genesis.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SensorEventPollerTest {

    private static final Duration INTERVAL = Duration.ofMillis(5);

    private SimulatedHardwareLink link;
    private HardwareSession session;
    private SimpleMeterRegistry registry;
    private DialogueMetrics metrics;
    private List<SensorEvent> received;
    private SensorEventPoller poller;

    @BeforeEach
    void setUp() {
        link = new SimulatedHardwareLink();
        session = link.open("robot.local", 9559);
        registry = new SimpleMeterRegistry();
        metrics = new DialogueMetrics(registry);
        received = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (poller != null) {
            poller.stop(Duration.ofSeconds(1));
        }
    }

    private SensorEventPoller poller(java.util.concurrent.Executor executor, AtomicBoolean healthy) {
        return new SensorEventPoller(session, SensorEventKeys.DEFAULT_MONITORED, received::add, executor,
                healthy::get, INTERVAL, Duration.ofMillis(10), metrics);
    }

    @Test
    void shouldDeliverRecognizedUtterance() {
        // Arrange
        poller = poller(new SyncExecutor(), new AtomicBoolean(true));
        poller.start();

        // Act
        link.injectUtterance("what time is it");

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> !received.isEmpty());
        SensorEvent event = received.get(0);
        assertThat(event.eventName()).isEqualTo(SensorEventKeys.WORD_RECOGNIZED);
        assertThat((List<?>) event.value()).first().isEqualTo("what time is it");
        assertThat(registry.get("genesis.sensor.events").tag("event", SensorEventKeys.WORD_RECOGNIZED)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldIgnoreSamplesThatAreNotMeaningful() throws InterruptedException {
        // Arrange
        poller = poller(new SyncExecutor(), new AtomicBoolean(true));
        link.inject(SensorEventKeys.FRONT_HEAD_TOUCHED, 0);
        link.inject(SensorEventKeys.WORD_RECOGNIZED, List.of("", 0.1));

        // Act
        poller.start();
        Thread.sleep(100);

        // Assert
        assertThat(received).isEmpty();
    }

    @Test
    void shouldDeliverRepeatedValueOnceUntilItChanges() {
        // Arrange
        poller = poller(new SyncExecutor(), new AtomicBoolean(true));
        link.inject("BatteryLow", true);
        link.inject("BatteryLow", true);
        link.inject("BatteryLow", 2);

        // Act
        poller.start();

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> received.size() >= 2);
        assertThat(received).extracting(SensorEvent::value).containsExactly(true, 2);
    }

    @Test
    void shouldCountRejectedHandoffsAndKeepPolling() {
        // Arrange
        RejectingExecutor executor = new RejectingExecutor();
        poller = poller(executor, new AtomicBoolean(true));
        poller.start();

        // Act
        link.injectUtterance("hello");
        link.injectTouch(SensorEventKeys.REAR_HEAD_TOUCHED);

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.rejectedCount() >= 2);
        assertThat(received).isEmpty();
        assertThat(poller.isRunning()).isTrue();
        assertThat(registry.get("genesis.sensor.rejected").tag("event", SensorEventKeys.WORD_RECOGNIZED)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldKeepRunningWhenCallbackThrows() {
        // Arrange
        List<SensorEvent> seen = new CopyOnWriteArrayList<>();
        poller = new SensorEventPoller(session, SensorEventKeys.DEFAULT_MONITORED, event -> {
            seen.add(event);
            throw new IllegalStateException("handler bug");
        }, new SyncExecutor(), () -> true, INTERVAL, Duration.ofMillis(10), metrics);
        poller.start();

        // Act
        link.injectUtterance("first");
        await().atMost(Duration.ofSeconds(2)).until(() -> seen.size() == 1);
        link.injectUtterance("second");

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> seen.size() == 2);
        assertThat(poller.isRunning()).isTrue();
    }

    @Test
    void shouldExitWhenHealthProbeFails() {
        // Arrange
        AtomicBoolean healthy = new AtomicBoolean(true);
        poller = poller(new SyncExecutor(), healthy);
        poller.start();
        await().atMost(Duration.ofSeconds(2)).until(poller::isRunning);

        // Act
        healthy.set(false);

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> !poller.isRunning());
    }

    @Test
    void shouldStopWithinTimeout() {
        poller = poller(new SyncExecutor(), new AtomicBoolean(true));
        poller.start();

        assertThat(poller.stop(Duration.ofSeconds(1))).isTrue();
        assertThat(poller.isRunning()).isFalse();
    }

    @Test
    void shouldRejectSecondStart() {
        poller = poller(new SyncExecutor(), new AtomicBoolean(true));
        poller.start();

        assertThatThrownBy(poller::start).isInstanceOf(IllegalStateException.class);
    }
}
