package com.phillippitts.genesis.service.connection;

import com.phillippitts.genesis.config.ThreadPoolConfig;
import com.phillippitts.genesis.config.properties.HardwareProperties;
import com.phillippitts.genesis.config.properties.ThreadPoolProperties;
import com.phillippitts.genesis.domain.ConnectionState;
import com.phillippitts.genesis.domain.SensorEvent;
import com.phillippitts.genesis.exception.HardwareLinkException;
import com.phillippitts.genesis.service.connection.event.ConnectionLostEvent;
import com.phillippitts.genesis.service.connection.event.ConnectionRestoredEvent;
import com.phillippitts.genesis.service.hardware.SensorEventKeys;
import com.phillippitts.genesis.service.hardware.SimulatedHardwareLink;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.testutil.EventCapturingPublisher;
import com.phillippitts.genesis.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ConnectionManagerTest {

    private SimulatedHardwareLink link;
    private HardwareProperties props;
    private EventCapturingPublisher publisher;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        link = new SimulatedHardwareLink();
        props = new HardwareProperties();
        props.setHost("pepper.local");
        props.setSpeechSpeed(0);
        props.setPollIntervalMs(5);
        props.setErrorBackoffMs(10);
        props.setPollerJoinTimeoutMs(1000);
        publisher = new EventCapturingPublisher();
        manager = new ConnectionManager(link, props, new SyncExecutor(), new SyncExecutor(), publisher,
                new DialogueMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() throws Exception {
        manager.disconnect().get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldConnectAndReportHealthy() throws Exception {
        // Act
        boolean connected = manager.connect().get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(connected).isTrue();
        assertThat(manager.state()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(manager.isHealthy()).isTrue();
        assertThat(link.sessionsOpened()).isEqualTo(1);
    }

    @Test
    void shouldCompleteWithFalseWhenRobotRefuses() throws Exception {
        // Arrange
        link.setRefuseConnections(true);

        // Act
        boolean connected = manager.connect().get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(connected).isFalse();
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(manager.isHealthy()).isFalse();
    }

    @Test
    void shouldReturnTrueWhenAlreadyConnected() throws Exception {
        manager.connect().get(1, TimeUnit.SECONDS);

        assertThat(manager.connect().get(1, TimeUnit.SECONDS)).isTrue();
        assertThat(link.sessionsOpened()).isEqualTo(1);
    }

    @Test
    void shouldFailSpeechRatherThanRunItOnCallerWhenHardwarePoolIsBusy() throws Exception {
        // Arrange
        ThreadPoolProperties pools = new ThreadPoolProperties();
        pools.setHardware(new ThreadPoolProperties.PoolProperties(1, 1, 0, "robot-io-"));
        ThreadPoolTaskExecutor hardware = (ThreadPoolTaskExecutor) new ThreadPoolConfig(pools).hardwareExecutor();
        ConnectionManager busy = new ConnectionManager(link, props, hardware, new SyncExecutor(), publisher,
                new DialogueMetrics(new SimpleMeterRegistry()));
        CountDownLatch release = new CountDownLatch(1);
        Runnable stalledCommand = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            assertThat(busy.connect().get(1, TimeUnit.SECONDS)).isTrue();
            await().atMost(Duration.ofSeconds(2)).until(() -> {
                try {
                    hardware.execute(stalledCommand);
                    return true;
                } catch (RejectedExecutionException e) {
                    return false;
                }
            });

            // Act
            CompletableFuture<Void> speech = busy.speak("hello");

            // Assert
            assertThat(speech).isCompletedExceptionally();
            assertThatThrownBy(speech::join).hasCauseInstanceOf(HardwareLinkException.class);
            assertThat(link.spokenLines()).isEmpty();
        } finally {
            release.countDown();
            hardware.shutdown();
        }
    }

    @Test
    void shouldSkipCommandsWhileDisconnected() throws Exception {
        // Act
        CompletableFuture<Void> speech = manager.speak("hello");
        CompletableFuture<Void> motion = manager.moveToPosture("Stand", 0.5);

        // Assert
        assertThat(speech.get(1, TimeUnit.SECONDS)).isNull();
        assertThat(motion.get(1, TimeUnit.SECONDS)).isNull();
        assertThat(link.spokenLines()).isEmpty();
        assertThat(link.postures()).isEmpty();
    }

    @Test
    void shouldForwardCommandsWhenConnected() throws Exception {
        // Arrange
        manager.connect().get(1, TimeUnit.SECONDS);

        // Act
        manager.speak("hello there").get(1, TimeUnit.SECONDS);
        manager.moveToPosture("Crouch", 0.5).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(link.spokenLines()).containsExactly("hello there");
        assertThat(link.postures()).containsExactly("Crouch");
    }

    @Test
    void shouldPrefixSpeechWithSpeedTag() throws Exception {
        props.setSpeechSpeed(80);
        manager.connect().get(1, TimeUnit.SECONDS);

        manager.speak("slowly").get(1, TimeUnit.SECONDS);

        assertThat(link.spokenLines()).containsExactly("\\rspd=80\\ slowly");
    }

    @Test
    void shouldFailCommandWhenSessionRejectsIt() throws Exception {
        // Arrange
        manager.connect().get(1, TimeUnit.SECONDS);
        link.dropConnection();

        // Act
        CompletableFuture<Void> speech = manager.speak("anyone there?");

        // Assert
        assertThat(speech).failsWithin(Duration.ofSeconds(1))
                .withThrowableOfType(java.util.concurrent.ExecutionException.class)
                .withCauseInstanceOf(HardwareLinkException.class);
    }

    @Test
    void shouldPublishLostEventOnceWhenSessionDies() throws Exception {
        // Arrange
        manager.connect().get(1, TimeUnit.SECONDS);
        link.dropConnection();

        // Act
        boolean first = manager.isHealthy();
        boolean second = manager.isHealthy();

        // Assert
        assertThat(first).isFalse();
        assertThat(second).isFalse();
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
        List<ConnectionLostEvent> lost = publisher.eventsOfType(ConnectionLostEvent.class);
        assertThat(lost).hasSize(1);
        assertThat(lost.get(0).host()).isEqualTo("pepper.local");
    }

    @Test
    void shouldRefuseSubscribeWhileDisconnected() {
        assertThatThrownBy(() -> manager.subscribe(event -> { }))
                .isInstanceOf(HardwareLinkException.class)
                .hasMessageContaining("DISCONNECTED");
    }

    @Test
    void shouldDeliverEventsToSubscribedCallback() throws Exception {
        // Arrange
        List<SensorEvent> received = new CopyOnWriteArrayList<>();
        manager.connect().get(1, TimeUnit.SECONDS);

        // Act
        manager.subscribe(received::add);
        link.injectUtterance("hello robot");

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> !received.isEmpty());
        assertThat(received.get(0).eventName()).isEqualTo(SensorEventKeys.WORD_RECOGNIZED);
        assertThat(manager.isPolling()).isTrue();
    }

    @Test
    void shouldReconnectAndResubscribeSameCallback() throws Exception {
        // Arrange
        List<SensorEvent> received = new CopyOnWriteArrayList<>();
        manager.connect().get(1, TimeUnit.SECONDS);
        manager.subscribe(received::add);
        link.dropConnection();

        // Act
        boolean reconnected = manager.reconnect().get(2, TimeUnit.SECONDS);
        boolean rearmed = manager.resubscribe();
        link.injectUtterance("still there?");

        // Assert
        assertThat(reconnected).isTrue();
        assertThat(rearmed).isTrue();
        assertThat(link.sessionsOpened()).isEqualTo(2);
        assertThat(publisher.eventsOfType(ConnectionRestoredEvent.class)).hasSize(1);
        await().atMost(Duration.ofSeconds(2)).until(() -> !received.isEmpty());
    }

    @Test
    void shouldNotResubscribeWithoutPriorSubscription() throws Exception {
        manager.connect().get(1, TimeUnit.SECONDS);

        assertThat(manager.resubscribe()).isFalse();
        assertThat(manager.isPolling()).isFalse();
    }

    @Test
    void shouldStopPollingOnDisconnect() throws Exception {
        // Arrange
        manager.connect().get(1, TimeUnit.SECONDS);
        manager.subscribe(event -> { });

        // Act
        manager.disconnect().get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(manager.isPolling()).isFalse();
        assertThat(manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }
}
