package com.phillippitts.genesis.config.hardware;

import com.phillippitts.genesis.config.properties.HardwareProperties;
import com.phillippitts.genesis.service.connection.ConnectionHeartbeat;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import com.phillippitts.genesis.service.hardware.HardwareLink;
import com.phillippitts.genesis.service.hardware.SimulatedHardwareLink;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the hardware link, the connection manager and its heartbeat.
 *
 * <p>With {@code genesis.hardware.simulated=true} (the default) an in-process simulated robot
 * is used. Otherwise the application must provide its own {@link HardwareLink} bean.
 */
@Configuration
public class HardwareLinkConfig {

    @Bean
    @ConditionalOnProperty(prefix = "genesis.hardware", name = "simulated", havingValue = "true",
            matchIfMissing = true)
    public SimulatedHardwareLink simulatedHardwareLink(HardwareProperties props) {
        return new SimulatedHardwareLink(
                Duration.ofMillis(props.getSimulatedSpeechMsPerChar()),
                Duration.ofMillis(props.getSimulatedMotionMs()));
    }

    @Bean
    public ConnectionManager connectionManager(HardwareLink hardwareLink,
                                               HardwareProperties props,
                                               @Qualifier("hardwareExecutor") Executor hardwareExecutor,
                                               @Qualifier("dialogueExecutor") Executor dialogueExecutor,
                                               ApplicationEventPublisher publisher,
                                               DialogueMetrics metrics) {
        return new ConnectionManager(hardwareLink, props, hardwareExecutor, dialogueExecutor, publisher, metrics);
    }

    /**
     * Heartbeat bean; its {@code @Scheduled} check is picked up by the scheduling infrastructure.
     */
    @Bean
    public ConnectionHeartbeat connectionHeartbeat(ConnectionManager connectionManager) {
        return new ConnectionHeartbeat(connectionManager);
    }
}
