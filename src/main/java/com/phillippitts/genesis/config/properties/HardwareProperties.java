package com.phillippitts.genesis.config.properties;

import com.phillippitts.genesis.service.hardware.SensorEventKeys;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Hardware link connection, polling and output settings.
 */
@Validated
@ConfigurationProperties(prefix = "genesis.hardware")
public class HardwareProperties {

    /** Robot host name or address. */
    @NotBlank
    private String host = "127.0.0.1";

    @Min(1)
    @Max(65535)
    private int port = 9559;

    /** Delay between polling passes over the monitored keys. */
    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 100;

    /** Back-off after a poll loop error. */
    @Positive
    private long errorBackoffMs = 1000;

    /** Bound on waiting for the poller thread to exit. */
    @Positive
    private long pollerJoinTimeoutMs = 5000;

    @Positive
    private long heartbeatIntervalMs = 5000;

    /** Bound on the startup connect; the runtime fails to start when it elapses. */
    @Positive
    private long connectTimeoutMs = 10000;

    @NotEmpty
    private List<String> monitoredEvents = new ArrayList<>(SensorEventKeys.DEFAULT_MONITORED);

    /** Fraction of maximum speed for posture changes. */
    @PositiveOrZero
    @Max(1)
    private double motionSpeed = 0.8;

    /** Speech rate passed as an inline tag; 0 keeps the robot default. */
    @PositiveOrZero
    private int speechSpeed = 80;

    /** Use the in-process simulated robot instead of a real one. */
    private boolean simulated = true;

    /** Simulated speaking time per character. */
    @PositiveOrZero
    private long simulatedSpeechMsPerChar = 15;

    @PositiveOrZero
    private long simulatedMotionMs = 400;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getErrorBackoffMs() {
        return errorBackoffMs;
    }

    public void setErrorBackoffMs(long errorBackoffMs) {
        this.errorBackoffMs = errorBackoffMs;
    }

    public long getPollerJoinTimeoutMs() {
        return pollerJoinTimeoutMs;
    }

    public void setPollerJoinTimeoutMs(long pollerJoinTimeoutMs) {
        this.pollerJoinTimeoutMs = pollerJoinTimeoutMs;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public List<String> getMonitoredEvents() {
        return monitoredEvents;
    }

    public void setMonitoredEvents(List<String> monitoredEvents) {
        this.monitoredEvents = monitoredEvents;
    }

    public double getMotionSpeed() {
        return motionSpeed;
    }

    public void setMotionSpeed(double motionSpeed) {
        this.motionSpeed = motionSpeed;
    }

    public int getSpeechSpeed() {
        return speechSpeed;
    }

    public void setSpeechSpeed(int speechSpeed) {
        this.speechSpeed = speechSpeed;
    }

    public boolean isSimulated() {
        return simulated;
    }

    public void setSimulated(boolean simulated) {
        this.simulated = simulated;
    }

    public long getSimulatedSpeechMsPerChar() {
        return simulatedSpeechMsPerChar;
    }

    public void setSimulatedSpeechMsPerChar(long simulatedSpeechMsPerChar) {
        this.simulatedSpeechMsPerChar = simulatedSpeechMsPerChar;
    }

    public long getSimulatedMotionMs() {
        return simulatedMotionMs;
    }

    public void setSimulatedMotionMs(long simulatedMotionMs) {
        this.simulatedMotionMs = simulatedMotionMs;
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration errorBackoff() {
        return Duration.ofMillis(errorBackoffMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration pollerJoinTimeout() {
        return Duration.ofMillis(pollerJoinTimeoutMs);
    }
}
