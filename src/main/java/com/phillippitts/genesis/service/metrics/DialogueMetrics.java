package com.phillippitts.genesis.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the event bridge and dialogue pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Meaningful sensor events per key, and handoffs the dialogue executor rejected</li>
 *   <li>Turn latency and outcome per route (internal, plugin, reasoning)</li>
 *   <li>Reasoning backend calls per outcome</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DialogueMetrics {

    private static final String METRIC_PREFIX = "genesis";

    private final MeterRegistry registry;

    public DialogueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a meaningful sample handed to the dialogue executor.
     *
     * @param eventName monitored key the sample came from
     */
    public void recordSensorEvent(String eventName) {
        Counter.builder(METRIC_PREFIX + ".sensor.events")
                .description("Meaningful sensor events handed to the dialogue pipeline")
                .tag("event", eventName)
                .register(registry)
                .increment();
    }

    /**
     * Counts a sensor event dropped because the dialogue executor rejected it.
     */
    public void recordRejectedHandoff(String eventName) {
        Counter.builder(METRIC_PREFIX + ".sensor.rejected")
                .description("Sensor events dropped because the dialogue executor was saturated")
                .tag("event", eventName)
                .register(registry)
                .increment();
    }

    /**
     * Records the end-to-end latency of one turn.
     *
     * @param route internal, plugin or reasoning
     * @param outcome success or error
     * @param durationNanos elapsed time in nanoseconds
     */
    public void recordTurn(String route, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time from utterance to completed speech and motion")
                .tag("route", route)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a call to the reasoning backend by outcome (ok, empty, error, disconnected).
     */
    public void recordReasoningCall(String outcome) {
        Counter.builder(METRIC_PREFIX + ".reasoning.calls")
                .description("Calls to the remote language model")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts a reply produced by an intent handler or plugin that failed.
     */
    public void recordHandlerFailure(String intent) {
        Counter.builder(METRIC_PREFIX + ".turn.handler.failure")
                .description("Intent handler or plugin failures converted to apologies")
                .tag("intent", intent)
                .register(registry)
                .increment();
    }
}
