/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoflow.monitoring;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the flow engine.
 *
 * Provides the following instruments:
 * - convoflow.turns.active (gauge) - Turns currently executing
 * - convoflow.turns.total (counter) - Turns started
 * - convoflow.turns.failed (counter) - Turns that ended with an error
 * - convoflow.turns.duration.seconds (histogram) - Turn duration distribution
 * - convoflow.actions.total (counter) - Actions executed
 * - convoflow.actions.failed (counter) - Actions that failed after retries
 * - convoflow.actions.retries (counter) - Retry attempts
 * - convoflow.validation.failures (counter) - Rejected user inputs
 * - convoflow.interrupts (counter) - Intent interruptions handled
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FlowMetrics {

    private static final Logger logger = Logger.getLogger(FlowMetrics.class.getName());
    private static final String METER_NAME = "convoflow-engine";

    private static FlowMetrics instance;

    private final LongCounter turnsTotal;
    private final LongCounter turnsFailed;
    private final LongCounter actionsTotal;
    private final LongCounter actionsFailed;
    private final LongCounter actionRetries;
    private final LongCounter validationFailures;
    private final LongCounter interrupts;

    private final DoubleHistogram turnDuration;

    private final AtomicLong activeTurns = new AtomicLong(0);

    private static final AttributeKey<String> FLOW_ID_KEY = AttributeKey.stringKey("flow.id");
    private static final AttributeKey<String> STATE_TYPE_KEY = AttributeKey.stringKey("state.type");
    private static final AttributeKey<String> EXECUTOR_KEY = AttributeKey.stringKey("executor.name");
    private static final AttributeKey<String> INTENT_KEY = AttributeKey.stringKey("intent");
    private static final AttributeKey<String> STATE_KEY = AttributeKey.stringKey("state.name");

    public FlowMetrics(Meter meter) {
        turnsTotal = meter.counterBuilder("convoflow.turns.total")
                .setDescription("Total number of state executions started")
                .setUnit("1")
                .build();

        turnsFailed = meter.counterBuilder("convoflow.turns.failed")
                .setDescription("Number of state executions that returned an error")
                .setUnit("1")
                .build();

        actionsTotal = meter.counterBuilder("convoflow.actions.total")
                .setDescription("Total number of actions executed")
                .setUnit("1")
                .build();

        actionsFailed = meter.counterBuilder("convoflow.actions.failed")
                .setDescription("Number of actions that failed after all attempts")
                .setUnit("1")
                .build();

        actionRetries = meter.counterBuilder("convoflow.actions.retries")
                .setDescription("Number of action retry attempts")
                .setUnit("1")
                .build();

        validationFailures = meter.counterBuilder("convoflow.validation.failures")
                .setDescription("Number of user inputs rejected by a state validator")
                .setUnit("1")
                .build();

        interrupts = meter.counterBuilder("convoflow.interrupts")
                .setDescription("Number of intent interruptions handled")
                .setUnit("1")
                .build();

        turnDuration = meter.histogramBuilder("convoflow.turns.duration.seconds")
                .setDescription("State execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("convoflow.turns.active")
                .setDescription("Number of state executions in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeTurns.get()));

        logger.fine("FlowMetrics initialized");
    }

    /**
     * Get the shared instance backed by the global OpenTelemetry.
     */
    public static synchronized FlowMetrics getInstance() {
        if (instance == null) {
            instance = new FlowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing.
     */
    public static FlowMetrics noop() {
        return new FlowMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordTurnStarted(String flowId, String stateType) {
        activeTurns.incrementAndGet();
        turnsTotal.add(1, flowAttributes(flowId, stateType));
    }

    public void recordTurnCompleted(String flowId, String stateType, double durationSeconds, boolean failed) {
        activeTurns.decrementAndGet();
        Attributes attrs = flowAttributes(flowId, stateType);
        turnDuration.record(durationSeconds, attrs);
        if (failed) {
            turnsFailed.add(1, attrs);
        }
    }

    public void recordActionExecuted(String executor) {
        actionsTotal.add(1, Attributes.of(EXECUTOR_KEY, nonNull(executor)));
    }

    public void recordActionFailed(String executor) {
        actionsFailed.add(1, Attributes.of(EXECUTOR_KEY, nonNull(executor)));
    }

    public void recordActionRetry(String executor) {
        actionRetries.add(1, Attributes.of(EXECUTOR_KEY, nonNull(executor)));
    }

    public void recordValidationFailure(String flowId, String state) {
        validationFailures.add(1, Attributes.of(FLOW_ID_KEY, nonNull(flowId), STATE_KEY, nonNull(state)));
    }

    public void recordInterrupt(String flowId, String intent) {
        interrupts.add(1, Attributes.of(FLOW_ID_KEY, nonNull(flowId), INTENT_KEY, nonNull(intent)));
    }

    /**
     * Get the current number of turns in progress.
     */
    public long getActiveTurns() {
        return activeTurns.get();
    }

    private static Attributes flowAttributes(String flowId, String stateType) {
        return Attributes.builder()
                .put(FLOW_ID_KEY, nonNull(flowId))
                .put(STATE_TYPE_KEY, nonNull(stateType))
                .build();
    }

    private static String nonNull(String value) {
        return value != null ? value : "unknown";
    }
}
