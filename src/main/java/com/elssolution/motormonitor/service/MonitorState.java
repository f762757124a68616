package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.ConnectivityStatus;
import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.domain.SensorModuleReading;
import com.elssolution.motormonitor.integration.push.EventPublisher;
import com.elssolution.motormonitor.integration.push.MonitorEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Shared state of the three loops and the push endpoint: snapshot, per-device
 * connectivity, latest health and recommendations.
 *
 * Every write goes through {@link #update}, which swaps an immutable {@link MonitorView}
 * under one lock. Critical sections only compute the next view; device and store I/O
 * happen before the call, and events are published after the lock is released.
 */
@Slf4j
@Component
public class MonitorState {

    private final Object lock = new Object();
    private final EventPublisher publisher;

    // guarded by lock
    private MonitorView current = MonitorView.initial();

    public MonitorState(EventPublisher publisher) {
        this.publisher = publisher;
    }

    /** Consistent copy of the whole state. */
    public MonitorView view() {
        synchronized (lock) {
            return current;
        }
    }

    /**
     * The single write entry point. {@code change} runs under the lock and must not block;
     * returning the same instance means "no change" and suppresses {@code events}.
     */
    public Change update(UnaryOperator<MonitorView> change, MonitorEvent... events) {
        MonitorView before;
        MonitorView after;
        synchronized (lock) {
            before = current;
            after = Objects.requireNonNull(change.apply(before), "state change returned null");
            current = after;
        }
        Change result = new Change(before, after);
        if (result.changed()) {
            for (MonitorEvent e : events) announce(e, payloadFor(e, after));
        }
        return result;
    }

    // ---------------------- typed writes ----------------------

    public MonitorView applySensorReading(SensorModuleReading reading, Instant at) {
        return update(v -> v.withSnapshot(v.snapshot().withSensorModule(reading))
                        .withConnectivity(Device.SENSOR_MODULE, ConnectivityStatus.seenAt(at))
                        .withLastUpdate(at),
                MonitorEvent.SENSOR_UPDATE).after();
    }

    public MonitorView applyControllerReading(double motorTempC, double motorVoltage, Instant at) {
        return update(v -> v.withSnapshot(v.snapshot().withController(motorTempC, motorVoltage))
                        .withConnectivity(Device.CONTROLLER, ConnectivityStatus.seenAt(at))
                        .withLastUpdate(at),
                MonitorEvent.SENSOR_UPDATE).after();
    }

    public MonitorView applyAnalysis(HealthBreakdown health, List<Recommendation> recommendations) {
        return update(v -> v.withAnalysis(health, recommendations),
                MonitorEvent.HEALTH_UPDATE, MonitorEvent.RECOMMENDATIONS_UPDATE).after();
    }

    public void setAnalysisStatus(AnalysisStatus status) {
        update(v -> v.analysisStatus() == status ? v : v.withAnalysisStatus(status));
    }

    /**
     * Atomically mark {@code device} disconnected and clear its fields, but only if
     * {@code when} holds for its current connectivity. Check and write share one lock
     * hold, so a read landing between them cannot be wiped out.
     */
    public Change disconnectIf(Device device, Predicate<ConnectivityStatus> when) {
        return update(v -> {
            ConnectivityStatus st = v.connectivity(device);
            if (!when.test(st)) return v;
            return v.withConnectivity(device, st.disconnected())
                    .withSnapshot(v.snapshot().without(device));
        }, MonitorEvent.SENSOR_UPDATE);
    }

    // ---------------------- outbound ----------------------

    public void publishStatus() {
        announce(MonitorEvent.STATUS_UPDATE, StatusUpdate.of(view()));
    }

    /** Fire-and-forget; never called with the lock held. */
    public void announce(MonitorEvent event, Object payload) {
        try {
            publisher.publish(event, payload);
        } catch (RuntimeException e) {
            log.warn("publish_failed event={} err={}", event.wireName(), e.toString());
        }
    }

    static Object payloadFor(MonitorEvent e, MonitorView v) {
        return switch (e) {
            case SENSOR_UPDATE -> SensorUpdate.of(v);
            case HEALTH_UPDATE -> v.health();
            case RECOMMENDATIONS_UPDATE -> v.recommendations();
            case STATUS_UPDATE -> StatusUpdate.of(v);
            default -> throw new IllegalArgumentException("no state payload for " + e);
        };
    }

    public record Change(MonitorView before, MonitorView after) {
        public boolean changed() {
            return before != after;
        }
    }
}
