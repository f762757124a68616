package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.ConnectivityStatus;
import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HealthStatus;
import com.elssolution.motormonitor.domain.SensorModuleReading;
import com.elssolution.motormonitor.integration.push.MonitorEvent;
import com.elssolution.motormonitor.support.RecordingPublisher;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class MonitorStateTest {

    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    static SensorModuleReading reading(double current, double voltage, double rpm) {
        return new SensorModuleReading(current, voltage, rpm, 25.0, 50.0, 77.0, 25.5, 78.0,
                "ON", "OFF", "OFF", "NOR");
    }

    private final RecordingPublisher publisher = new RecordingPublisher();
    private final MonitorState state = new MonitorState(publisher);

    @Test
    void starts_disconnected_with_no_data() {
        MonitorView v = state.view();

        assertThat(v.isConnected(Device.SENSOR_MODULE)).isFalse();
        assertThat(v.isConnected(Device.CONTROLLER)).isFalse();
        assertThat(v.snapshot().hasAnyValue()).isFalse();
        assertThat(v.health().getHealthStatus()).isEqualTo(HealthStatus.NO_DATA);
        assertThat(v.analysisStatus()).isEqualTo(AnalysisStatus.INITIALIZING);
    }

    @Test
    void sensor_reading_merges_and_marks_connected() {
        state.applyControllerReading(30.0, 24.0, T0);
        MonitorView v = state.applySensorReading(reading(6.0, 24.5, 2700), T0.plusSeconds(1));

        assertThat(v.snapshot().getCurrent()).isEqualTo(6.0);
        assertThat(v.snapshot().getMotorTempC()).isEqualTo(30.0);
        assertThat(v.connectivity(Device.SENSOR_MODULE)).isEqualTo(ConnectivityStatus.seenAt(T0.plusSeconds(1)));
        assertThat(v.lastUpdate()).isEqualTo(T0.plusSeconds(1));
        assertThat(publisher.count(MonitorEvent.SENSOR_UPDATE)).isEqualTo(2);
        assertThat(publisher.payloads(MonitorEvent.SENSOR_UPDATE).get(1))
                .isInstanceOfSatisfying(SensorUpdate.class, u -> {
                    assertThat(u.sensorModuleConnected()).isTrue();
                    assertThat(u.controllerConnected()).isTrue();
                });
    }

    @Test
    void analysis_publishes_health_and_recommendations() {
        HealthBreakdown h = HealthBreakdown.builder().overall(80).healthStatus(HealthStatus.GOOD).build();

        state.applyAnalysis(h, List.of());

        assertThat(state.view().analysisStatus()).isEqualTo(AnalysisStatus.ACTIVE);
        assertThat(publisher.payloads(MonitorEvent.HEALTH_UPDATE)).containsExactly(h);
        assertThat(publisher.count(MonitorEvent.RECOMMENDATIONS_UPDATE)).isEqualTo(1);
    }

    @Test
    void disconnect_is_conditional_and_clears_owned_fields_only() {
        state.applySensorReading(reading(6.0, 24.5, 2700), T0);
        state.applyControllerReading(30.0, 24.0, T0);
        publisher.clear();

        MonitorState.Change noop = state.disconnectIf(Device.SENSOR_MODULE, st -> false);
        assertThat(noop.changed()).isFalse();
        assertThat(publisher.all()).isEmpty();

        MonitorState.Change change = state.disconnectIf(Device.SENSOR_MODULE, ConnectivityStatus::isConnected);
        MonitorView v = change.after();

        assertThat(change.changed()).isTrue();
        assertThat(v.isConnected(Device.SENSOR_MODULE)).isFalse();
        assertThat(v.connectivity(Device.SENSOR_MODULE).getLastSeen()).isEqualTo(T0);
        assertThat(v.snapshot().getCurrent()).isNull();
        assertThat(v.snapshot().getRelay1()).isNull();
        assertThat(v.snapshot().getMotorTempC()).isEqualTo(30.0);
        assertThat(publisher.count(MonitorEvent.SENSOR_UPDATE)).isEqualTo(1);
    }

    @Test
    void failing_publisher_does_not_break_writes() {
        MonitorState s = new MonitorState((event, payload) -> { throw new IllegalStateException("socket down"); });

        assertThatCode(() -> s.applyControllerReading(30.0, 24.0, T0)).doesNotThrowAnyException();
        assertThat(s.view().snapshot().getMotorVoltage()).isEqualTo(24.0);
    }

    @Test
    void concurrent_writers_do_not_lose_fields() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < 500; i++) state.applySensorReading(reading(5.0 + i % 3, 24.0, 2700), T0);
                return null;
            });
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < 500; i++) state.applyControllerReading(30.0 + i % 3, 24.0, T0);
                return null;
            });
            go.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        MonitorView v = state.view();
        assertThat(v.snapshot().getCurrent()).isNotNull();
        assertThat(v.snapshot().getMotorTempC()).isNotNull();
        assertThat(v.isConnected(Device.SENSOR_MODULE)).isTrue();
        assertThat(v.isConnected(Device.CONTROLLER)).isTrue();
    }
}
