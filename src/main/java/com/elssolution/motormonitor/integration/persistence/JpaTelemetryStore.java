package com.elssolution.motormonitor.integration.persistence;

import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HealthStatus;
import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.MaintenanceAlert;
import com.elssolution.motormonitor.domain.SensorSnapshot;
import com.elssolution.motormonitor.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TelemetryStore} over Spring Data JPA. Only scores are stored for history rows;
 * issue texts are not persisted, so rows read back carry empty issue lists.
 */
@Slf4j
@Service
@Transactional
public class JpaTelemetryStore implements TelemetryStore {

    private final SensorReadingRepository readings;
    private final MaintenanceAlertRepository maintenance;
    private final SystemEventRepository events;
    private final Clock clock;

    public JpaTelemetryStore(SensorReadingRepository readings, MaintenanceAlertRepository maintenance,
                             SystemEventRepository events, Clock clock) {
        this.readings = readings;
        this.maintenance = maintenance;
        this.events = events;
        this.clock = clock;
    }

    // ---------------------- history ----------------------

    @Override
    public void append(HistoricalReading r) {
        readings.save(toEntity(r));
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoricalReading> recent(Duration window) {
        return since(clock.instant().minus(window));
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoricalReading> since(Instant since) {
        return readings.findByRecordedAtGreaterThanEqualOrderByRecordedAtDescIdDesc(since).stream()
                .map(JpaTelemetryStore::toDomain)
                .toList();
    }

    // ---------------------- maintenance alerts ----------------------

    @Override
    @Transactional(readOnly = true)
    public boolean hasUnacknowledgedAlertSince(String type, Instant since) {
        return maintenance.existsByAlertTypeAndAcknowledgedFalseAndCreatedAtGreaterThanEqual(type, since);
    }

    @Override
    public MaintenanceAlert append(MaintenanceAlert a) {
        MaintenanceAlertEntity saved = maintenance.save(MaintenanceAlertEntity.builder()
                .createdAt(a.getCreatedAt())
                .alertType(a.getType())
                .category(a.getCategory())
                .severity(a.getSeverity().name())
                .priority(a.getPriority().name())
                .description(a.getDescription())
                .recommendedAction(a.getAction())
                .predictionConfidence(a.getConfidence())
                .acknowledged(a.isAcknowledged())
                .build());
        return a.withId(saved.getId());
    }

    @Override
    public boolean acknowledge(long alertId) {
        return maintenance.findById(alertId)
                .map(e -> {
                    e.setAcknowledged(true);
                    log.info("maintenance_alert_acknowledged id={} type={}", alertId, e.getAlertType());
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MaintenanceAlert> unacknowledgedAlerts(int limit) {
        return maintenance.findByAcknowledgedFalseOrderByCreatedAtDescIdDesc(PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(JpaTelemetryStore::toDomain)
                .toList();
    }

    // ---------------------- system events ----------------------

    @Override
    public void logSystemEvent(String eventType, String component, String message, String severity) {
        events.save(SystemEventEntity.builder()
                .occurredAt(clock.instant())
                .eventType(eventType)
                .component(component)
                .message(message)
                .severity(severity)
                .build());
    }

    // ---------------------- mapping ----------------------

    static SensorReadingEntity toEntity(HistoricalReading r) {
        SensorSnapshot s = r.snapshot();
        HealthBreakdown h = r.health();
        boolean scored = h != null && h.getHealthStatus() != HealthStatus.NO_DATA;
        return SensorReadingEntity.builder()
                .recordedAt(r.timestamp())
                .espCurrent(s.getCurrent())
                .espVoltage(s.getVoltage())
                .espRpm(s.getRpm())
                .envTempC(s.getAmbientTempC())
                .envHumidity(s.getHumidity())
                .envTempF(s.getAmbientTempF())
                .heatIndexC(s.getHeatIndexC())
                .heatIndexF(s.getHeatIndexF())
                .relay1Status(s.getRelay1())
                .relay2Status(s.getRelay2())
                .relay3Status(s.getRelay3())
                .combinedStatus(s.getCombinedStatus())
                .plcMotorTemp(s.getMotorTempC())
                .plcMotorVoltage(s.getMotorVoltage())
                .espConnected(r.connected().getOrDefault(Device.SENSOR_MODULE, false))
                .plcConnected(r.connected().getOrDefault(Device.CONTROLLER, false))
                .overallHealthScore(scored ? h.getOverall() : null)
                .electricalHealth(scored ? h.getElectrical() : null)
                .thermalHealth(scored ? h.getThermal() : null)
                .mechanicalHealth(scored ? h.getMechanical() : null)
                .predictiveHealth(scored ? h.getPredictive() : null)
                .efficiencyScore(scored ? h.getEfficiency() : null)
                .powerConsumptionKw(r.powerKw())
                .build();
    }

    static HistoricalReading toDomain(SensorReadingEntity e) {
        SensorSnapshot s = SensorSnapshot.builder()
                .current(e.getEspCurrent())
                .voltage(e.getEspVoltage())
                .rpm(e.getEspRpm())
                .ambientTempC(e.getEnvTempC())
                .humidity(e.getEnvHumidity())
                .ambientTempF(e.getEnvTempF())
                .heatIndexC(e.getHeatIndexC())
                .heatIndexF(e.getHeatIndexF())
                .relay1(e.getRelay1Status())
                .relay2(e.getRelay2Status())
                .relay3(e.getRelay3Status())
                .combinedStatus(e.getCombinedStatus())
                .motorTempC(e.getPlcMotorTemp())
                .motorVoltage(e.getPlcMotorVoltage())
                .build();

        Map<Device, Boolean> connected = new EnumMap<>(Device.class);
        connected.put(Device.SENSOR_MODULE, e.isEspConnected());
        connected.put(Device.CONTROLLER, e.isPlcConnected());

        HealthBreakdown health = HealthBreakdown.NO_DATA;
        if (e.getOverallHealthScore() != null) {
            double overall = e.getOverallHealthScore();
            health = HealthBreakdown.builder()
                    .overall(overall)
                    .electrical(orZero(e.getElectricalHealth()))
                    .thermal(orZero(e.getThermalHealth()))
                    .mechanical(orZero(e.getMechanicalHealth()))
                    .predictive(orZero(e.getPredictiveHealth()))
                    .efficiency(orZero(e.getEfficiencyScore()))
                    .healthStatus(HealthStatus.fromScore(overall))
                    .build();
        }
        double power = e.getPowerConsumptionKw() == null ? 0.0 : e.getPowerConsumptionKw();
        return new HistoricalReading(e.getRecordedAt(), s, Map.copyOf(connected), health, power);
    }

    static MaintenanceAlert toDomain(MaintenanceAlertEntity e) {
        return MaintenanceAlert.builder()
                .id(e.getId())
                .createdAt(e.getCreatedAt())
                .type(e.getAlertType())
                .category(e.getCategory())
                .severity(Severity.valueOf(e.getSeverity()))
                .priority(Severity.valueOf(e.getPriority()))
                .description(e.getDescription())
                .action(e.getRecommendedAction())
                .confidence(e.getPredictionConfidence())
                .acknowledged(e.isAcknowledged())
                .build();
    }

    private static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }
}
