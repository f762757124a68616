package com.elssolution.motormonitor.integration.persistence;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** One history row: merged snapshot, connection flags and the health in force at write time. */
@Entity
@Table(name = "sensor_data", indexes = @Index(name = "idx_sensor_data_ts", columnList = "recorded_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    // sensor module
    private Double espCurrent;
    private Double espVoltage;
    private Double espRpm;
    private Double envTempC;
    private Double envHumidity;
    private Double envTempF;
    private Double heatIndexC;
    private Double heatIndexF;
    @Column(length = 10) private String relay1Status;
    @Column(length = 10) private String relay2Status;
    @Column(length = 10) private String relay3Status;
    @Column(length = 10) private String combinedStatus;

    // controller
    private Double plcMotorTemp;
    private Double plcMotorVoltage;

    private boolean espConnected;
    private boolean plcConnected;

    /** Null while no health has been computed yet. */
    private Double overallHealthScore;
    private Double electricalHealth;
    private Double thermalHealth;
    private Double mechanicalHealth;
    private Double predictiveHealth;
    private Double efficiencyScore;

    @Column(name = "power_consumption_kw")
    private Double powerConsumptionKw;
}
