package com.elssolution.motormonitor.integration.persistence;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "maintenance_log",
        indexes = @Index(name = "idx_maintenance_type_ts", columnList = "alert_type, created_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceAlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "alert_type", length = 50, nullable = false)
    private String alertType;

    @Column(length = 20)
    private String severity;

    @Column(length = 30)
    private String category;

    @Column(length = 1000)
    private String description;

    private double predictionConfidence;

    @Column(length = 1000)
    private String recommendedAction;

    @Column(length = 20)
    private String priority;

    private boolean acknowledged;
}
