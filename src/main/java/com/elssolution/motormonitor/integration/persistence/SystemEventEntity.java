package com.elssolution.motormonitor.integration.persistence;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Audit trail of operator actions (motor control commands and the like). */
@Entity
@Table(name = "system_events")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant occurredAt;

    @Column(length = 50)
    private String eventType;

    @Column(length = 50)
    private String component;

    @Column(length = 1000)
    private String message;

    @Column(length = 20)
    private String severity;
}
