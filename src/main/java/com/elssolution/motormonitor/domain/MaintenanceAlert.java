package com.elssolution.motormonitor.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/** A persisted, promoted recommendation. {@code id} is null until stored. */
@Value
@Builder(toBuilder = true)
public class MaintenanceAlert {
    @With
    Long id;
    Instant createdAt;
    String type;
    String category;
    Severity severity;
    Severity priority;
    String description;
    String action;
    double confidence;
    boolean acknowledged;

    public static MaintenanceAlert from(Recommendation rec, Instant at) {
        return MaintenanceAlert.builder()
                .createdAt(at)
                .type(rec.getType())
                .category(rec.getCategory())
                .severity(rec.getSeverity())
                .priority(rec.getPriority())
                .description(rec.getDescription())
                .action(rec.getAction())
                .confidence(rec.getConfidence())
                .acknowledged(false)
                .build();
    }
}
