package com.elssolution.motormonitor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One scoring cycle's result. All scores are in [0, 100] and rounded to one decimal.
 * Issues are keyed by category: electrical, thermal, mechanical, predictive.
 */
@Value
@Builder
public class HealthBreakdown {

    public static final String ELECTRICAL = "electrical";
    public static final String THERMAL = "thermal";
    public static final String MECHANICAL = "mechanical";
    public static final String PREDICTIVE = "predictive";

    public static final HealthBreakdown NO_DATA = HealthBreakdown.builder()
            .healthStatus(HealthStatus.NO_DATA)
            .build();

    double overall;
    double electrical;
    double thermal;
    double mechanical;
    double predictive;
    double efficiency;
    @JsonIgnore
    HealthStatus healthStatus;
    @Singular("issue")
    Map<String, List<String>> issues;

    @JsonProperty("status")
    public String statusLabel() {
        return healthStatus.label();
    }

    @JsonProperty("statusClass")
    public String statusClass() {
        return healthStatus.cssClass();
    }

    public List<String> issuesFor(String category) {
        return issues.getOrDefault(category, List.of());
    }
}
