package com.elssolution.motormonitor.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Recommendation {
    String type;
    String category;
    Severity severity;
    Severity priority;
    String title;
    String description;
    String action;
    double confidence;   // 0..1
}
