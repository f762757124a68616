package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.SensorSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Optional outlier check feeding the predictive sub-score.
 * Returns an issue string when the current reading looks anomalous.
 */
@FunctionalInterface
public interface AnomalyDetector {

    AnomalyDetector NONE = (current, chronological) -> Optional.empty();

    Optional<String> inspect(SensorSnapshot current, List<HistoricalReading> chronological);
}
