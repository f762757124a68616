package com.elssolution.motormonitor.integration.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface SensorReadingRepository extends JpaRepository<SensorReadingEntity, Long> {

    List<SensorReadingEntity> findByRecordedAtGreaterThanEqualOrderByRecordedAtDescIdDesc(Instant since);
}
