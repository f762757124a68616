package com.elssolution.motormonitor.integration.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface MaintenanceAlertRepository extends JpaRepository<MaintenanceAlertEntity, Long> {

    boolean existsByAlertTypeAndAcknowledgedFalseAndCreatedAtGreaterThanEqual(String alertType, Instant since);

    List<MaintenanceAlertEntity> findByAcknowledgedFalseOrderByCreatedAtDescIdDesc(Pageable page);
}
