package com.elssolution.motormonitor.integration.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SystemEventRepository extends JpaRepository<SystemEventEntity, Long> {
}
