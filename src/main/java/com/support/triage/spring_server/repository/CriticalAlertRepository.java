package com.support.triage.spring_server.repository;

import com.support.triage.spring_server.entity.AlertStatus;
import com.support.triage.spring_server.entity.CriticalAlert;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CriticalAlertRepository extends MongoRepository<CriticalAlert, String> {

    List<CriticalAlert> findByStatusOrderByCreatedAtDesc(AlertStatus status);

    long countByStatus(AlertStatus status);
}
