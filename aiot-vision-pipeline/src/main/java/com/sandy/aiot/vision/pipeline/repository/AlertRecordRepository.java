package com.sandy.aiot.vision.pipeline.repository;

import com.sandy.aiot.vision.pipeline.entity.AlertRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRecordRepository extends JpaRepository<AlertRecord, Long> {
    Optional<AlertRecord> findByAlertId(Long alertId);
    List<AlertRecord> findTop50ByOrderByTriggeredAtDesc();
    List<AlertRecord> findByStateOrderByTriggeredAtDesc(String state);
}
