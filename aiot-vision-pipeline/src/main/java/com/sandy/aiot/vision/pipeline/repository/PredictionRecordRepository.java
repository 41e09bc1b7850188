package com.sandy.aiot.vision.pipeline.repository;

import com.sandy.aiot.vision.pipeline.entity.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, Long> {
    List<PredictionRecord> findTop50BySensorIdOrderByTimestampDesc(String sensorId);
    long countBySensorId(String sensorId);
}
