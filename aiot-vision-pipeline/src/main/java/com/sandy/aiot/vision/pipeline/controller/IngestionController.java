package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.model.RawReading;
import com.sandy.aiot.vision.pipeline.service.ingest.BatchResult;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionService;
import com.sandy.aiot.vision.pipeline.service.ingest.RejectReason;
import com.sandy.aiot.vision.pipeline.service.ingest.SubmitResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP push endpoint for protocol adapters.
 * A single reading rejected for a full buffer answers 429, one rejected during shutdown 503 and
 * an invalid one 400. Batches always answer 200 with one result per element.
 */
@RestController
@RequestMapping("/pipeline/api/readings")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    @PostMapping
    public ResponseEntity<SubmitResult> submit(@RequestBody RawReading reading) {
        SubmitResult result = ingestionService.submit(reading);
        if (result.isAccepted()) return ResponseEntity.ok(result);
        if (result.getReason() == RejectReason.BUFFER_FULL) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(result);
        }
        if (result.getReason() == RejectReason.SHUTTING_DOWN) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        return ResponseEntity.badRequest().body(result);
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchResult> submitBatch(@RequestBody List<RawReading> readings) {
        return ResponseEntity.ok(ingestionService.submitBatch(readings));
    }
}
