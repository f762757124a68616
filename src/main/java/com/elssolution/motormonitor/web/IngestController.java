package com.elssolution.motormonitor.web;

import com.elssolution.motormonitor.service.ReadingParser;
import com.elssolution.motormonitor.service.SensorIngestService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Push endpoint of the sensor module. */
@RestController
public class IngestController {

    private final SensorIngestService ingest;

    public IngestController(SensorIngestService ingest) {
        this.ingest = ingest;
    }

    @PostMapping("/send-data")
    public ResponseEntity<ApiResponse> sendData(@RequestBody(required = false) JsonNode payload) {
        if (ReadingParser.isEmpty(payload)) {
            return ResponseEntity.badRequest().body(ApiResponse.error("No data received"));
        }
        ingest.ingest(payload);
        return ResponseEntity.ok(ApiResponse.success("Data processed successfully"));
    }
}
