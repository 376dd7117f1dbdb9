package com.platform.hacontroller.api;

import com.platform.hacontroller.model.MetricSample;
import com.platform.hacontroller.telemetry.MetricAggregator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Push side of the telemetry feed.
 */
@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final MetricAggregator metricAggregator;

    @PostMapping
    public ResponseEntity<Void> ingest(@Valid @RequestBody MetricSample sample) {
        metricAggregator.ingest(sample);
        return ResponseEntity.accepted().build();
    }

    /**
     * Samples are checked one by one; the first invalid sample fails the request,
     * samples before it stay ingested.
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Integer>> ingestBatch(@RequestBody List<MetricSample> samples) {
        samples.forEach(metricAggregator::ingest);
        return ResponseEntity.accepted().body(Map.of("accepted", samples.size()));
    }
}
