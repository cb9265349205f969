package com.example.healthrag;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/metrics")
public class MetricController {

    @Autowired
    private HealthMetricService metricService;

    @PostMapping
    public ResponseEntity<HealthMetricView> ingest(@RequestBody ApiModels.MetricIngestRequest req) {
        HealthMetricView v = metricService.ingest(req.getOwnerId(), req.getDate(), req.getCategory(), req.getSource(), req.getFields());
        return ResponseEntity.status(HttpStatus.CREATED).body(v);
    }

    @GetMapping("/{ownerId}")
    public List<HealthMetricView> list(@PathVariable String ownerId,
                                       @RequestParam(name = "category", required = false) String category,
                                       @RequestParam(name = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                       @RequestParam(name = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return metricService.list(ownerId, category, start, end);
    }

    @GetMapping("/{ownerId}/{id}")
    public ResponseEntity<HealthMetricView> get(@PathVariable String ownerId, @PathVariable String id) {
        return metricService.get(ownerId, id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{ownerId}/{id}")
    public ResponseEntity<Void> delete(@PathVariable String ownerId, @PathVariable String id) {
        return metricService.delete(ownerId, id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
