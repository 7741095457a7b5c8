package com.skillpulse.api.controller;

import com.skillpulse.api.model.AnalyzeTrendsRequest;
import com.skillpulse.api.model.AnalyzeTrendsResponse;
import com.skillpulse.api.model.ClearPeriodsResponse;
import com.skillpulse.api.model.PeriodsResponse;
import com.skillpulse.api.model.StoreTrendsRequest;
import com.skillpulse.api.model.StoreTrendsResponse;
import com.skillpulse.api.service.RequestValidation;
import com.skillpulse.processing.store.Snapshot;
import com.skillpulse.processing.store.SnapshotStore;
import com.skillpulse.processing.trend.TrendEngine;
import com.skillpulse.processing.trend.TrendRecord;
import com.skillpulse.processing.trend.TrendSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

@RestController
public class TrendsController {

  private static final Logger log = LoggerFactory.getLogger(TrendsController.class);

  private static final int DEFAULT_PERIODS_BACK = 1;
  private static final int MAX_PERIODS_BACK = 100;

  private static final Comparator<TrendRecord> BY_MAGNITUDE =
      Comparator.comparingLong((TrendRecord r) -> Math.abs(r.absoluteChange())).reversed()
          .thenComparing(TrendRecord::skill);

  private final TrendEngine engine;
  private final SnapshotStore store;

  public TrendsController(TrendEngine engine, SnapshotStore store) {
    this.engine = engine;
    this.store = store;
  }

  @PostMapping("/api/trends/store")
  public ResponseEntity<StoreTrendsResponse> storeTrends(@RequestBody(required = false) StoreTrendsRequest request) {
    RequestValidation.requireBody(request);
    Map<String, Long> counts = RequestValidation.skillCounts(request.skillCounts());
    String period = RequestValidation.sanitizeLabel(request.period(), RequestValidation.MAX_LABEL_LENGTH);

    String saved = store.save(period, counts);
    long total = counts.values().stream().mapToLong(Long::longValue).sum();
    log.info("Trend data stored for period {}: {} skills, {} total occurrences", saved, counts.size(), total);

    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new StoreTrendsResponse("Skill frequency data stored successfully", saved, counts.size(), total));
  }

  @PostMapping("/api/trends/analyze")
  public AnalyzeTrendsResponse analyzeTrends(@RequestBody(required = false) AnalyzeTrendsRequest request) {
    RequestValidation.requireBody(request);
    Map<String, Long> counts = RequestValidation.skillCounts(request.skillCounts());
    String comparison = RequestValidation.sanitizeLabel(request.comparisonPeriod(), RequestValidation.MAX_LABEL_LENGTH);
    int periodsBack = RequestValidation.boundedInt(request.periodsBack(), DEFAULT_PERIODS_BACK, 1, MAX_PERIODS_BACK);

    SortedMap<String, TrendRecord> records = engine.analyzeTrends(counts, comparison, periodsBack);
    TrendSummary summary = engine.getSummary(records);
    List<TrendRecord> sorted = records.values().stream().sorted(BY_MAGNITUDE).toList();

    log.info("Trend analysis completed: {} skills analyzed, {} rising, {} declining",
        records.size(), summary.rising().size(), summary.declining().size());
    return new AnalyzeTrendsResponse(sorted, AnalyzeTrendsResponse.Summary.of(summary), records.size());
  }

  @GetMapping("/api/trends/periods")
  public PeriodsResponse listPeriods() {
    List<String> periods = store.listPeriods();
    log.info("Historical periods requested: {} periods available", periods.size());
    return new PeriodsResponse(periods, periods.size());
  }

  @GetMapping("/api/trends/periods/{period}")
  public ResponseEntity<Snapshot> getPeriod(@PathVariable("period") String period) {
    return store.load(period)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @DeleteMapping("/api/trends/periods")
  public ClearPeriodsResponse clearPeriods(@RequestParam(name = "before", required = false) String before) {
    return new ClearPeriodsResponse(store.clearBefore(before));
  }
}
