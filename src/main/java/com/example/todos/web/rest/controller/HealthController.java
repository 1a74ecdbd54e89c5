package com.example.todos.web.rest.controller;

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health Check Controller
 *
 * Note: probes report failures in their body and status instead of throwing to
 * GlobalErrorHandler, since monitoring tools read the status code.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long DATABASE_RESPONSE_TIME_WARNING_MS = 500L;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final JdbcTemplate jdbcTemplate;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  /**
   * Liveness probe - checks JVM heap usage
   */
  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memory_usage_percent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Readiness probe - checks the database
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> database = new HashMap<>();
    boolean isReady;

    long started = System.nanoTime();
    try {
      jdbcTemplate.queryForObject("SELECT 1", Integer.class);
      long responseTimeMs = (System.nanoTime() - started) / 1_000_000;
      database.put("status", STATUS_UP);
      database.put("response_time_ms", responseTimeMs);
      isReady = responseTimeMs <= DATABASE_RESPONSE_TIME_WARNING_MS;
      if (!isReady) {
        log.warn("Readiness check failed: database responded in {}ms", responseTimeMs);
      }
    } catch (DataAccessException e) {
      log.error("Database health check failed", e);
      database.put("status", STATUS_DOWN);
      database.put("error", e.getMostSpecificCause().getMessage());
      isReady = false;
    }

    Map<String, Object> status = new HashMap<>();
    status.put("database", database);
    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
