package com.example.todos.web.rest.controller;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Health",
    description = "Health check endpoints for monitoring and orchestration"
)
@RequestMapping(value = HEALTH_BASE)
public interface HealthAPI {

  @Operation(
      summary = "Basic health check",
      description = "Simple health check for load balancers"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is healthy")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness probe",
      description = "Determines whether the process should be restarted"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is alive"),
      @ApiResponse(responseCode = "503", description = "Service should be restarted")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Determines whether the service can accept traffic"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is ready"),
      @ApiResponse(responseCode = "503", description = "Database unreachable")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();
}
