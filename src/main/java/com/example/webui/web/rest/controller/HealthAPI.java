package com.example.webui.web.rest.controller;

import static com.example.webui.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

/**
 * Session store and maintenance lock status for load balancers and operators.
 */
@Tag(name = "Health", description = "Session store reachability and maintenance lock activity")
@RequestMapping(value = HEALTH_BASE, produces = MediaType.APPLICATION_JSON_VALUE)
public interface HealthAPI {

  @Operation(summary = "Process is serving requests; names the active session store")
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Readiness probe",
      description = "With Redis configured, ready only while Redis answers PING"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session store reachable"),
      @ApiResponse(responseCode = "503", description = "Redis unreachable")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();

  @Operation(
      summary = "Maintenance lock counters",
      description = "Acquire attempts and renewal outcomes per maintenance lock; empty without Redis"
  )
  @GetMapping(value = LOCKS)
  ResponseEntity<Map<String, Object>> locks();
}
