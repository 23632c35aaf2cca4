package com.example.webui.web.rest.controller;

import static com.example.webui.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Session API for the chat UI.
 */
@Tag(
    name = "Session",
    description = "Per-user session state"
)
@RequestMapping(
    value = API_BASE + SESSION,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  /**
   * Summary of the caller's session. The third-party token itself is never returned.
   */
  @Operation(
      summary = "Get current session",
      description = "Returns the caller's user id and whether a third-party token is attached"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session returned"),
      @ApiResponse(responseCode = "401", description = "No valid credential")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> getSession();

  @Operation(
      summary = "Remove current session",
      description = "Deletes the caller's stored session, dropping any third-party token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Session removed"),
      @ApiResponse(responseCode = "401", description = "No valid credential")
  })
  @DeleteMapping
  ResponseEntity<Void> removeSession();
}
