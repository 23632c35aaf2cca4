package com.example.webui.web.rest.controller;

import static com.example.webui.web.rest.ApiConstants.ApiPath.*;

import com.example.webui.service.maintenance.ScheduleInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Maintenance",
    description = "Automated maintenance job status"
)
@RequestMapping(
    value = API_BASE + MAINTENANCE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface MaintenanceAPI {

  @Operation(
      summary = "Chat cleanup schedule",
      description = "Whether automated chat cleanup is enabled, blocked or scheduled, and when it runs next"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Schedule returned")
  })
  @GetMapping(value = SCHEDULE)
  ResponseEntity<ScheduleInfo> getChatCleanupSchedule();
}
