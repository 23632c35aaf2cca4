package com.example.webui.web.rest.controller;

import com.example.webui.service.maintenance.MaintenanceScheduleService;
import com.example.webui.service.maintenance.ScheduleInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MaintenanceController implements MaintenanceAPI {

  private final MaintenanceScheduleService scheduleService;

  @Override
  public ResponseEntity<ScheduleInfo> getChatCleanupSchedule() {
    return ResponseEntity.ok(scheduleService.chatCleanupSchedule());
  }
}
