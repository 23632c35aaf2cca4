package com.example.webui.service.maintenance;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Status of the automated chat cleanup schedule, as shown to administrators.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleInfo(
    boolean enabled,
    String status,
    String nextRun,
    int lifetimeDays,
    String scheduleCron,
    String scheduleTimezone,
    String reason
) {}
