package com.example.webui.service.maintenance;

@FunctionalInterface
public interface MaintenanceWork {

  void execute(JobContext context) throws Exception;
}
