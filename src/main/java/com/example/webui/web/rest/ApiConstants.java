package com.example.webui.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Session paths
    public static final String SESSION = "/session";

    // Maintenance paths
    public static final String MAINTENANCE = "/maintenance";
    public static final String SCHEDULE = "/schedule";

    // Health paths
    public static final String LOCKS = "/locks";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
