package com.example.webui.service.maintenance;

/**
 * Result of one scheduled maintenance run.
 */
public enum JobOutcome {
  COMPLETED,
  SKIPPED_DISABLED,
  SKIPPED_LOCK_UNAVAILABLE,
  ABORTED_LOCK_LOST,
  FAILED
}
