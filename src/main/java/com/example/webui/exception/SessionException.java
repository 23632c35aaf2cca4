package com.example.webui.exception;

/**
 * Raised by request handlers that need the caller's user session when the session filter
 * could not resolve one.
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }
}
