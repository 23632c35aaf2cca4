package com.example.webui.exception;

import lombok.Getter;

/**
 * Application credential could not be verified
 */
@Getter
public class TokenValidationException extends RuntimeException {

  public enum Reason {
    EXPIRED,
    INVALID_SIGNATURE,
    INVALID_CLAIMS,
    MALFORMED
  }

  private final Reason reason;

  public TokenValidationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TokenValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }
}
