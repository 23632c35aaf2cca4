package com.example.webui.service.session;

/**
 * Decides whether a newly observed third-party token replaces the one stored in a session.
 */
public enum TokenReplacementPolicy {

  /**
   * Keep the token that expires furthest in the future. A new token replaces the stored
   * one only when its expiry is strictly later.
   */
  LATEST_EXPIRY {
    @Override
    public boolean shouldReplace(long storedExpiry, long newExpiry) {
      return newExpiry > storedExpiry;
    }
  },

  /**
   * Legacy comparison: replaces the stored token when the stored expiry is later than the
   * new one. Kept selectable until product confirms which behaviour is intended.
   */
  EARLIEST_EXPIRY {
    @Override
    public boolean shouldReplace(long storedExpiry, long newExpiry) {
      return storedExpiry > newExpiry;
    }
  };

  public abstract boolean shouldReplace(long storedExpiry, long newExpiry);
}
