package com.example.webui.service.session;

import com.example.webui.domain.entity.UserSession;

import java.util.Optional;

/**
 * Storage for user sessions keyed by user id. Entries expire once they have not been
 * updated for the configured session lifetime.
 */
public interface SessionStore {

  /**
   * Looks up the session of a user.
   *
   * @param userId the user whose session to load
   * @return the session, or empty if none is stored, it has expired, or the store is unreachable
   */
  Optional<UserSession> get(String userId);

  /**
   * Inserts or replaces a session and restarts its lifetime.
   *
   * @param session the session to store
   * @return {@code false} if the session could not be durably saved
   */
  boolean update(UserSession session);

  /**
   * Removes the session of a user. Removing an absent session is not an error.
   *
   * @param userId the user whose session to remove
   */
  void remove(String userId);

  /**
   * Short name of the backing store, reported by health checks.
   */
  String kind();
}
