package com.example.webui.service.session;

import com.example.webui.domain.entity.UserSession;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session store held in the memory of this process.
 * <p>
 * Sessions are not shared between instances, so this store must not be used when the
 * application runs replicated. Entries expire once they have not been written for the
 * session lifetime; expired entries are purged by a sweep that piggybacks on store calls
 * and runs at most once per clean interval.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

  private final Cache<String, UserSession> sessions;
  private final Clock clock;
  private final long cleanIntervalMillis;
  private final AtomicLong lastCleaned;

  public InMemorySessionStore(Duration sessionLifetime, Duration cleanInterval, Clock clock) {
    this.clock = clock;
    this.cleanIntervalMillis = cleanInterval.toMillis();
    this.lastCleaned = new AtomicLong(clock.millis());
    this.sessions = Caffeine.newBuilder()
        // Caffeine expires at elapsed >= duration; a session lives while elapsed <= lifetime
        .expireAfterWrite(sessionLifetime.plusNanos(1))
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
        .executor(Runnable::run)
        .build();

    log.warn("Using in-process session store (lifetime={}). Sessions are not shared across instances.",
             sessionLifetime);
  }

  @Override
  public Optional<UserSession> get(String userId) {
    sweepIfDue();
    return Optional.ofNullable(sessions.getIfPresent(userId));
  }

  @Override
  public boolean update(UserSession session) {
    sweepIfDue();
    sessions.put(session.userId(), session);
    return true;
  }

  @Override
  public void remove(String userId) {
    sweepIfDue();
    sessions.invalidate(userId);
  }

  @Override
  public String kind() {
    return "in-process";
  }

  long size() {
    return sessions.estimatedSize();
  }

  private void sweepIfDue() {
    long now = clock.millis();
    long last = lastCleaned.get();
    if (now - last > cleanIntervalMillis && lastCleaned.compareAndSet(last, now)) {
      long before = sessions.estimatedSize();
      sessions.cleanUp();
      log.trace("Swept expired sessions: {} -> {}", before, sessions.estimatedSize());
    }
  }
}
