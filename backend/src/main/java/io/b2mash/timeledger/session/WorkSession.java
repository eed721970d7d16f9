package io.b2mash.timeledger.session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * One continuous work interval. Created running (no end instant, no duration) and finished exactly
 * once; the duration fixed at finish time is never recomputed. At most one running session per
 * user is guaranteed by the partial unique index {@code uq_work_sessions_one_active}.
 */
@Entity
@Table(name = "work_sessions")
public class WorkSession {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "started_at", nullable = false, updatable = false)
  private Instant startedAt;

  @Column(name = "ended_at")
  private Instant endedAt;

  @Column(name = "duration_minutes")
  private Integer durationMinutes;

  @Column(name = "legacy_seconds", nullable = false)
  private boolean legacySeconds;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected WorkSession() {}

  public WorkSession(UUID userId, Instant startedAt) {
    this.userId = userId;
    this.startedAt = startedAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getEndedAt() {
    return endedAt;
  }

  public Integer getDurationMinutes() {
    return durationMinutes;
  }

  public boolean isLegacySeconds() {
    return legacySeconds;
  }

  public long getVersion() {
    return version;
  }

  public boolean isRunning() {
    return endedAt == null;
  }

  /**
   * Fixes the end instant and billable duration.
   *
   * @throws IllegalStateException if the session has already been finished
   */
  public void finish(Instant endedAt, int durationMinutes) {
    if (!isRunning()) {
      throw new IllegalStateException("Session " + id + " is already finished");
    }
    this.endedAt = endedAt;
    this.durationMinutes = durationMinutes;
    this.legacySeconds = false;
  }

  /**
   * Rewrites a legacy seconds-denominated duration into minutes and clears the legacy flag. Running
   * legacy sessions pass {@code null} and only lose the flag.
   */
  public void convertLegacyDuration(Integer minutes) {
    this.durationMinutes = minutes;
    this.legacySeconds = false;
  }
}
