package io.b2mash.timeledger.adjustment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A signed manual correction in whole minutes. Immutable once created; counted in the month of
 * {@link #getCreatedAt()}.
 */
@Entity
@Table(name = "adjustments")
public class Adjustment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "minutes", nullable = false)
  private int minutes;

  @Column(name = "reason", columnDefinition = "TEXT")
  private String reason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "legacy_seconds", nullable = false)
  private boolean legacySeconds;

  protected Adjustment() {}

  public Adjustment(UUID userId, int minutes, String reason, Instant createdAt) {
    this.userId = userId;
    this.minutes = minutes;
    this.reason = reason;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public int getMinutes() {
    return minutes;
  }

  public String getReason() {
    return reason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isLegacySeconds() {
    return legacySeconds;
  }

  public void convertLegacyDuration(int minutes) {
    this.minutes = minutes;
    this.legacySeconds = false;
  }
}
