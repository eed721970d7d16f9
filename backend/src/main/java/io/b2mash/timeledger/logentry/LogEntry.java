package io.b2mash.timeledger.logentry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record of one ledger mutation. The identity column doubles as the creation
 * sequence, so "newest first" is {@code ORDER BY id DESC}. Updates are rejected by a database
 * trigger except for the one-time legacy unit conversion.
 */
@Entity
@Table(name = "log_entries")
public class LogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, updatable = false, length = 16)
  private LogKind kind;

  @Column(name = "minutes")
  private Integer minutes;

  @Column(name = "recorded_at", nullable = false, updatable = false)
  private Instant recordedAt;

  @Column(name = "details", columnDefinition = "TEXT")
  private String details;

  @Column(name = "legacy_seconds", nullable = false)
  private boolean legacySeconds;

  protected LogEntry() {}

  public LogEntry(UUID userId, LogKind kind, Integer minutes, String details, Instant recordedAt) {
    this.userId = userId;
    this.kind = kind;
    this.minutes = minutes;
    this.details = details;
    this.recordedAt = recordedAt;
  }

  public Long getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public LogKind getKind() {
    return kind;
  }

  public Integer getMinutes() {
    return minutes;
  }

  public Instant getRecordedAt() {
    return recordedAt;
  }

  public String getDetails() {
    return details;
  }

  public boolean isLegacySeconds() {
    return legacySeconds;
  }

  public void convertLegacyDuration(Integer minutes) {
    this.minutes = minutes;
    this.legacySeconds = false;
  }
}
