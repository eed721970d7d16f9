package io.b2mash.timeledger.session;

import io.b2mash.timeledger.config.LedgerProperties;
import io.b2mash.timeledger.exception.ResourceNotFoundException;
import io.b2mash.timeledger.ledger.LedgerRevision;
import io.b2mash.timeledger.ledger.LedgerStore;
import io.b2mash.timeledger.logentry.LogKind;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Start/stop state machine per user: {@code Idle} (no running session) and {@code Running}. Each
 * transition writes the session change and its log entry in one transaction.
 */
@Service
public class SessionService {

  private static final Logger log = LoggerFactory.getLogger(SessionService.class);

  static final DateTimeFormatter DETAIL_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final LedgerStore ledgerStore;
  private final LedgerRevision ledgerRevision;
  private final LedgerProperties ledgerProperties;
  private final Clock clock;

  public SessionService(
      LedgerStore ledgerStore,
      LedgerRevision ledgerRevision,
      LedgerProperties ledgerProperties,
      Clock clock) {
    this.ledgerStore = ledgerStore;
    this.ledgerRevision = ledgerRevision;
    this.ledgerProperties = ledgerProperties;
    this.clock = clock;
  }

  /**
   * Starts a session for an idle user.
   *
   * @throws io.b2mash.timeledger.exception.ResourceConflictException if a session is already
   *     running
   */
  @Transactional
  public WorkSession start(UUID userId) {
    ledgerStore.requireUser(userId);
    Instant now = clock.instant();

    var session = ledgerStore.insertSession(userId, now);
    ledgerStore.appendLog(userId, LogKind.START, null, "Started at " + formatLocal(now), now);
    ledgerRevision.markChanged();

    log.info("Started session {} for user {}", session.getId(), userId);
    return session;
  }

  /**
   * Stops the running session, fixing its billable duration.
   *
   * @throws ResourceNotFoundException if the user has no running session
   */
  @Transactional
  public WorkSession stop(UUID userId) {
    ledgerStore.requireUser(userId);
    var active =
        ledgerStore
            .activeSession(userId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "No active session", "User " + userId + " has no running session"));

    Instant end = clock.instant();
    if (end.isBefore(active.getStartedAt())) {
      log.warn(
          "Clock skew on stop: session {} started at {} but now is {}; elapsed clamped to 0",
          active.getId(),
          active.getStartedAt(),
          end);
    }
    long elapsed = DurationPolicy.elapsedSeconds(active.getStartedAt(), end);
    int minutes = DurationPolicy.billableMinutes(active.getStartedAt(), end);

    var finished = ledgerStore.finishSession(active.getId(), end, minutes);
    ledgerStore.appendLog(
        userId,
        LogKind.STOP,
        minutes,
        "Stopped at " + formatLocal(end) + " after " + DurationPolicy.formatHms(elapsed),
        end);
    ledgerRevision.markChanged();

    log.info(
        "Stopped session {} for user {}: {} elapsed, {} minutes recorded",
        finished.getId(),
        userId,
        DurationPolicy.formatHms(elapsed),
        minutes);
    return finished;
  }

  /**
   * The running session together with its live elapsed time. Computed fresh on every call; nothing
   * is persisted.
   */
  @Transactional(readOnly = true)
  public Optional<ActiveSessionView> activeSession(UUID userId) {
    ledgerStore.requireUser(userId);
    Instant now = clock.instant();
    return ledgerStore
        .activeSession(userId)
        .map(
            s ->
                new ActiveSessionView(
                    s.getId(),
                    s.getStartedAt(),
                    DurationPolicy.elapsedSeconds(s.getStartedAt(), now)));
  }

  private String formatLocal(Instant instant) {
    return DETAIL_TIMESTAMP.format(instant.atZone(ledgerProperties.displayZone()));
  }

  public record ActiveSessionView(UUID sessionId, Instant startedAt, long elapsedSeconds) {

    public String elapsed() {
      return DurationPolicy.formatHms(elapsedSeconds);
    }
  }
}
