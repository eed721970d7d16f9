package io.b2mash.timeledger.ledger;

import io.b2mash.timeledger.adjustment.Adjustment;
import io.b2mash.timeledger.adjustment.AdjustmentRepository;
import io.b2mash.timeledger.exception.ResourceConflictException;
import io.b2mash.timeledger.exception.ResourceNotFoundException;
import io.b2mash.timeledger.logentry.LogEntry;
import io.b2mash.timeledger.logentry.LogEntryRepository;
import io.b2mash.timeledger.logentry.LogKind;
import io.b2mash.timeledger.session.WorkSession;
import io.b2mash.timeledger.session.WorkSessionRepository;
import io.b2mash.timeledger.user.LedgerUser;
import io.b2mash.timeledger.user.LedgerUserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persistent repository of users, sessions, adjustments and log entries. Exposes only the
 * operations the session and report services need.
 *
 * <p>Uniqueness rules (one user per name, one running session per user) are enforced by database
 * constraints; this class translates their violations into ledger errors. Writes participate in the
 * caller's transaction so that a state change and its log entry commit or roll back together.
 */
@Component
public class LedgerStore {

  private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

  private final LedgerUserRepository userRepository;
  private final WorkSessionRepository workSessionRepository;
  private final AdjustmentRepository adjustmentRepository;
  private final LogEntryRepository logEntryRepository;
  private final Clock clock;
  private final TransactionTemplate userCreationTxTemplate;

  public LedgerStore(
      LedgerUserRepository userRepository,
      WorkSessionRepository workSessionRepository,
      AdjustmentRepository adjustmentRepository,
      LogEntryRepository logEntryRepository,
      Clock clock,
      PlatformTransactionManager txManager) {
    this.userRepository = userRepository;
    this.workSessionRepository = workSessionRepository;
    this.adjustmentRepository = adjustmentRepository;
    this.logEntryRepository = logEntryRepository;
    this.clock = clock;
    this.userCreationTxTemplate = new TransactionTemplate(txManager);
    this.userCreationTxTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  // --- Users ---

  /**
   * Returns the user with this name, creating it on first use. Concurrent first logins for the same
   * name resolve to a single row: the loser of the insert race re-reads the winner's user.
   */
  public LedgerUser findOrCreateUser(String name) {
    return userRepository.findByName(name).orElseGet(() -> createUser(name));
  }

  @Transactional(readOnly = true)
  public LedgerUser requireUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  private LedgerUser createUser(String name) {
    try {
      var user =
          userCreationTxTemplate.execute(
              tx -> userRepository.saveAndFlush(new LedgerUser(name, clock.instant())));
      log.info("Created ledger user {} for name {}", user.getId(), name);
      return user;
    } catch (DataIntegrityViolationException e) {
      // Race condition: a concurrent login created this user first
      log.debug("User {} created concurrently, re-reading", name);
      return userRepository
          .findByName(name)
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "User not found after constraint violation for: " + name));
    }
  }

  // --- Sessions ---

  @Transactional(readOnly = true)
  public Optional<WorkSession> activeSession(UUID userId) {
    return workSessionRepository.findActiveByUserId(userId);
  }

  /**
   * Inserts a running session.
   *
   * @throws ResourceConflictException if the user already has a running session, including one
   *     inserted by a concurrent request that committed first
   */
  @Transactional
  public WorkSession insertSession(UUID userId, Instant start) {
    try {
      return workSessionRepository.saveAndFlush(new WorkSession(userId, start));
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Session already running", "User " + userId + " already has an active session");
    }
  }

  /**
   * Sets end instant and duration on a running session. A concurrent finish of the same session
   * fails with an optimistic locking exception at flush.
   *
   * @throws ResourceNotFoundException if no such session exists
   * @throws ResourceConflictException if the session has already been finished
   */
  @Transactional
  public WorkSession finishSession(UUID sessionId, Instant end, int minutes) {
    var session =
        workSessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
    if (!session.isRunning()) {
      throw new ResourceConflictException(
          "Session already finished", "Session " + sessionId + " was stopped earlier");
    }
    session.finish(end, minutes);
    return workSessionRepository.saveAndFlush(session);
  }

  @Transactional(readOnly = true)
  public List<WorkSession> listFinishedSessions(UUID userId) {
    return workSessionRepository.findFinishedByUserId(userId);
  }

  // --- Adjustments ---

  @Transactional
  public Adjustment insertAdjustment(UUID userId, int minutes, String reason, Instant createdAt) {
    if (minutes == 0) {
      throw new IllegalArgumentException("Adjustment minutes must be non-zero");
    }
    return adjustmentRepository.save(new Adjustment(userId, minutes, reason, createdAt));
  }

  @Transactional(readOnly = true)
  public List<Adjustment> listAdjustments(UUID userId) {
    return adjustmentRepository.findByUserIdOrderByCreatedAtDesc(userId);
  }

  // --- Log entries ---

  @Transactional
  public LogEntry appendLog(
      UUID userId, LogKind kind, Integer minutes, String details, Instant recordedAt) {
    return logEntryRepository.save(new LogEntry(userId, kind, minutes, details, recordedAt));
  }

  /** Newest first, at most {@code limit} entries. */
  @Transactional(readOnly = true)
  public List<LogEntry> listLogs(UUID userId, int limit) {
    return logEntryRepository.findRecentByUserId(userId, PageRequest.of(0, limit));
  }
}
