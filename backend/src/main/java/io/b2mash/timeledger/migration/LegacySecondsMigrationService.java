package io.b2mash.timeledger.migration;

import io.b2mash.timeledger.adjustment.AdjustmentRepository;
import io.b2mash.timeledger.ledger.LedgerRevision;
import io.b2mash.timeledger.logentry.LogEntryRepository;
import io.b2mash.timeledger.session.DurationPolicy;
import io.b2mash.timeledger.session.WorkSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One-time conversion of rows imported from the earlier application, which stored seconds in its
 * "minutes" columns. Imported rows carry {@code legacy_seconds = true}; each is rewritten to minutes
 * with {@link DurationPolicy#minutesFromLegacySeconds(long)} and its flag cleared in the same
 * transaction, so a second run finds nothing to do.
 *
 * <p>No minimum-billable rule is applied: a legacy 10-second session becomes 0 minutes, as the
 * original data recorded it.
 */
@Service
public class LegacySecondsMigrationService {

  private static final Logger log = LoggerFactory.getLogger(LegacySecondsMigrationService.class);

  private final WorkSessionRepository workSessionRepository;
  private final AdjustmentRepository adjustmentRepository;
  private final LogEntryRepository logEntryRepository;
  private final LedgerRevision ledgerRevision;

  public LegacySecondsMigrationService(
      WorkSessionRepository workSessionRepository,
      AdjustmentRepository adjustmentRepository,
      LogEntryRepository logEntryRepository,
      LedgerRevision ledgerRevision) {
    this.workSessionRepository = workSessionRepository;
    this.adjustmentRepository = adjustmentRepository;
    this.logEntryRepository = logEntryRepository;
    this.ledgerRevision = ledgerRevision;
  }

  @Transactional
  public MigrationResult migrate() {
    int sessions = 0;
    for (var session : workSessionRepository.findByLegacySecondsTrue()) {
      Integer seconds = session.getDurationMinutes();
      session.convertLegacyDuration(
          seconds != null ? DurationPolicy.minutesFromLegacySeconds(seconds) : null);
      sessions++;
    }

    int adjustments = 0;
    for (var adjustment : adjustmentRepository.findByLegacySecondsTrue()) {
      adjustment.convertLegacyDuration(
          DurationPolicy.minutesFromLegacySeconds(adjustment.getMinutes()));
      adjustments++;
    }

    int logEntries = 0;
    for (var entry : logEntryRepository.findByLegacySecondsTrue()) {
      Integer seconds = entry.getMinutes();
      entry.convertLegacyDuration(
          seconds != null ? DurationPolicy.minutesFromLegacySeconds(seconds) : null);
      logEntries++;
    }

    var result = new MigrationResult(sessions, adjustments, logEntries);
    if (result.total() > 0) {
      ledgerRevision.markChanged();
      log.info(
          "Converted legacy seconds to minutes: {} sessions, {} adjustments, {} log entries",
          sessions,
          adjustments,
          logEntries);
    } else {
      log.info("No legacy seconds rows left to convert");
    }
    return result;
  }

  public record MigrationResult(int sessions, int adjustments, int logEntries) {

    public int total() {
      return sessions + adjustments + logEntries;
    }
  }
}
