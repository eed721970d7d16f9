package io.b2mash.timeledger.adjustment;

import io.b2mash.timeledger.exception.InvalidStateException;
import io.b2mash.timeledger.ledger.LedgerRevision;
import io.b2mash.timeledger.ledger.LedgerStore;
import io.b2mash.timeledger.logentry.LogKind;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AdjustmentService {

  private static final Logger log = LoggerFactory.getLogger(AdjustmentService.class);

  static final String DEFAULT_DETAIL = "Manual adjustment";

  private final LedgerStore ledgerStore;
  private final LedgerRevision ledgerRevision;
  private final Clock clock;

  public AdjustmentService(LedgerStore ledgerStore, LedgerRevision ledgerRevision, Clock clock) {
    this.ledgerStore = ledgerStore;
    this.ledgerRevision = ledgerRevision;
    this.clock = clock;
  }

  /**
   * Records a signed correction. Independent of whether a session is running.
   *
   * @throws InvalidStateException if {@code deltaMinutes} is zero
   */
  @Transactional
  public Adjustment adjust(UUID userId, int deltaMinutes, String reason) {
    if (deltaMinutes == 0) {
      throw new InvalidStateException(
          "Invalid adjustment", "Adjustment must be a non-zero number of minutes");
    }
    ledgerStore.requireUser(userId);

    String trimmed = reason != null && !reason.isBlank() ? reason.strip() : null;
    Instant now = clock.instant();

    var adjustment = ledgerStore.insertAdjustment(userId, deltaMinutes, trimmed, now);
    ledgerStore.appendLog(
        userId, LogKind.ADJUST, deltaMinutes, trimmed != null ? trimmed : DEFAULT_DETAIL, now);
    ledgerRevision.markChanged();

    log.info(
        "Recorded adjustment {} of {} minutes for user {}",
        adjustment.getId(),
        deltaMinutes,
        userId);
    return adjustment;
  }
}
