package io.b2mash.timeledger.logentry;

import io.b2mash.timeledger.config.LedgerProperties;
import io.b2mash.timeledger.exception.InvalidStateException;
import io.b2mash.timeledger.ledger.LedgerStore;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LogEntryService {

  private final LedgerStore ledgerStore;
  private final LedgerProperties ledgerProperties;

  public LogEntryService(LedgerStore ledgerStore, LedgerProperties ledgerProperties) {
    this.ledgerStore = ledgerStore;
    this.ledgerProperties = ledgerProperties;
  }

  /**
   * Most recent log entries, newest first. A missing limit means the configured cap; larger limits
   * are clamped to it.
   */
  @Transactional(readOnly = true)
  public List<LogEntry> recentLogs(UUID userId, Integer limit) {
    if (limit != null && limit <= 0) {
      throw new InvalidStateException("Invalid limit", "limit must be positive");
    }
    ledgerStore.requireUser(userId);
    int cap = ledgerProperties.logLimit();
    int effective = limit == null ? cap : Math.min(limit, cap);
    return ledgerStore.listLogs(userId, effective);
  }
}
