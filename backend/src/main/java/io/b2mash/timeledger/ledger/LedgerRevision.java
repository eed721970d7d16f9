package io.b2mash.timeledger.ledger;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Monotonic counter of committed ledger mutations. Derived read models (month totals) key their
 * caches on it. Inside a transaction the bump is deferred until after commit, so a concurrent
 * reader can never cache pre-commit state under the new revision.
 */
@Component
public class LedgerRevision {

  private final AtomicLong revision = new AtomicLong();

  public long current() {
    return revision.get();
  }

  public void markChanged() {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              revision.incrementAndGet();
            }
          });
    } else {
      revision.incrementAndGet();
    }
  }
}
