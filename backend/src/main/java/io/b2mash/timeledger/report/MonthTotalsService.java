package io.b2mash.timeledger.report;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.timeledger.config.LedgerProperties;
import io.b2mash.timeledger.ledger.LedgerRevision;
import io.b2mash.timeledger.ledger.LedgerStore;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Month-bucketed totals recomputed from finished sessions and adjustments. Sessions count in the
 * month of their end instant, adjustments in the month of their creation instant, both evaluated in
 * the display timezone.
 *
 * <p>Results are cached per user and ledger revision (Caffeine, bounded TTL). Any committed
 * mutation advances the revision, so a cached result is never served for a changed ledger.
 */
@Service
public class MonthTotalsService {

  private static final Logger log = LoggerFactory.getLogger(MonthTotalsService.class);

  private final LedgerStore ledgerStore;
  private final LedgerRevision ledgerRevision;
  private final LedgerProperties ledgerProperties;
  private final Clock clock;
  private final Cache<TotalsKey, List<MonthTotal>> totalsCache;

  public MonthTotalsService(
      LedgerStore ledgerStore,
      LedgerRevision ledgerRevision,
      LedgerProperties ledgerProperties,
      Clock clock) {
    this.ledgerStore = ledgerStore;
    this.ledgerRevision = ledgerRevision;
    this.ledgerProperties = ledgerProperties;
    this.clock = clock;
    this.totalsCache =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(ledgerProperties.totalsCacheTtl())
            .build();
  }

  /** Totals per month, newest month first. Months without entries are absent. */
  @Transactional(readOnly = true)
  public List<MonthTotal> monthTotals(UUID userId) {
    ledgerStore.requireUser(userId);
    var key = new TotalsKey(userId, ledgerRevision.current());
    var cached = totalsCache.getIfPresent(key);
    if (cached != null) {
      log.debug("Month totals cache hit for user {} at revision {}", userId, key.revision());
      return cached;
    }
    var totals = computeTotals(userId);
    totalsCache.put(key, totals);
    log.debug("Computed {} month buckets for user {}", totals.size(), userId);
    return totals;
  }

  /** Total for the display-timezone month containing now; zero when nothing was recorded. */
  @Transactional(readOnly = true)
  public MonthTotal currentMonth(UUID userId) {
    String current = monthKey(clock.instant());
    return monthTotals(userId).stream()
        .filter(t -> t.month().equals(current))
        .findFirst()
        .orElse(new MonthTotal(current, 0));
  }

  public long currentMonthMinutes(UUID userId) {
    return currentMonth(userId).minutes();
  }

  private List<MonthTotal> computeTotals(UUID userId) {
    Map<String, Long> buckets = new TreeMap<>();
    for (var session : ledgerStore.listFinishedSessions(userId)) {
      int minutes = session.getDurationMinutes() != null ? session.getDurationMinutes() : 0;
      buckets.merge(monthKey(session.getEndedAt()), (long) minutes, Long::sum);
    }
    for (var adjustment : ledgerStore.listAdjustments(userId)) {
      buckets.merge(monthKey(adjustment.getCreatedAt()), (long) adjustment.getMinutes(), Long::sum);
    }
    return buckets.entrySet().stream()
        .map(e -> new MonthTotal(e.getKey(), e.getValue()))
        .sorted(Comparator.comparing(MonthTotal::month).reversed())
        .toList();
  }

  private String monthKey(Instant instant) {
    return YearMonth.from(instant.atZone(ledgerProperties.displayZone())).toString();
  }

  private record TotalsKey(UUID userId, long revision) {}
}
