package io.b2mash.timeledger.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.timeledger.adjustment.Adjustment;
import io.b2mash.timeledger.config.LedgerProperties;
import io.b2mash.timeledger.ledger.LedgerRevision;
import io.b2mash.timeledger.ledger.LedgerStore;
import io.b2mash.timeledger.session.WorkSession;
import io.b2mash.timeledger.testutil.MutableClock;
import io.b2mash.timeledger.user.LedgerUser;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MonthTotalsServiceTest {

  private static final UUID USER_ID = UUID.randomUUID();

  @Mock private LedgerStore ledgerStore;

  private final MutableClock clock = new MutableClock(Instant.parse("2024-04-10T12:00:00Z"));
  private final LedgerRevision ledgerRevision = new LedgerRevision();
  private MonthTotalsService service;

  @BeforeEach
  void setUp() {
    var properties =
        new LedgerProperties(ZoneOffset.ofHours(1), 500, List.of(), Duration.ofSeconds(30));
    service = new MonthTotalsService(ledgerStore, ledgerRevision, properties, clock);
    when(ledgerStore.requireUser(USER_ID)).thenReturn(new LedgerUser("Alice", clock.instant()));
  }

  @Test
  void sessionIsBucketedByLocalMonthOfItsEnd() {
    // Starts in March (UTC), ends 00:01:10 UTC on April 1st -> April in +01:00
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(List.of(finished("2024-03-31T23:58:30Z", "2024-04-01T00:01:10Z", 3)));
    when(ledgerStore.listAdjustments(USER_ID)).thenReturn(List.of());

    assertThat(service.monthTotals(USER_ID)).containsExactly(new MonthTotal("2024-04", 3));
  }

  @Test
  void utcMarchEndIsStillAprilInDisplayZone() {
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(List.of(finished("2024-03-31T22:00:00Z", "2024-03-31T23:30:00Z", 90)));
    when(ledgerStore.listAdjustments(USER_ID)).thenReturn(List.of());

    assertThat(service.monthTotals(USER_ID)).containsExactly(new MonthTotal("2024-04", 90));
  }

  @Test
  void adjustmentsCountInMonthOfCreationAndBucketsSortNewestFirst() {
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(
            List.of(
                finished("2024-02-10T08:00:00Z", "2024-02-10T10:00:00Z", 120),
                finished("2024-04-02T08:00:00Z", "2024-04-02T09:00:00Z", 60),
                finished("2024-03-31T23:58:30Z", "2024-04-01T00:01:10Z", 3)));
    when(ledgerStore.listAdjustments(USER_ID))
        .thenReturn(
            List.of(
                adjustment(-15, "2024-04-05T09:00:00Z"),
                adjustment(45, "2024-02-29T23:30:00Z"),
                adjustment(10, "2023-12-31T23:30:00Z")));

    var totals = service.monthTotals(USER_ID);

    assertThat(totals)
        .containsExactly(
            new MonthTotal("2024-04", 48),
            new MonthTotal("2024-03", 45),
            new MonthTotal("2024-02", 120),
            new MonthTotal("2024-01", 10));
    assertThat(totals.stream().mapToLong(MonthTotal::minutes).sum())
        .isEqualTo(120 + 60 + 3 - 15 + 45 + 10);
  }

  @Test
  void repeatedCallsWithoutMutationAreIdenticalAndServedFromCache() {
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(List.of(finished("2024-04-02T08:00:00Z", "2024-04-02T09:00:00Z", 60)));
    when(ledgerStore.listAdjustments(USER_ID)).thenReturn(List.of());

    var first = service.monthTotals(USER_ID);
    var second = service.monthTotals(USER_ID);

    assertThat(second).isEqualTo(first);
    verify(ledgerStore, times(1)).listFinishedSessions(USER_ID);
  }

  @Test
  void revisionChangeForcesRecomputation() {
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(List.of(finished("2024-04-02T08:00:00Z", "2024-04-02T09:00:00Z", 60)));
    when(ledgerStore.listAdjustments(USER_ID))
        .thenReturn(List.of())
        .thenReturn(List.of(adjustment(-15, "2024-04-05T09:00:00Z")));

    assertThat(service.monthTotals(USER_ID)).containsExactly(new MonthTotal("2024-04", 60));
    ledgerRevision.markChanged();
    assertThat(service.monthTotals(USER_ID)).containsExactly(new MonthTotal("2024-04", 45));
  }

  @Test
  void currentMonth_defaultsToZeroWhenNothingRecorded() {
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(List.of(finished("2024-02-10T08:00:00Z", "2024-02-10T10:00:00Z", 120)));
    when(ledgerStore.listAdjustments(USER_ID)).thenReturn(List.of());

    assertThat(service.currentMonth(USER_ID)).isEqualTo(new MonthTotal("2024-04", 0));
    assertThat(service.currentMonthMinutes(USER_ID)).isZero();
  }

  @Test
  void currentMonth_usesDisplayZoneForToday() {
    // 23:30 UTC on April 30th is already May 1st in +01:00
    clock.set("2024-04-30T23:30:00Z");
    when(ledgerStore.listFinishedSessions(USER_ID))
        .thenReturn(List.of(finished("2024-04-30T22:00:00Z", "2024-04-30T23:10:00Z", 70)));
    when(ledgerStore.listAdjustments(USER_ID)).thenReturn(List.of());

    assertThat(service.currentMonthMinutes(USER_ID)).isEqualTo(70);
  }

  private static WorkSession finished(String start, String end, int minutes) {
    var session = new WorkSession(USER_ID, Instant.parse(start));
    session.finish(Instant.parse(end), minutes);
    return session;
  }

  private static Adjustment adjustment(int minutes, String createdAt) {
    return new Adjustment(USER_ID, minutes, null, Instant.parse(createdAt));
  }
}
