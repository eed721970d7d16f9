package io.b2mash.timeledger.report;

import io.b2mash.timeledger.session.DurationPolicy;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReportController {

  private final MonthTotalsService monthTotalsService;

  public ReportController(MonthTotalsService monthTotalsService) {
    this.monthTotalsService = monthTotalsService;
  }

  @GetMapping("/api/users/{userId}/month-totals")
  public ResponseEntity<List<MonthTotalResponse>> monthTotals(@PathVariable UUID userId) {
    var totals = monthTotalsService.monthTotals(userId);
    return ResponseEntity.ok(totals.stream().map(MonthTotalResponse::from).toList());
  }

  @GetMapping("/api/users/{userId}/month-totals/current")
  public ResponseEntity<MonthTotalResponse> currentMonth(@PathVariable UUID userId) {
    return ResponseEntity.ok(MonthTotalResponse.from(monthTotalsService.currentMonth(userId)));
  }

  /** Tabular row: month key, minutes and the same total as {@code HH:MM}. */
  public record MonthTotalResponse(String month, long minutes, String duration) {

    public static MonthTotalResponse from(MonthTotal total) {
      return new MonthTotalResponse(
          total.month(), total.minutes(), DurationPolicy.formatHoursMinutes(total.minutes()));
    }
  }
}
