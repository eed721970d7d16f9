package io.b2mash.timeledger.logentry;

import io.b2mash.timeledger.session.DurationPolicy;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LogEntryController {

  private final LogEntryService logEntryService;

  public LogEntryController(LogEntryService logEntryService) {
    this.logEntryService = logEntryService;
  }

  @GetMapping("/api/users/{userId}/logs")
  public ResponseEntity<List<LogEntryResponse>> recentLogs(
      @PathVariable UUID userId, @RequestParam(required = false) Integer limit) {
    var entries = logEntryService.recentLogs(userId, limit);
    return ResponseEntity.ok(entries.stream().map(LogEntryResponse::from).toList());
  }

  public record LogEntryResponse(
      Long id, Instant recordedAt, String kind, Integer minutes, String duration, String details) {

    public static LogEntryResponse from(LogEntry entry) {
      return new LogEntryResponse(
          entry.getId(),
          entry.getRecordedAt(),
          entry.getKind().value(),
          entry.getMinutes(),
          entry.getMinutes() != null ? DurationPolicy.formatHoursMinutes(entry.getMinutes()) : null,
          entry.getDetails());
    }
  }
}
