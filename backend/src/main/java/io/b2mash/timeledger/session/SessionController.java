package io.b2mash.timeledger.session;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SessionController {

  private final SessionService sessionService;

  public SessionController(SessionService sessionService) {
    this.sessionService = sessionService;
  }

  @PostMapping("/api/users/{userId}/sessions/start")
  public ResponseEntity<SessionResponse> startSession(@PathVariable UUID userId) {
    var session = sessionService.start(userId);
    return ResponseEntity.created(
            URI.create("/api/users/" + userId + "/sessions/" + session.getId()))
        .body(SessionResponse.from(session));
  }

  @PostMapping("/api/users/{userId}/sessions/stop")
  public ResponseEntity<SessionResponse> stopSession(@PathVariable UUID userId) {
    return ResponseEntity.ok(SessionResponse.from(sessionService.stop(userId)));
  }

  /** Polled by the client on every refresh tick; 204 when the user is idle. */
  @GetMapping("/api/users/{userId}/sessions/active")
  public ResponseEntity<ActiveSessionResponse> activeSession(@PathVariable UUID userId) {
    return sessionService
        .activeSession(userId)
        .map(view -> ResponseEntity.ok(ActiveSessionResponse.from(view)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  // --- DTOs ---

  public record SessionResponse(
      UUID id,
      UUID userId,
      Instant startedAt,
      Instant endedAt,
      Integer durationMinutes,
      boolean running) {

    public static SessionResponse from(WorkSession session) {
      return new SessionResponse(
          session.getId(),
          session.getUserId(),
          session.getStartedAt(),
          session.getEndedAt(),
          session.getDurationMinutes(),
          session.isRunning());
    }
  }

  public record ActiveSessionResponse(
      UUID sessionId, Instant startedAt, long elapsedSeconds, String elapsed) {

    public static ActiveSessionResponse from(SessionService.ActiveSessionView view) {
      return new ActiveSessionResponse(
          view.sessionId(), view.startedAt(), view.elapsedSeconds(), view.elapsed());
    }
  }
}
