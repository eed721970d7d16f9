package io.b2mash.timeledger.adjustment;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AdjustmentController {

  private final AdjustmentService adjustmentService;

  public AdjustmentController(AdjustmentService adjustmentService) {
    this.adjustmentService = adjustmentService;
  }

  @PostMapping("/api/users/{userId}/adjustments")
  public ResponseEntity<AdjustmentResponse> createAdjustment(
      @PathVariable UUID userId, @Valid @RequestBody CreateAdjustmentRequest request) {
    var adjustment =
        adjustmentService.adjust(userId, request.deltaMinutes(), request.reason());
    return ResponseEntity.created(
            URI.create("/api/users/" + userId + "/adjustments/" + adjustment.getId()))
        .body(AdjustmentResponse.from(adjustment));
  }

  // --- DTOs ---

  public record CreateAdjustmentRequest(
      @NotNull(message = "deltaMinutes is required") Integer deltaMinutes,
      @Size(max = 2000, message = "reason must be at most 2000 characters") String reason) {}

  public record AdjustmentResponse(
      UUID id, UUID userId, int minutes, String reason, Instant createdAt) {

    public static AdjustmentResponse from(Adjustment adjustment) {
      return new AdjustmentResponse(
          adjustment.getId(),
          adjustment.getUserId(),
          adjustment.getMinutes(),
          adjustment.getReason(),
          adjustment.getCreatedAt());
    }
  }
}
