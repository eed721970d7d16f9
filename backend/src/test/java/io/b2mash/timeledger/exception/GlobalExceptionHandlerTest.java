package io.b2mash.timeledger.exception;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.timeledger.adjustment.AdjustmentController;
import io.b2mash.timeledger.adjustment.AdjustmentService;
import io.b2mash.timeledger.session.SessionController;
import io.b2mash.timeledger.session.SessionService;
import io.b2mash.timeledger.session.WorkSession;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.CannotCreateTransactionException;

class GlobalExceptionHandlerTest {

  private static final UUID USER_ID = UUID.randomUUID();

  private final SessionService sessionService = mock(SessionService.class);
  private final AdjustmentService adjustmentService = mock(AdjustmentService.class);
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SessionController(sessionService), new AdjustmentController(adjustmentService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void conflict_mapsTo409ProblemDetail() throws Exception {
    when(sessionService.start(USER_ID))
        .thenThrow(new ResourceConflictException("Session already running", "busy"));

    mockMvc
        .perform(post("/api/users/" + USER_ID + "/sessions/start"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Session already running"))
        .andExpect(jsonPath("$.detail").value("busy"));
  }

  @Test
  void notFound_mapsTo404() throws Exception {
    when(sessionService.stop(USER_ID))
        .thenThrow(ResourceNotFoundException.withDetail("No active session", "idle"));

    mockMvc
        .perform(post("/api/users/" + USER_ID + "/sessions/stop"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("No active session"));
  }

  @Test
  void concurrentStop_mapsTo409() throws Exception {
    when(sessionService.stop(USER_ID))
        .thenThrow(new ObjectOptimisticLockingFailureException(WorkSession.class, UUID.randomUUID()));

    mockMvc
        .perform(post("/api/users/" + USER_ID + "/sessions/stop"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Concurrent modification"));
  }

  @Test
  void storageFailure_mapsTo503AndIsRetryable() throws Exception {
    when(sessionService.start(USER_ID))
        .thenThrow(new CannotCreateTransactionException("connection refused"));

    mockMvc
        .perform(post("/api/users/" + USER_ID + "/sessions/start"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.title").value("Storage unavailable"))
        .andExpect(jsonPath("$.retryable").value(true));
  }

  @Test
  void zeroAdjustment_mapsTo400() throws Exception {
    when(adjustmentService.adjust(any(), anyInt(), any()))
        .thenThrow(new InvalidStateException("Invalid adjustment", "non-zero required"));

    mockMvc
        .perform(
            post("/api/users/" + USER_ID + "/adjustments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"deltaMinutes": 0}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid adjustment"));
  }

  @Test
  void missingDelta_failsBeanValidation() throws Exception {
    mockMvc
        .perform(
            post("/api/users/" + USER_ID + "/adjustments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"reason": "forgot the number"}
                    """))
        .andExpect(status().isBadRequest());
  }
}
