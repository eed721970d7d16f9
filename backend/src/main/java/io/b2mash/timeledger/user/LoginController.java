package io.b2mash.timeledger.user;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LoginController {

  private final LedgerUserService ledgerUserService;

  public LoginController(LedgerUserService ledgerUserService) {
    this.ledgerUserService = ledgerUserService;
  }

  @PostMapping("/api/login")
  public ResponseEntity<UserResponse> login(@Valid @RequestBody LoginRequest request) {
    var user = ledgerUserService.login(request.name());
    return ResponseEntity.ok(new UserResponse(user.getId(), user.getName()));
  }

  public record LoginRequest(@NotBlank(message = "name is required") String name) {}

  public record UserResponse(UUID id, String name) {}
}
