package io.b2mash.timeledger.migration;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoint; safe to call repeatedly. */
@RestController
public class LegacySecondsMigrationController {

  private final LegacySecondsMigrationService migrationService;

  public LegacySecondsMigrationController(LegacySecondsMigrationService migrationService) {
    this.migrationService = migrationService;
  }

  @PostMapping("/internal/migrations/legacy-seconds")
  public ResponseEntity<LegacySecondsMigrationService.MigrationResult> migrateLegacySeconds() {
    return ResponseEntity.ok(migrationService.migrate());
  }
}
