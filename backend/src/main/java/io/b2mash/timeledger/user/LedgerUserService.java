package io.b2mash.timeledger.user;

import io.b2mash.timeledger.config.LedgerProperties;
import io.b2mash.timeledger.exception.ForbiddenException;
import io.b2mash.timeledger.exception.InvalidStateException;
import io.b2mash.timeledger.ledger.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Name-based login. Selecting a name is not authentication: it only resolves the ledger that the
 * following commands and queries operate on.
 */
@Service
public class LedgerUserService {

  private static final Logger log = LoggerFactory.getLogger(LedgerUserService.class);

  private static final int MAX_NAME_LENGTH = 255;

  private final LedgerStore ledgerStore;
  private final LedgerProperties ledgerProperties;

  public LedgerUserService(LedgerStore ledgerStore, LedgerProperties ledgerProperties) {
    this.ledgerStore = ledgerStore;
    this.ledgerProperties = ledgerProperties;
  }

  public LedgerUser login(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid name", "Name must not be blank");
    }
    String trimmed = name.strip();
    if (trimmed.length() > MAX_NAME_LENGTH) {
      throw new InvalidStateException(
          "Invalid name", "Name must be at most " + MAX_NAME_LENGTH + " characters");
    }
    if (!ledgerProperties.isAllowed(trimmed)) {
      log.warn("Login rejected for name outside the allowed list: {}", trimmed);
      throw new ForbiddenException("Login not allowed", "Name '" + trimmed + "' is not allowed");
    }
    return ledgerStore.findOrCreateUser(trimmed);
  }
}
