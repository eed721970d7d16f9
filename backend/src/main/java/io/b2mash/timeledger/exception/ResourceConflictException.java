package io.b2mash.timeledger.exception;

import org.springframework.http.HttpStatus;

/** The requested transition is not valid from the current ledger state. */
public class ResourceConflictException extends LedgerProblemException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, title, detail);
  }
}
