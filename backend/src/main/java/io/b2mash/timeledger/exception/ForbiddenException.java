package io.b2mash.timeledger.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends LedgerProblemException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, title, detail);
  }
}
