package io.b2mash.timeledger.exception;

import org.springframework.http.HttpStatus;

/** Malformed or out-of-range input. Nothing has been written when this is thrown. */
public class InvalidStateException extends LedgerProblemException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, title, detail);
  }
}
