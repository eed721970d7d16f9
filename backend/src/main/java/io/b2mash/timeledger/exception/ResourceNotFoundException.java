package io.b2mash.timeledger.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends LedgerProblemException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, title, detail);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }
}
