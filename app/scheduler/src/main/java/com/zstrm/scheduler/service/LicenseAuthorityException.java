/*
 * Where: scheduler service layer
 * What: failure of the remote license renewal call
 * Why: the renewal cycle absorbs every reason the same way while logs keep them apart
 */
package com.zstrm.scheduler.service;

public class LicenseAuthorityException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public LicenseAuthorityException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public LicenseAuthorityException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
