/*
 * Where: subscription model
 * What: the three terminal states of POST /subscription and their HTTP status
 * Why: the status decision table lives in one place and is testable without a server
 */
package com.newsletter.subscription.model;

import java.util.Locale;
import org.springframework.http.HttpStatus;

public enum SubscriptionOutcome {
  /** The form could not be extracted; nothing was persisted. */
  REJECTED(HttpStatus.BAD_REQUEST),
  PERSISTED(HttpStatus.OK),
  /** The insert failed; the cause is logged, never returned. */
  FAILED(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus httpStatus;

  SubscriptionOutcome(HttpStatus httpStatus) {
    this.httpStatus = httpStatus;
  }

  public HttpStatus httpStatus() {
    return httpStatus;
  }

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
