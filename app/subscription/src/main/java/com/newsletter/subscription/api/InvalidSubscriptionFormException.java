package com.newsletter.subscription.api;

/** The form fields did not come from a form-url-encoded request body. */
public class InvalidSubscriptionFormException extends RuntimeException {

  public InvalidSubscriptionFormException(String message) {
    super(message);
  }
}
