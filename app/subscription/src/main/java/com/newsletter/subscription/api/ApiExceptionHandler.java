package com.newsletter.subscription.api;

import com.newsletter.subscription.model.SubscriptionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  // MethodArgumentNotValidException is a BindException, so form binding and validation land here
  @ExceptionHandler(BindException.class)
  public ResponseEntity<ApiErrorResponse> handleBinding(BindException ex) {
    return rejected("request validation failed");
  }

  @ExceptionHandler(InvalidSubscriptionFormException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidForm(InvalidSubscriptionFormException ex) {
    return rejected(ex.getMessage());
  }

  // only POST /subscription restricts its media type; anything but a url-encoded form is rejected
  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return rejected("request body must be application/x-www-form-urlencoded");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<Void> handleRuntime(RuntimeException ex) {
    logger.error("unhandled error while serving request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
  }

  private static ResponseEntity<ApiErrorResponse> rejected(String message) {
    return ResponseEntity.status(SubscriptionOutcome.REJECTED.httpStatus())
        .body(new ApiErrorResponse("SUBSCRIPTION_BAD_REQUEST", message));
  }
}
