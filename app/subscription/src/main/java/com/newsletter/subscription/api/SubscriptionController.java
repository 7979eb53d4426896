package com.newsletter.subscription.api;

import com.newsletter.subscription.api.request.SubscriptionForm;
import com.newsletter.subscription.model.SubscriptionOutcome;
import com.newsletter.subscription.service.SubscriptionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

@RestController
@RequiredArgsConstructor
public class SubscriptionController {

  private static final Set<String> FORM_FIELDS = Set.of("email", "name");

  private final SubscriptionService subscriptionService;

  /**
   * Binding failures never reach this method; {@link ApiExceptionHandler} answers them. Servlet
   * parameters merge the query string into the body, so form fields found in the query string are
   * rejected here before the service runs.
   */
  @PostMapping(value = "/subscription", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<Void> subscribe(
      @Valid @ModelAttribute SubscriptionForm form, HttpServletRequest request) {
    rejectQueryStringFields(request.getQueryString());
    final SubscriptionOutcome outcome = subscriptionService.subscribe(form);
    return ResponseEntity.status(outcome.httpStatus()).build();
  }

  private static void rejectQueryStringFields(String queryString) {
    if (queryString == null || queryString.isEmpty()) {
      return;
    }
    for (String key :
        UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams().keySet()) {
      if (FORM_FIELDS.contains(UriUtils.decode(key, StandardCharsets.UTF_8))) {
        throw new InvalidSubscriptionFormException(
            "form field '" + key + "' must be sent in the request body");
      }
    }
  }
}
