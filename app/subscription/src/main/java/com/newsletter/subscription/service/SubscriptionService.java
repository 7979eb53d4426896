/*
 * Where: subscription service
 * What: turns a validated form into a persisted subscriber and reports the outcome
 * Why: the controller only maps the outcome to a status; persistence errors stop here
 */
package com.newsletter.subscription.service;

import static net.logstash.logback.argument.StructuredArguments.kv;

import com.newsletter.subscription.api.request.SubscriptionForm;
import com.newsletter.subscription.model.Subscriber;
import com.newsletter.subscription.model.SubscriptionOutcome;
import com.newsletter.subscription.repository.SubscriberRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class SubscriptionService {

  static final String SUBSCRIBER_EMAIL_KEY = "subscriber_email";
  static final String SUBSCRIBER_NAME_KEY = "subscriber_name";

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

  private final SubscriberRepository subscriberRepository;
  private final SubscriptionMetrics subscriptionMetrics;
  private final Clock clock;

  public SubscriptionService(
      SubscriberRepository subscriberRepository,
      SubscriptionMetrics subscriptionMetrics,
      Clock clock) {
    this.subscriberRepository = subscriberRepository;
    this.subscriptionMetrics = subscriptionMetrics;
    this.clock = clock;
  }

  /**
   * Persists a new subscriber for {@code form}.
   *
   * @return {@link SubscriptionOutcome#PERSISTED} on success, {@link SubscriptionOutcome#FAILED}
   *     when the insert raised a {@link DataAccessException}
   */
  public SubscriptionOutcome subscribe(SubscriptionForm form) {
    try (MDC.MDCCloseable email = MDC.putCloseable(SUBSCRIBER_EMAIL_KEY, form.email());
        MDC.MDCCloseable name = MDC.putCloseable(SUBSCRIBER_NAME_KEY, form.name())) {
      logger.info("adding a new subscriber");
      final Subscriber subscriber =
          new Subscriber(UUID.randomUUID(), form.email(), form.name(), Instant.now(clock));
      final SubscriptionOutcome outcome = persist(subscriber);
      subscriptionMetrics.recordOutcome(outcome);
      return outcome;
    }
  }

  private SubscriptionOutcome persist(Subscriber subscriber) {
    try {
      subscriberRepository.insert(subscriber);
    } catch (DataAccessException ex) {
      logger.warn(
          "subscriber was not saved {} {}",
          kv("subscriber_id", subscriber.id()),
          kv("error", ex.getClass().getSimpleName()));
      return SubscriptionOutcome.FAILED;
    }
    logger.info("new subscriber saved {}", kv("subscriber_id", subscriber.id()));
    return SubscriptionOutcome.PERSISTED;
  }
}
