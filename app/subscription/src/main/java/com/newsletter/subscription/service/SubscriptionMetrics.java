package com.newsletter.subscription.service;

import com.newsletter.subscription.model.SubscriptionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class SubscriptionMetrics {

  static final String REQUESTS_TOTAL = "subscription.requests.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<SubscriptionOutcome, Counter> outcomeCounters =
      new ConcurrentHashMap<>();

  public SubscriptionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordOutcome(SubscriptionOutcome outcome) {
    outcomeCounters.computeIfAbsent(outcome, this::registerOutcomeCounter).increment();
  }

  private Counter registerOutcomeCounter(SubscriptionOutcome outcome) {
    return Counter.builder(REQUESTS_TOTAL)
        .description("Subscription requests by terminal outcome")
        .tags(Tags.of("outcome", outcome.tagValue()))
        .register(meterRegistry);
  }
}
