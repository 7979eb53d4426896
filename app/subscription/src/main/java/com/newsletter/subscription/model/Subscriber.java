package com.newsletter.subscription.model;

import java.time.Instant;
import java.util.UUID;

/** A row of the subscriptions table. */
public record Subscriber(UUID id, String email, String name, Instant subscribedAt) {}
