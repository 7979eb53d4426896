package com.newsletter.subscription.api.request;

import jakarta.validation.constraints.NotEmpty;

/** Form-url-encoded body of {@code POST /subscription}. */
public record SubscriptionForm(@NotEmpty String email, @NotEmpty String name) {}
