package com.newsletter.subscription.api;

public record ApiErrorResponse(String code, String message) {}
