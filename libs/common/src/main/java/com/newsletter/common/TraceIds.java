package com.newsletter.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  // request_id is always minted server side; inbound X-Request-Id headers are not trusted
  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
