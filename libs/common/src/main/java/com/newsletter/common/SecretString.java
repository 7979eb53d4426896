/*
 * Where: common value types
 * What: wraps a credential so that it never renders through toString
 * Why: settings records are logged and printed; the password must not leak through them
 */
package com.newsletter.common;

import java.util.Objects;

public final class SecretString {

  private static final String REDACTED = "[REDACTED]";

  private final String value;

  public SecretString(String value) {
    this.value = Objects.requireNonNull(value, "secret value must not be null");
  }

  /** Returns the raw value. Only connection setup may call this. */
  public String expose() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof SecretString secret && value.equals(secret.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return REDACTED;
  }
}
