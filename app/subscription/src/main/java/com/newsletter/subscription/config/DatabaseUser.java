package com.newsletter.subscription.config;

import com.newsletter.common.SecretString;

public record DatabaseUser(String name, SecretString password) {

  public DatabaseUser {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("database.user.name is required");
    }
    if (password == null) {
      throw new IllegalArgumentException("database.user.password is required");
    }
  }
}
