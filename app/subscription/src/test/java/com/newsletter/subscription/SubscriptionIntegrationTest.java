package com.newsletter.subscription;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class SubscriptionIntegrationTest {

  private static final String VALID_FORM = "name=le%20guin&email=ursula_le_guin%40gmail.com";

  private static int rowCount(TestApp app) {
    return app.jdbc().queryForObject("SELECT count(*) FROM subscriptions", Integer.class);
  }

  @Test
  void validFormIsPersistedAndReturns200() {
    final TestApp app = TestApps.spawn();
    final Instant requestedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    final TestApp.HttpResult result = app.postSubscription(VALID_FORM);

    assertThat(result.status()).isEqualTo(200);
    assertThat(result.body()).isEmpty();
    final Map<String, Object> row =
        app.jdbc().queryForMap("SELECT id, email, name, subscribed_at FROM subscriptions");
    assertThat(row.get("email")).isEqualTo("ursula_le_guin@gmail.com");
    assertThat(row.get("name")).isEqualTo("le guin");
    assertThat(row.get("id")).isInstanceOf(UUID.class);
    assertThat(((Timestamp) row.get("subscribed_at")).toInstant())
        .isAfterOrEqualTo(requestedAt.minusMillis(1));
  }

  @Test
  void incompleteFormsReturn400AndPersistNothing() {
    final TestApp app = TestApps.spawn();
    final List<String> invalidBodies =
        List.of("name=le%20guin", "email=ursula_le_guin%40gmail.com", "");

    for (String body : invalidBodies) {
      final TestApp.HttpResult result = app.postSubscription(body);
      assertThat(result.status()).as("body '%s'", body).isEqualTo(400);
    }
    assertThat(rowCount(app)).isZero();
  }

  @Test
  void repeatedSubmissionCreatesDistinctRows() {
    final TestApp app = TestApps.spawn();

    assertThat(app.postSubscription(VALID_FORM).status()).isEqualTo(200);
    assertThat(app.postSubscription(VALID_FORM).status()).isEqualTo(200);

    final List<UUID> ids = app.jdbc().queryForList("SELECT id FROM subscriptions", UUID.class);
    assertThat(ids).hasSize(2).doesNotHaveDuplicates();
  }

  @Test
  void brokenSchemaReturns500WithEmptyBody() {
    final TestApp app = TestApps.spawn();
    app.jdbc().execute("ALTER TABLE subscriptions DROP COLUMN email");

    final TestApp.HttpResult result = app.postSubscription(VALID_FORM);

    assertThat(result.status()).isEqualTo(500);
    assertThat(result.body()).isEmpty();
  }

  @Test
  void greetRespondsWithName() {
    final TestApp app = TestApps.spawn();

    assertThat(app.get("/greet/Ada").body()).isEqualTo("Hello Ada");
    assertThat(app.get("/greet").body()).isEqualTo("Hello World");
  }
}
