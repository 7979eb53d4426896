package com.newsletter.subscription.repository;

import static net.logstash.logback.argument.StructuredArguments.kv;

import com.newsletter.common.JdbcTimestampUtils;
import com.newsletter.subscription.model.Subscriber;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubscriberRepository {

  private static final Logger logger = LoggerFactory.getLogger(SubscriberRepository.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts one subscriber row.
   *
   * @throws DataAccessException as raised by the driver; logged here and not retried
   */
  public void insert(Subscriber subscriber) {
    final String sql =
        """
        INSERT INTO subscriptions (id, email, name, subscribed_at)
        VALUES (:id, :email, :name, :subscribedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", subscriber.id())
            .addValue("email", subscriber.email())
            .addValue("name", subscriber.name())
            .addValue("subscribedAt", JdbcTimestampUtils.toTimestamp(subscriber.subscribedAt()));
    try {
      jdbcTemplate.update(sql, params);
    } catch (DataAccessException ex) {
      logger.error(
          "failed to execute query {} {}",
          kv("operation", "insert_subscriber"),
          kv("subscriber_id", subscriber.id()),
          ex);
      throw ex;
    }
  }
}
