package com.newsletter.common.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TelemetrySubscriberTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ByteArrayOutputStream sink = new ByteArrayOutputStream();
  private LoggerContext context;

  @BeforeEach
  void setUp() {
    context = new LoggerContext();
    context.setMDCAdapter(MDC.getMDCAdapter());
  }

  @AfterEach
  void cleanup() {
    MDC.clear();
    context.stop();
  }

  @Test
  void writesOneJsonRecordPerEventWithMdcFieldsAndServiceName() throws Exception {
    Telemetry.subscriber("subscription", TelemetryFilter.parse("info"), sink).attachTo(context);

    MDC.put("request_id", "req-1");
    MDC.put("subscriber_email", "ursula_le_guin@gmail.com");
    context.getLogger("com.newsletter.test").info("adding a new subscriber");

    final List<JsonNode> records = records();
    assertThat(records).hasSize(1);
    final JsonNode record = records.get(0);
    assertThat(record.get("message").asText()).isEqualTo("adding a new subscriber");
    assertThat(record.get("level").asText()).isEqualTo("INFO");
    assertThat(record.get("name").asText()).isEqualTo("subscription");
    assertThat(record.get("request_id").asText()).isEqualTo("req-1");
    assertThat(record.get("subscriber_email").asText()).isEqualTo("ursula_le_guin@gmail.com");
    assertThat(record.get("logger_name").asText()).isEqualTo("com.newsletter.test");
  }

  @Test
  void dropsEventsBelowTheConfiguredLevels() throws Exception {
    Telemetry.subscriber("subscription", TelemetryFilter.parse("warn,com.newsletter=debug"), sink)
        .attachTo(context);

    context.getLogger("org.example").info("filtered out");
    context.getLogger("org.example").warn("kept");
    context.getLogger("com.newsletter.repository").debug("kept too");

    assertThat(records())
        .extracting(node -> node.get("message").asText())
        .containsExactly("kept", "kept too");
  }

  @Test
  void resettingTheContextDoesNotCloseTheSink() throws Exception {
    Telemetry.subscriber("subscription", TelemetryFilter.parse("info"), sink).attachTo(context);
    context.reset();
    Telemetry.subscriber("subscription", TelemetryFilter.parse("info"), sink).attachTo(context);

    context.getLogger(Logger.ROOT_LOGGER_NAME).info("still writing");

    assertThat(records()).extracting(node -> node.get("message").asText()).contains("still writing");
  }

  @Test
  void installerRefusesSecondInstall() {
    final TelemetryInstaller installer = new TelemetryInstaller(() -> context);
    final TelemetrySubscriber subscriber =
        Telemetry.subscriber("subscription", TelemetryFilter.parse("info"), sink);

    installer.install(subscriber);

    assertThat(installer.isInstalled()).isTrue();
    assertThatThrownBy(() -> installer.install(subscriber))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already installed");
  }

  private List<JsonNode> records() throws Exception {
    final String output = sink.toString(StandardCharsets.UTF_8);
    final List<JsonNode> nodes = new java.util.ArrayList<>();
    for (String line : output.split("\\R")) {
      if (!line.isBlank()) {
        nodes.add(objectMapper.readTree(line));
      }
    }
    return nodes;
  }
}
