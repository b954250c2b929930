/*
 * Where: handoff NATS bootstrap
 * What: creates or updates the JetStream stream at startup
 * Why: the stream must exist with a duplicate window before the first publish
 */
package com.tickety.handoff.nats;

import com.tickety.handoff.config.HandoffNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class HandoffJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(HandoffJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final HandoffNatsProperties properties;

  @PostConstruct
  public void start() {
    ensureSettings();
    try {
      // operation status and deferred deliveries share one stream
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.operationSubjectWildcard(), properties.deliverySubject())
              .duplicateWindow(properties.duplicateWindow())
              .build();
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
      logger.info(
          "handoff stream ensured stream={} subjects={} duplicateWindow={}",
          properties.stream(),
          streamConfiguration.getSubjects(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private void ensureSettings() {
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("handoff.nats.duplicate-window must be positive");
    }
  }
}
