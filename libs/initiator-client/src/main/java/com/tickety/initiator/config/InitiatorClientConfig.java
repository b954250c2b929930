/*
 * Where: initiator client configuration
 * What: wires the relay RestClient, the relay client and the realtime subscriber
 * Why: device apps import one configuration instead of assembling the client by hand
 */
package com.tickety.initiator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickety.initiator.realtime.OperationStatusSubscriber;
import com.tickety.initiator.relay.RelayClient;
import com.tickety.initiator.relay.RetryBackoff;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({RelayClientProperties.class, RealtimeProperties.class})
public class InitiatorClientConfig {

  @Bean
  RestClient relayRestClient(RestClient.Builder builder, RelayClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RelayClient relayClient(RestClient relayRestClient, RelayClientProperties properties) {
    return new RelayClient(relayRestClient, properties, RetryBackoff.from(properties));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "relay.realtime.enabled", havingValue = "true")
  OperationStatusSubscriber operationStatusSubscriber(
      Connection connection,
      RelayClient relayClient,
      RealtimeProperties properties,
      ObjectMapper objectMapper) {
    return new OperationStatusSubscriber(connection, relayClient, properties, objectMapper);
  }
}
