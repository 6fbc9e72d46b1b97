package com.github.adamzv.kafkasearch.support;

import com.github.adamzv.kafkasearch.adapters.kafka.KafkaAdminAdapter;
import com.github.adamzv.kafkasearch.adapters.kafka.KafkaPartitionStreamFactory;
import com.github.adamzv.kafkasearch.application.KafkaSearchClient;
import com.github.adamzv.kafkasearch.ports.BrokerMetadataPort;
import com.github.adamzv.kafkasearch.ports.PartitionStreamFactory;
import com.github.adamzv.kafkasearch.ports.PayloadDecoder;
import com.github.adamzv.kafkasearch.security.ConnectionConfig;
import com.github.adamzv.kafkasearch.security.ScramAuthenticatorProvider;
import com.github.adamzv.kafkasearch.security.SecureConnector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ClientProperties.class)
public class ApplicationConfig {

  private static final Duration CLIENT_TIMEOUT = Duration.ofSeconds(5);

  private final ClientProperties clientProperties;

  public ApplicationConfig(ClientProperties clientProperties) {
    this.clientProperties = clientProperties;
  }

  @Bean
  public SecureConnector secureConnector() {
    return new SecureConnector();
  }

  @Bean
  public ConnectionConfig connectionConfig(SecureConnector secureConnector) {
    ConnectionConfig config = secureConnector.configure(clientProperties.toConnectionSettings());
    if (config.saslEnabled()) {
      ScramAuthenticatorProvider.install();
    }
    return config;
  }

  // closed through KafkaSearchClient
  @Bean(destroyMethod = "")
  public BrokerMetadataPort brokerMetadataPort(ConnectionConfig connectionConfig) {
    Map<String, Object> props = new HashMap<>(connectionConfig.toProperties());
    int timeoutMs = Math.toIntExact(CLIENT_TIMEOUT.toMillis());
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
    return new KafkaAdminAdapter(AdminClient.create(props), String.join(",", connectionConfig.bootstrapServers()));
  }

  @Bean
  public PartitionStreamFactory partitionStreamFactory(ConnectionConfig connectionConfig) {
    return new KafkaPartitionStreamFactory(connectionConfig);
  }

  @Bean
  @ConditionalOnMissingBean
  public PayloadDecoder payloadDecoder() {
    return PayloadDecoder.IDENTITY;
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean(destroyMethod = "close")
  public KafkaSearchClient kafkaSearchClient(BrokerMetadataPort brokerMetadataPort,
                                             PartitionStreamFactory partitionStreamFactory,
                                             PayloadDecoder payloadDecoder,
                                             MeterRegistry meterRegistry) {
    return new KafkaSearchClient(
        brokerMetadataPort,
        partitionStreamFactory,
        payloadDecoder,
        clientProperties.toClientOptions(),
        meterRegistry
    );
  }
}
