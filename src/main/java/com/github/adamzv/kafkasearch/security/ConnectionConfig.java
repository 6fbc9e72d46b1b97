package com.github.adamzv.kafkasearch.security;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.security.auth.SecurityProtocol;
import org.apache.kafka.common.security.scram.ScramLoginModule;

/**
 * Immutable result of {@link SecureConnector#configure(ConnectionSettings)}.
 */
public record ConnectionConfig(
    List<String> bootstrapServers,
    Optional<SaslCredentials> sasl,
    Optional<TlsMaterial> tls,
    int concurrency
) {

  private static final String PEM = "PEM";

  public ConnectionConfig {
    bootstrapServers = List.copyOf(bootstrapServers);
    sasl = sasl == null ? Optional.empty() : sasl;
    tls = tls == null ? Optional.empty() : tls;
  }

  public boolean saslEnabled() {
    return sasl.isPresent();
  }

  public boolean tlsEnabled() {
    return tls.isPresent();
  }

  public SecurityProtocol securityProtocol() {
    if (saslEnabled()) {
      return tlsEnabled() ? SecurityProtocol.SASL_SSL : SecurityProtocol.SASL_PLAINTEXT;
    }
    return tlsEnabled() ? SecurityProtocol.SSL : SecurityProtocol.PLAINTEXT;
  }

  /**
   * Client properties shared by admin and consumer clients.
   */
  public Map<String, Object> toProperties() {
    Map<String, Object> props = new HashMap<>();
    props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, String.join(",", bootstrapServers));
    props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, securityProtocol().name);

    sasl.ifPresent(credentials -> {
      props.put(SaslConfigs.SASL_MECHANISM, credentials.hash().mechanismName());
      props.put(SaslConfigs.SASL_JAAS_CONFIG, ScramLoginModule.class.getName()
          + " required username=\"" + escape(credentials.username())
          + "\" password=\"" + escape(credentials.password()) + "\";");
    });

    tls.ifPresent(material -> {
      props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, PEM);
      props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, material.certificateChainPem());
      props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, material.privateKeyPem());
      props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, PEM);
      props.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, material.caCertificatesPem());
    });
    return props;
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
