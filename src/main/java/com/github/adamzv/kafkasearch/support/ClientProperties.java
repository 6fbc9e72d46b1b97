package com.github.adamzv.kafkasearch.support;

import com.github.adamzv.kafkasearch.application.ClientOptions;
import com.github.adamzv.kafkasearch.domain.DecodeErrorPolicy;
import com.github.adamzv.kafkasearch.domain.ResultOrdering;
import com.github.adamzv.kafkasearch.security.ConnectionSettings;
import com.github.adamzv.kafkasearch.security.ScramHash;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka-search")
public record ClientProperties(
    @NotBlank(message = "kafka-search.bootstrapServers must not be blank")
    String bootstrapServers,
    String username,
    String password,
    String certFile,
    String keyFile,
    String caCertFile,
    @DefaultValue("SHA_512")
    ScramHash scramHash,
    @DefaultValue("20")
    @Positive(message = "kafka-search.concurrency must be > 0")
    int concurrency,
    @DefaultValue("1s")
    Duration pollTimeout,
    @DefaultValue("SERIALIZED_FORM")
    ResultOrdering resultOrdering,
    @DefaultValue("STOP_SILENTLY")
    DecodeErrorPolicy fetchDecodeErrorPolicy
) {

  public ConnectionSettings toConnectionSettings() {
    return new ConnectionSettings(
        bootstrapServerList(),
        username,
        password,
        certFile,
        keyFile,
        caCertFile,
        scramHash,
        concurrency
    );
  }

  public ClientOptions toClientOptions() {
    return new ClientOptions(concurrency, pollTimeout, resultOrdering, fetchDecodeErrorPolicy);
  }

  @Override
  public String toString() {
    return "ClientProperties[bootstrapServers=" + bootstrapServers
        + ", username=" + username
        + ", certFile=" + certFile
        + ", keyFile=" + keyFile
        + ", caCertFile=" + caCertFile
        + ", concurrency=" + concurrency + "]";
  }

  private List<String> bootstrapServerList() {
    return Arrays.stream(bootstrapServers.split(","))
        .map(String::trim)
        .filter(server -> !server.isEmpty())
        .toList();
  }
}
