package com.github.adamzv.kafkasearch.security;

import java.util.List;

/**
 * Raw connection inputs as supplied by the bootstrap layer. Blank values mean "not set".
 */
public record ConnectionSettings(
    List<String> bootstrapServers,
    String username,
    String password,
    String certFile,
    String keyFile,
    String caCertFile,
    ScramHash scramHash,
    int concurrency
) {

  public static final int DEFAULT_CONCURRENCY = 20;

  public ConnectionSettings {
    bootstrapServers = bootstrapServers == null ? List.of() : List.copyOf(bootstrapServers);
    scramHash = scramHash == null ? ScramHash.SHA_512 : scramHash;
  }

  public static ConnectionSettings plaintext(List<String> bootstrapServers) {
    return new ConnectionSettings(bootstrapServers, null, null, null, null, null, ScramHash.SHA_512, DEFAULT_CONCURRENCY);
  }

  @Override
  public String toString() {
    return "ConnectionSettings[bootstrapServers=" + bootstrapServers
        + ", username=" + username
        + ", certFile=" + certFile
        + ", keyFile=" + keyFile
        + ", caCertFile=" + caCertFile
        + ", scramHash=" + scramHash
        + ", concurrency=" + concurrency + "]";
  }
}
