package com.github.adamzv.kafkasearch.security;

import java.security.Provider;
import java.security.Security;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers {@link AuthenticatorSaslClientFactory} for the SCRAM mechanisms ahead of the
 * provider bundled with kafka-clients.
 */
public final class ScramAuthenticatorProvider extends Provider {

  private static final long serialVersionUID = 1L;
  private static final Logger log = LoggerFactory.getLogger(ScramAuthenticatorProvider.class);

  static final String NAME = "KafkaSearchScram";

  private ScramAuthenticatorProvider() {
    super(NAME, "1.0", "SCRAM SASL client backed by ChallengeResponseAuthenticator");
    for (ScramHash hash : ScramHash.values()) {
      put("SaslClientFactory." + hash.mechanismName(), AuthenticatorSaslClientFactory.class.getName());
    }
  }

  public static synchronized void install() {
    if (Security.getProvider(NAME) != null) {
      return;
    }
    Security.insertProviderAt(new ScramAuthenticatorProvider(), 1);
    log.debug("scram_provider_installed name={}", NAME);
  }
}
