package com.github.adamzv.kafkasearch.security;

import java.util.Optional;
import org.apache.kafka.common.security.scram.internals.ScramMechanism;

/**
 * Hash functions the SCRAM exchange can run with.
 */
public enum ScramHash {
  SHA_256(ScramMechanism.SCRAM_SHA_256),
  SHA_512(ScramMechanism.SCRAM_SHA_512);

  private final ScramMechanism mechanism;

  ScramHash(ScramMechanism mechanism) {
    this.mechanism = mechanism;
  }

  ScramMechanism mechanism() {
    return mechanism;
  }

  public String mechanismName() {
    return mechanism.mechanismName();
  }

  public static Optional<ScramHash> forMechanismName(String mechanismName) {
    for (ScramHash hash : values()) {
      if (hash.mechanismName().equals(mechanismName)) {
        return Optional.of(hash);
      }
    }
    return Optional.empty();
  }
}
