package com.github.adamzv.kafkasearch.security;

/**
 * PEM material for mutual TLS, already checked to parse.
 */
public record TlsMaterial(
    String certificateChainPem,
    String privateKeyPem,
    String caCertificatesPem,
    int trustAnchorCount
) {

  @Override
  public String toString() {
    return "TlsMaterial[trustAnchorCount=" + trustAnchorCount + "]";
  }
}
