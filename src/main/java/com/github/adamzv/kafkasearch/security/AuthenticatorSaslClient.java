package com.github.adamzv.kafkasearch.security;

import com.github.adamzv.kafkasearch.domain.ProblemException;
import java.nio.charset.StandardCharsets;
import javax.security.sasl.SaslClient;
import javax.security.sasl.SaslException;

/**
 * {@link SaslClient} view of a {@link ChallengeResponseAuthenticator}, so the kafka network
 * layer can drive the exchange.
 */
final class AuthenticatorSaslClient implements SaslClient {

  private final ChallengeResponseAuthenticator authenticator;

  AuthenticatorSaslClient(ChallengeResponseAuthenticator authenticator) {
    this.authenticator = authenticator;
  }

  @Override
  public String getMechanismName() {
    return authenticator.hash().mechanismName();
  }

  @Override
  public boolean hasInitialResponse() {
    return true;
  }

  @Override
  public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
    String response;
    try {
      response = authenticator.step(challenge == null ? "" : new String(challenge, StandardCharsets.UTF_8));
    } catch (ProblemException | IllegalStateException ex) {
      throw new SaslException(ex.getMessage(), ex);
    }
    if (authenticator.done() && response.isEmpty()) {
      return null;
    }
    return response.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public boolean isComplete() {
    return authenticator.done();
  }

  @Override
  public byte[] unwrap(byte[] incoming, int offset, int len) throws SaslException {
    throw new SaslException("SCRAM does not negotiate a security layer");
  }

  @Override
  public byte[] wrap(byte[] outgoing, int offset, int len) throws SaslException {
    throw new SaslException("SCRAM does not negotiate a security layer");
  }

  @Override
  public Object getNegotiatedProperty(String propName) {
    if (!isComplete()) {
      throw new IllegalStateException("Authentication exchange has not completed");
    }
    return null;
  }

  @Override
  public void dispose() {
  }
}
