package com.github.adamzv.kafkasearch.security;

import com.github.adamzv.kafkasearch.domain.Problems;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import javax.security.auth.callback.Callback;
import javax.security.auth.callback.CallbackHandler;
import javax.security.auth.callback.NameCallback;
import javax.security.auth.callback.PasswordCallback;
import javax.security.auth.callback.UnsupportedCallbackException;
import javax.security.sasl.SaslClient;
import javax.security.sasl.SaslException;
import org.apache.kafka.common.security.scram.ScramExtensionsCallback;
import org.apache.kafka.common.security.scram.internals.ScramSaslClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of one SCRAM conversation: {@link #begin} once, {@link #step} for every server
 * challenge, {@link #done} once the server signature has been verified.
 *
 * <p>Only computes tokens; moving them over the wire is up to the owner. A fresh instance is
 * needed for every connection attempt.
 */
public class ChallengeResponseAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(ChallengeResponseAuthenticator.class);

  enum State {
    UNINITIALIZED,
    IN_PROGRESS,
    DONE
  }

  private final ScramHash hash;
  private SaslClient conversation;
  private State state = State.UNINITIALIZED;

  public ChallengeResponseAuthenticator(ScramHash hash) {
    if (hash == null) {
      throw new IllegalArgumentException("hash must not be null");
    }
    this.hash = hash;
  }

  public ScramHash hash() {
    return hash;
  }

  public synchronized void begin(String username, String password, String authorizationId) {
    if (state != State.UNINITIALIZED) {
      throw new IllegalStateException("SCRAM conversation already started; use a new authenticator");
    }
    if (username == null || username.isBlank()) {
      throw Problems.authFailed("SCRAM username must not be blank", context(), null);
    }
    if (password == null) {
      throw Problems.authFailed("SCRAM password is required", Map.of("mechanism", hash.mechanismName(), "username", username), null);
    }
    if (authorizationId != null && !authorizationId.isBlank() && !authorizationId.equals(username)) {
      log.debug("scram_authzid_ignored mechanism={} username={} authzid={}", hash.mechanismName(), username, authorizationId);
    }

    try {
      conversation = new ScramSaslClient(hash.mechanism(), new CredentialHandler(username, password));
    } catch (NoSuchAlgorithmException ex) {
      throw Problems.authFailed("Hash function unavailable for " + hash.mechanismName(), context(), ex);
    }
    state = State.IN_PROGRESS;
  }

  /**
   * Consumes a server challenge and returns the response to send back. The first call takes
   * an empty challenge and yields the client-first message; the last one verifies the server
   * signature and returns an empty response.
   */
  public synchronized String step(String challenge) {
    if (state == State.UNINITIALIZED) {
      throw new IllegalStateException("begin must be called before step");
    }
    if (state == State.DONE) {
      throw new IllegalStateException("SCRAM conversation already finished");
    }

    byte[] token = challenge == null ? new byte[0] : challenge.getBytes(StandardCharsets.UTF_8);
    try {
      byte[] response = conversation.evaluateChallenge(token);
      if (conversation.isComplete()) {
        state = State.DONE;
      }
      return response == null ? "" : new String(response, StandardCharsets.UTF_8);
    } catch (SaslException ex) {
      throw Problems.authFailed("SCRAM exchange failed: " + ex.getMessage(), context(), ex);
    }
  }

  public synchronized boolean done() {
    return state == State.DONE;
  }

  synchronized State state() {
    return state;
  }

  private Map<String, Object> context() {
    return Map.of("mechanism", hash.mechanismName());
  }

  private static final class CredentialHandler implements CallbackHandler {

    private final String username;
    private final String password;

    private CredentialHandler(String username, String password) {
      this.username = username;
      this.password = password;
    }

    @Override
    public void handle(Callback[] callbacks) throws IOException, UnsupportedCallbackException {
      for (Callback callback : callbacks) {
        if (callback instanceof NameCallback nameCallback) {
          nameCallback.setName(username);
        } else if (callback instanceof PasswordCallback passwordCallback) {
          passwordCallback.setPassword(password.toCharArray());
        } else if (callback instanceof ScramExtensionsCallback) {
          // no extensions requested
        } else {
          throw new UnsupportedCallbackException(callback);
        }
      }
    }
  }
}
