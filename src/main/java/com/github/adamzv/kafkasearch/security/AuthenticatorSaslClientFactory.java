package com.github.adamzv.kafkasearch.security;

import com.github.adamzv.kafkasearch.domain.ProblemException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import javax.security.auth.callback.Callback;
import javax.security.auth.callback.CallbackHandler;
import javax.security.auth.callback.NameCallback;
import javax.security.auth.callback.PasswordCallback;
import javax.security.auth.callback.UnsupportedCallbackException;
import javax.security.sasl.SaslClient;
import javax.security.sasl.SaslClientFactory;
import javax.security.sasl.SaslException;

/**
 * Creates one {@link ChallengeResponseAuthenticator} per SASL handshake. Instantiated
 * reflectively through {@link ScramAuthenticatorProvider}.
 */
public class AuthenticatorSaslClientFactory implements SaslClientFactory {

  @Override
  public SaslClient createSaslClient(String[] mechanisms,
                                     String authorizationId,
                                     String protocol,
                                     String serverName,
                                     Map<String, ?> props,
                                     CallbackHandler callbackHandler) throws SaslException {
    for (String mechanism : mechanisms) {
      Optional<ScramHash> hash = ScramHash.forMechanismName(mechanism);
      if (hash.isEmpty()) {
        continue;
      }

      NameCallback nameCallback = new NameCallback("Name:");
      PasswordCallback passwordCallback = new PasswordCallback("Password:", false);
      try {
        callbackHandler.handle(new Callback[]{nameCallback, passwordCallback});
        char[] password = passwordCallback.getPassword();
        ChallengeResponseAuthenticator authenticator = new ChallengeResponseAuthenticator(hash.get());
        authenticator.begin(nameCallback.getName(), password == null ? null : new String(password), authorizationId);
        return new AuthenticatorSaslClient(authenticator);
      } catch (IOException | UnsupportedCallbackException ex) {
        throw new SaslException("Credentials could not be obtained for " + mechanism, ex);
      } catch (ProblemException ex) {
        throw new SaslException(ex.getMessage(), ex);
      } finally {
        passwordCallback.clearPassword();
      }
    }
    return null;
  }

  @Override
  public String[] getMechanismNames(Map<String, ?> props) {
    return Arrays.stream(ScramHash.values())
        .map(ScramHash::mechanismName)
        .toArray(String[]::new);
  }
}
