package com.github.adamzv.kafkasearch.security;

public record SaslCredentials(
    String username,
    String password,
    ScramHash hash
) {

  @Override
  public String toString() {
    return "SaslCredentials[username=" + username + ", password=****, hash=" + hash + "]";
  }
}
