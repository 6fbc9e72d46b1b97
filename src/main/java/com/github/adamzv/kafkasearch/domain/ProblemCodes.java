package com.github.adamzv.kafkasearch.domain;

public final class ProblemCodes {
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String CONNECT_FAILED = "CONNECT_FAILED";
  public static final String AUTH_FAILED = "AUTH_FAILED";
  public static final String TLS_CONFIG_INVALID = "TLS_CONFIG_INVALID";
  public static final String DECODE_FAILED = "DECODE_FAILED";
  public static final String METADATA_UNAVAILABLE = "METADATA_UNAVAILABLE";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";

  private ProblemCodes() {
  }
}
