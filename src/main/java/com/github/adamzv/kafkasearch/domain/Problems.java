package com.github.adamzv.kafkasearch.domain;

import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details, null);
  }

  public static ProblemException notFound(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NOT_FOUND, message, details, null);
  }

  public static ProblemException connectFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.CONNECT_FAILED, message, details, cause);
  }

  public static ProblemException authFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.AUTH_FAILED, message, details, cause);
  }

  public static ProblemException tlsConfigInvalid(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.TLS_CONFIG_INVALID, message, details, cause);
  }

  public static ProblemException decodeFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.DECODE_FAILED, message, details, cause);
  }

  public static ProblemException metadataUnavailable(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.METADATA_UNAVAILABLE, message, details, cause);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, null);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, cause);
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details, Throwable cause) {
    return new ProblemException(new Problem(code, message, details), cause);
  }
}
