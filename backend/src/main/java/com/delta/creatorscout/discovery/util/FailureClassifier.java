package com.delta.creatorscout.discovery.util;

import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.HttpFetchResult;
import java.util.Locale;

public final class FailureClassifier {

  private FailureClassifier() {}

  public static FailureKind fromHttpStatus(int status) {
    if (status == 429) {
      return FailureKind.RATE_LIMITED;
    }
    if (status == 408 || (status >= 500 && status < 600)) {
      return FailureKind.UPSTREAM_SERVER_ERROR;
    }
    return FailureKind.FATAL;
  }

  public static FailureKind fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return FailureKind.FATAL;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.equals(PoliteHttpClient.ERROR_HOST_COOLDOWN)) {
      return FailureKind.RATE_LIMITED;
    }
    if (code.contains("timeout") || code.equals(PoliteHttpClient.ERROR_IO)) {
      return FailureKind.NETWORK_ERROR;
    }
    if (code.equals(PoliteHttpClient.ERROR_HTTP)) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("connection")
          || lower.contains("ssl")
          || lower.contains("handshake")) {
        return FailureKind.NETWORK_ERROR;
      }
    }
    return FailureKind.FATAL;
  }

  public static FailureKind classify(HttpFetchResult result) {
    if (result == null) {
      return FailureKind.FATAL;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String describe(HttpFetchResult result) {
    if (result == null) {
      return "no_response";
    }
    if (result.errorCode() != null) {
      String message = result.errorMessage();
      return message == null || message.isBlank()
          ? result.errorCode()
          : result.errorCode() + ": " + message;
    }
    return "http_" + result.statusCode();
  }
}
