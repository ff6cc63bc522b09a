package com.flamingo.ai.askdocs.exception;

import com.google.common.base.Throwables;
import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/** Base exception for failures of a service the pipeline calls out to. */
public abstract class ExternalServiceException extends RuntimeException {

  private final String service;
  private final boolean timedOut;
  private final String userMessage;

  protected ExternalServiceException(
      String service, String message, Throwable cause, String userMessage) {
    super(message, cause);
    this.service = service;
    this.timedOut = cause != null && isTimeout(cause);
    this.userMessage = timedOut ? service + " did not respond in time" : userMessage;
  }

  /** True when the cause chain contains a timeout. */
  public static boolean isTimeout(Throwable throwable) {
    return Throwables.getCausalChain(throwable).stream()
        .anyMatch(
            t ->
                t instanceof TimeoutException
                    || t instanceof InterruptedIOException
                    || t instanceof HttpTimeoutException
                    || (t instanceof ExternalServiceException e && e.isTimedOut()));
  }

  public String getService() {
    return service;
  }

  public boolean isTimedOut() {
    return timedOut;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
