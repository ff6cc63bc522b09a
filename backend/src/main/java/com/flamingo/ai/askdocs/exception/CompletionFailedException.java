package com.flamingo.ai.askdocs.exception;

/** Exception thrown when the completion service fails. Never retried. */
public class CompletionFailedException extends ExternalServiceException {

  public CompletionFailedException(String message, Throwable cause) {
    super(
        "Completion service",
        message,
        cause,
        "AI service is temporarily unavailable. Please try again later.");
  }
}
