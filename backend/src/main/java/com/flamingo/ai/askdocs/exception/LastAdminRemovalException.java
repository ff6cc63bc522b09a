package com.flamingo.ai.askdocs.exception;

/** Exception thrown when removing an admin would leave the allowlist empty. */
public class LastAdminRemovalException extends RuntimeException {

  public LastAdminRemovalException(String username) {
    super("Cannot remove " + username + ": at least one admin must remain");
  }
}
