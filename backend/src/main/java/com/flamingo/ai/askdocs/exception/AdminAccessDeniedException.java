package com.flamingo.ai.askdocs.exception;

/** Exception thrown when a caller outside the admin allowlist uses an admin operation. */
public class AdminAccessDeniedException extends RuntimeException {

  private final String username;

  public AdminAccessDeniedException(String username) {
    super("Admin access denied for user: " + username);
    this.username = username;
  }

  public String getUsername() {
    return username;
  }
}
