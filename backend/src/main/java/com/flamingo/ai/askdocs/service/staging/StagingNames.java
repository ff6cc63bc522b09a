package com.flamingo.ai.askdocs.service.staging;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;

/** Builds collision-resistant, filesystem-safe names for staged uploads. */
public final class StagingNames {

  private static final SecureRandom RANDOM = new SecureRandom();

  private StagingNames() {}

  /**
   * Returns {@code upload_<epochMillis>_<8 hex>.<ext>}, keeping the original extension when it is
   * alphanumeric.
   */
  public static String uploadName(String originalFileName, Clock clock) {
    byte[] suffix = new byte[4];
    RANDOM.nextBytes(suffix);
    return "upload_"
        + clock.millis()
        + "_"
        + HexFormat.of().formatHex(suffix)
        + extensionOf(originalFileName);
  }

  public static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    boolean alphanumeric =
        ext.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9'));
    if (ext.length() > 10 || !alphanumeric) {
      return "";
    }
    return "." + ext;
  }
}
