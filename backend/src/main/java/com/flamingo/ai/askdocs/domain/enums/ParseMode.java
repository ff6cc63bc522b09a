package com.flamingo.ai.askdocs.domain.enums;

/** Text extraction mode used by the parse service. */
public enum ParseMode {
  /** Extract embedded text and fall back to OCR for image-only pages. */
  OCR,
  /** Extract embedded text ordered by position on the page. */
  LAYOUT
}
