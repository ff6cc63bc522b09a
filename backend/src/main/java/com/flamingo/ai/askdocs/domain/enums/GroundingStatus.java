package com.flamingo.ai.askdocs.domain.enums;

/** How well an answer's citations match the context it was generated from. */
public enum GroundingStatus {
  /** Nothing was retrieved, no completion was requested. */
  NO_CONTEXT,
  /** Every cited source was part of the supplied context. */
  VERIFIED,
  /** The completion cited a file that was not supplied. */
  UNVERIFIED_CITATIONS
}
