package com.flamingo.ai.askdocs.service.staging;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Blob storage that source files are transferred into before parsing.
 *
 * <p>I/O failures are reported as {@link java.io.UncheckedIOException}.
 */
public interface StagingArea {

  /**
   * Transfers a local file into the staging area under the given name, replacing any blob with
   * that name.
   */
  StagedFile put(Path localFile, String stagedName);

  /** Blobs whose name contains the fragment, sorted by name. */
  List<StagedFile> list(String nameFragment);

  /** All blobs, sorted by name. */
  List<StagedFile> listAll();

  Optional<StagedFile> find(String stagedName);

  /** Removes one blob. Returns false when it did not exist. */
  boolean remove(String stagedName);

  /** Removes every blob whose name contains the fragment. Returns the number removed. */
  int removeMatching(String nameFragment);
}
