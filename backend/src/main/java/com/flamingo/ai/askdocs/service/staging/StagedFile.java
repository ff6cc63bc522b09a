package com.flamingo.ai.askdocs.service.staging;

import java.nio.file.Path;

/**
 * A blob in the staging area.
 *
 * @param name the blob name within the staging area
 * @param path where the parse service can read it
 * @param size size in bytes
 */
public record StagedFile(String name, Path path, long size) {}
