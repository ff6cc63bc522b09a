package com.flamingo.ai.askdocs.service.staging;

import com.flamingo.ai.askdocs.config.RagConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Staging area backed by a local directory. */
@Component
@Slf4j
public class FileSystemStagingArea implements StagingArea {

  private final Path root;

  @Autowired
  public FileSystemStagingArea(RagConfig ragConfig) {
    this(Paths.get(ragConfig.getStaging().getDirectory()));
  }

  public FileSystemStagingArea(Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create staging directory " + this.root, e);
    }
    log.info("Staging area at {}", this.root);
  }

  @Override
  public StagedFile put(Path localFile, String stagedName) {
    Path target = resolve(stagedName);
    try {
      Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Staged {} as {}", localFile, stagedName);
      return toStagedFile(target);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to stage " + localFile + " as " + stagedName, e);
    }
  }

  @Override
  public List<StagedFile> list(String nameFragment) {
    return listWhere(name -> name.contains(nameFragment));
  }

  @Override
  public List<StagedFile> listAll() {
    return listWhere(name -> true);
  }

  @Override
  public Optional<StagedFile> find(String stagedName) {
    Path path = resolve(stagedName);
    return Files.isRegularFile(path) ? Optional.of(toStagedFile(path)) : Optional.empty();
  }

  @Override
  public boolean remove(String stagedName) {
    try {
      return Files.deleteIfExists(resolve(stagedName));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to remove staged file " + stagedName, e);
    }
  }

  @Override
  public int removeMatching(String nameFragment) {
    int removed = 0;
    for (StagedFile file : list(nameFragment)) {
      if (remove(file.name())) {
        removed++;
      }
    }
    return removed;
  }

  private List<StagedFile> listWhere(Predicate<String> nameFilter) {
    try (Stream<Path> files = Files.list(root)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> nameFilter.test(p.getFileName().toString()))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .map(this::toStagedFile)
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list staging area " + root, e);
    }
  }

  /** Maps a blob name to a path, rejecting names that would escape the staging directory. */
  private Path resolve(String stagedName) {
    if (stagedName == null
        || stagedName.isBlank()
        || stagedName.contains("/")
        || stagedName.contains("\\")
        || stagedName.equals(".")
        || stagedName.equals("..")) {
      throw new IllegalArgumentException("Invalid staged file name: " + stagedName);
    }
    return root.resolve(stagedName);
  }

  private StagedFile toStagedFile(Path path) {
    try {
      return new StagedFile(path.getFileName().toString(), path, Files.size(path));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read staged file " + path, e);
    }
  }
}
