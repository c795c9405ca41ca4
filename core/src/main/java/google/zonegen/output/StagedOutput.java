// Copyright 2025 The Nomulus Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package google.zonegen.output;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Rendered files written to a private staging directory, waiting to be moved into place.
 *
 * <p>The staging directory is created next to the destination so that publishing is a rename on
 * the same file system. Until {@link #publish()} is called nothing under the destination changes.
 */
public final class StagedOutput implements AutoCloseable {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Path stagingDirectory;
  private final Path destination;
  private final ImmutableList<String> relativePaths;
  private boolean finished;

  private StagedOutput(Path stagingDirectory, Path destination, ImmutableList<String> paths) {
    this.stagingDirectory = stagingDirectory;
    this.destination = destination;
    this.relativePaths = paths;
  }

  /**
   * Writes every file of {@code output} below a new staging directory.
   *
   * @param destination the directory the files' relative paths will be resolved against
   * @param prefix the name prefix of the staging directory
   */
  public static StagedOutput stage(Path destination, RenderedOutput output, String prefix)
      throws IOException {
    Path target = destination.toAbsolutePath().normalize();
    Path parent = target.getParent() == null ? target : target.getParent();
    Files.createDirectories(parent);
    Path staging = Files.createTempDirectory(parent, prefix);
    try {
      for (Map.Entry<String, String> file : output.files().entrySet()) {
        Path staged = staging.resolve(file.getKey()).normalize();
        checkArgument(
            staged.startsWith(staging), "Rendered path %s escapes the output", file.getKey());
        Files.createDirectories(staged.getParent());
        Files.writeString(staged, file.getValue(), UTF_8);
      }
    } catch (IOException | RuntimeException e) {
      deleteStaging(staging);
      throw e;
    }
    logger.atInfo().log("Staged %d file(s) in %s.", output.files().size(), staging);
    return new StagedOutput(staging, target, output.files().keySet().asList());
  }

  public Path stagingDirectory() {
    return stagingDirectory;
  }

  /** Moves every staged file to its destination and returns the published paths. */
  public ImmutableList<Path> publish() throws IOException {
    checkState(
        !finished, "Output staged in %s was already published or discarded", stagingDirectory);
    finished = true;
    ImmutableList.Builder<Path> published = new ImmutableList.Builder<>();
    for (String relativePath : relativePaths) {
      Path source = stagingDirectory.resolve(relativePath);
      Path target = destination.resolve(relativePath);
      Files.createDirectories(target.getParent());
      try {
        Files.move(
            source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
      }
      published.add(target);
    }
    deleteStaging(stagingDirectory);
    logger.atInfo().log("Published %d file(s) to %s.", relativePaths.size(), destination);
    return published.build();
  }

  /** Removes the staged files without touching the destination. Does nothing after publishing. */
  public void discard() {
    if (finished) {
      return;
    }
    finished = true;
    deleteStaging(stagingDirectory);
    logger.atInfo().log("Discarded output staged in %s.", stagingDirectory);
  }

  @Override
  public void close() {
    discard();
  }

  private static void deleteStaging(Path staging) {
    try {
      MoreFiles.deleteRecursively(staging, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Could not remove staging directory %s.", staging);
    }
  }
}
