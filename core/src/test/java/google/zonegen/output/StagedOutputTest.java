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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link StagedOutput}. */
class StagedOutputTest {

  private static final String PREFIX = ".zonegen-staging-";

  @TempDir Path tmpDir;

  private static final RenderedOutput OUTPUT =
      RenderedOutput.of(
          ImmutableMap.of(
              "zones.conf", "zone:\n", "master/example.com.zone", "$ORIGIN example.com.\n"));

  private long entriesIn(Path directory) throws Exception {
    try (Stream<Path> entries = Files.list(directory)) {
      return entries.count();
    }
  }

  @Test
  void testPublish_movesEveryFile() throws Exception {
    Path destination = tmpDir.resolve("nsd");

    ImmutableList<Path> published;
    try (StagedOutput staged = StagedOutput.stage(destination, OUTPUT, PREFIX)) {
      assertThat(Files.exists(destination)).isFalse();
      published = staged.publish();
      assertThat(Files.exists(staged.stagingDirectory())).isFalse();
    }

    assertThat(published)
        .containsExactly(
            destination.resolve("zones.conf"), destination.resolve("master/example.com.zone"))
        .inOrder();
    assertThat(Files.readString(destination.resolve("master/example.com.zone"), UTF_8))
        .isEqualTo("$ORIGIN example.com.\n");
    assertThat(entriesIn(tmpDir)).isEqualTo(1);
  }

  @Test
  void testPublish_replacesExistingFiles() throws Exception {
    Path destination = tmpDir.resolve("nsd");
    Files.createDirectories(destination);
    Files.writeString(destination.resolve("zones.conf"), "old\n", UTF_8);

    try (StagedOutput staged = StagedOutput.stage(destination, OUTPUT, PREFIX)) {
      staged.publish();
    }

    assertThat(Files.readString(destination.resolve("zones.conf"), UTF_8)).isEqualTo("zone:\n");
  }

  @Test
  void testClose_withoutPublish_leavesDestinationAlone() throws Exception {
    Path destination = tmpDir.resolve("nsd");
    Files.createDirectories(destination);
    Files.writeString(destination.resolve("zones.conf"), "old\n", UTF_8);

    Path stagingDirectory;
    try (StagedOutput staged = StagedOutput.stage(destination, OUTPUT, PREFIX)) {
      stagingDirectory = staged.stagingDirectory();
      assertThat(Files.isDirectory(stagingDirectory)).isTrue();
    }

    assertThat(Files.exists(stagingDirectory)).isFalse();
    assertThat(Files.readString(destination.resolve("zones.conf"), UTF_8)).isEqualTo("old\n");
    assertThat(entriesIn(destination)).isEqualTo(1);
  }

  @Test
  void testPublish_twice_fails() throws Exception {
    try (StagedOutput staged = StagedOutput.stage(tmpDir.resolve("out"), OUTPUT, PREFIX)) {
      staged.publish();
      assertThrows(IllegalStateException.class, staged::publish);
    }
  }

  @Test
  void testStage_pathEscapingTheOutput_fails() throws Exception {
    RenderedOutput escaping = RenderedOutput.of(ImmutableMap.of("../evil.conf", "x"));

    assertThrows(
        IllegalArgumentException.class,
        () -> StagedOutput.stage(tmpDir.resolve("out"), escaping, PREFIX));
    assertThat(entriesIn(tmpDir)).isEqualTo(0);
  }
}
