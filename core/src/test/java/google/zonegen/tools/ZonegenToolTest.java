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

package google.zonegen.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link ZonegenTool}. */
class ZonegenToolTest {

  private static final String DOCUMENT =
      """
      defaults:
        email: hostmaster@example.com
        nameserver: ns1.example.com.
      zone:
        example.com:
          hosts: {www: 192.168.1.2}
      reverse: 192.168.1.0/24
      """;

  @TempDir Path tmpDir;

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
  private Path serialFile;

  @BeforeEach
  void beforeEach() {
    serialFile = tmpDir.resolve(".serial");
  }

  private int run(InputStream stdin, String... args) {
    return new ZonegenTool()
        .run(
            args,
            stdin,
            new PrintStream(stdout, true, UTF_8),
            new PrintStream(stderr, true, UTF_8));
  }

  private int run(String... args) {
    return run(new ByteArrayInputStream(new byte[0]), args);
  }

  private Path write(String name, String content) throws Exception {
    Path file = tmpDir.resolve(name);
    Files.writeString(file, content, UTF_8);
    return file;
  }

  private String stderrText() {
    return stderr.toString(UTF_8);
  }

  @Test
  void testRun_help() {
    assertThat(run("--help")).isEqualTo(ZonegenTool.EXIT_OK);
    assertThat(stdout.toString(UTF_8)).contains("--input_format");
  }

  @Test
  void testRun_unknownFlag() {
    assertThat(run("--bogus")).isEqualTo(ZonegenTool.EXIT_INPUT_ERROR);
    assertThat(stderrText()).contains("--bogus");
  }

  @Test
  void testRun_unknownOutputFormat() {
    assertThat(run("-f", "bind")).isEqualTo(ZonegenTool.EXIT_INPUT_ERROR);
  }

  @Test
  void testRun_stdinToStdout() {
    int exitCode =
        run(new ByteArrayInputStream(DOCUMENT.getBytes(UTF_8)), "-s", serialFile.toString());

    assertThat(exitCode).isEqualTo(ZonegenTool.EXIT_OK);
    assertThat(stdout.toString(UTF_8)).startsWith("server:\nlocal-zone: example.com. static\n");
    assertThat(Files.exists(serialFile)).isTrue();
  }

  @Test
  void testRun_nsdToDirectory() throws Exception {
    Path input = write("zones.yaml", DOCUMENT);
    Path output = tmpDir.resolve("nsd");

    int exitCode =
        run(
            "-i", input.toString(),
            "--format", "nsd",
            "-o", output.toString(),
            "--serial", serialFile.toString());

    assertThat(exitCode).isEqualTo(ZonegenTool.EXIT_OK);
    assertThat(Files.exists(output.resolve("zones.conf"))).isTrue();
    assertThat(Files.exists(output.resolve("master/example.com.zone"))).isTrue();
  }

  @Test
  void testRun_tomlDetectedFromExtension() throws Exception {
    Path input =
        write(
            "zones.toml",
            """
            [defaults]
            email = "hostmaster@example.com"
            nameserver = "ns1.example.com."

            [zone."example.com".hosts]
            www = "192.168.1.2"
            """);

    assertThat(run("-i", input.toString(), "-s", serialFile.toString()))
        .isEqualTo(ZonegenTool.EXIT_OK);
    assertThat(stdout.toString(UTF_8)).contains("www.example.com.");
  }

  @Test
  void testRun_invalidDocument_printsEveryDiagnostic() throws Exception {
    Path input = write("zones.yaml", "defaults:\n  ttl: 0\n  retry: -5\n");

    assertThat(run("-i", input.toString(), "-s", serialFile.toString()))
        .isEqualTo(ZonegenTool.EXIT_INPUT_ERROR);
    assertThat(stderrText())
        .contains(
            "YAML parse error: Path: 'defaults.ttl', Location: line 2 column 8, "
                + "Error: TTL cannot be zero");
    assertThat(stderrText()).contains("Path: 'defaults.retry', Location: line 3 column 10");
    assertThat(stdout.toString(UTF_8)).isEmpty();
    assertThat(Files.exists(serialFile)).isFalse();
  }

  @Test
  void testRun_malformedDocument() throws Exception {
    Path input = write("zones.yaml", "zone: [unclosed\n");

    assertThat(run("-i", input.toString(), "-s", serialFile.toString()))
        .isEqualTo(ZonegenTool.EXIT_INPUT_ERROR);
    assertThat(stderrText()).startsWith("YAML parse error:");
  }

  @Test
  void testRun_corruptSerial() throws Exception {
    Path input = write("zones.yaml", DOCUMENT);
    write(".serial", "not a serial\n");

    assertThat(run("-i", input.toString(), "-s", serialFile.toString()))
        .isEqualTo(ZonegenTool.EXIT_IO_ERROR);
    assertThat(stderrText()).contains("is corrupt");
  }

  @Test
  void testRun_missingInput() {
    assertThat(run("-i", tmpDir.resolve("missing.yaml").toString()))
        .isEqualTo(ZonegenTool.EXIT_IO_ERROR);
    assertThat(stderrText()).startsWith("I/O error:");
  }

  @Test
  void testRun_configOverrideMovesSerialFile() throws Exception {
    Path input = write("zones.yaml", DOCUMENT);
    Path overrideSerial = tmpDir.resolve("state/serial");
    Path config = write("zonegen.yaml", "serial:\n  defaultFile: " + overrideSerial + "\n");

    assertThat(run("-i", input.toString(), "--config", config.toString()))
        .isEqualTo(ZonegenTool.EXIT_OK);
    assertThat(Files.readString(overrideSerial, UTF_8)).matches("\\d{10}\n");
  }

  @Test
  void testRun_configOverrideWithEmptyKey_keepsDefault() throws Exception {
    Path input = write("zones.yaml", DOCUMENT);
    Path config = write("zonegen.yaml", "serial:\n  defaultFile:\n");

    assertThat(
            run(
                "-i",
                input.toString(),
                "-s",
                serialFile.toString(),
                "--config",
                config.toString()))
        .isEqualTo(ZonegenTool.EXIT_OK);
    assertThat(Files.readString(serialFile, UTF_8)).matches("\\d{10}\n");
  }
}
