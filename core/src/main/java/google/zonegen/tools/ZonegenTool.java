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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.ByteStreams;
import google.zonegen.ZonegenException;
import google.zonegen.document.DocumentFormat;
import google.zonegen.module.DaggerZonegenComponent;
import google.zonegen.module.ZonegenComponent;
import google.zonegen.output.OutputFormat;
import google.zonegen.pipeline.GenerationRequest;
import google.zonegen.pipeline.GenerationResult;
import google.zonegen.serial.SerialStateException;
import google.zonegen.validation.ValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.logging.LogManager;
import javax.annotation.Nullable;

/** Command line entry point: generates Unbound or NSD configuration from a zone document. */
@Parameters(
    separators = " =",
    commandDescription = "Generate DNS server configuration from a YAML or TOML zone document")
public final class ZonegenTool {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final int EXIT_OK = 0;
  /** The document or the command line is invalid. */
  static final int EXIT_INPUT_ERROR = 1;
  /** A file could not be read or written, or the serial state is unusable. */
  static final int EXIT_IO_ERROR = 2;

  @Parameter(
      names = {"-i", "--input"},
      description = "Zone document to read. Reads stdin if omitted.")
  @Nullable
  private Path input;

  @Parameter(
      names = "--input_format",
      description = "Syntax of the input: yaml or toml. Defaults to the file extension, else yaml.")
  @Nullable
  private DocumentFormat inputFormat;

  @Parameter(
      names = {"-o", "--output"},
      description =
          "Output file for unbound (stdout if omitted) or output directory for nsd"
              + " (defaults to 'nsd').")
  @Nullable
  private Path output;

  @Parameter(
      names = {"-f", "--format"},
      description = "Server to generate configuration for: unbound or nsd.")
  private OutputFormat format = OutputFormat.UNBOUND;

  @Parameter(
      names = {"-s", "--serial"},
      description = "File holding the serial of the last run. Defaults to '.serial'.")
  @Nullable
  private Path serialFile;

  @Parameter(names = "--config", description = "YAML file overriding the built-in settings.")
  @Nullable
  private Path configFile;

  @Parameter(
      names = {"-h", "--help"},
      description = "Show this help.",
      help = true)
  private boolean help;

  public static void main(String[] args) {
    configureLogging();
    System.exit(new ZonegenTool().run(args, System.in, System.out, System.err));
  }

  /** Parses {@code args}, runs the generator and returns the process exit code. */
  @VisibleForTesting
  int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
    JCommander jcommander = JCommander.newBuilder().addObject(this).programName("zonegen").build();
    try {
      jcommander.parse(args);
    } catch (ParameterException e) {
      stderr.println(e.getMessage());
      printUsage(jcommander, stderr);
      return EXIT_INPUT_ERROR;
    }
    if (help) {
      printUsage(jcommander, stdout);
      return EXIT_OK;
    }
    try {
      Optional<String> overrideYaml =
          configFile == null ? Optional.empty() : Optional.of(Files.readString(configFile, UTF_8));
      ZonegenComponent component = DaggerZonegenComponent.factory().create(overrideYaml);
      GenerationRequest request = buildRequest(component, readInput(stdin));
      GenerationResult result = component.pipeline().run(request, stdout);
      logger.atInfo().log(
          "Generated %d zone(s) with serial %d.",
          result.model().allZones().size(), result.model().serial());
      return EXIT_OK;
    } catch (ValidationException e) {
      e.getDiagnostics().forEach(stderr::println);
      return EXIT_INPUT_ERROR;
    } catch (SerialStateException e) {
      stderr.println(e.getMessage());
      return EXIT_IO_ERROR;
    } catch (ZonegenException | IllegalArgumentException e) {
      stderr.println(e.getMessage());
      return EXIT_INPUT_ERROR;
    } catch (IOException e) {
      stderr.println("I/O error: " + e.getMessage());
      return EXIT_IO_ERROR;
    }
  }

  private GenerationRequest buildRequest(ZonegenComponent component, String document) {
    DocumentFormat documentFormat =
        Optional.ofNullable(inputFormat)
            .or(
                () ->
                    Optional.ofNullable(input)
                        .flatMap(i -> DocumentFormat.fromFileName(i.getFileName().toString())))
            .orElse(DocumentFormat.YAML);
    Optional<Path> outputPath = Optional.ofNullable(output);
    if (outputPath.isEmpty() && !format.isSingleFile()) {
      outputPath = Optional.of(Paths.get(component.nsdDirectory()));
    }
    return GenerationRequest.newBuilder()
        .setDocument(document)
        .setInputFormat(documentFormat)
        .setOutputFormat(format)
        .setOutput(outputPath)
        .setSerialFile(
            Optional.ofNullable(serialFile).orElse(Paths.get(component.defaultSerialFile())))
        .build();
  }

  private String readInput(InputStream stdin) throws IOException {
    return input == null
        ? new String(ByteStreams.toByteArray(stdin), UTF_8)
        : Files.readString(input, UTF_8);
  }

  private static void printUsage(JCommander jcommander, PrintStream out) {
    StringBuilder usage = new StringBuilder();
    jcommander.getUsageFormatter().usage(usage);
    out.print(usage);
  }

  private static void configureLogging() {
    try (InputStream config = ZonegenTool.class.getResourceAsStream("logging.properties")) {
      if (config != null) {
        LogManager.getLogManager().readConfiguration(config);
      }
    } catch (IOException e) {
      System.err.println("Could not load logging configuration: " + e.getMessage());
    }
  }
}
