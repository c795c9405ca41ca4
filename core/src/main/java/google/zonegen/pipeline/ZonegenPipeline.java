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

package google.zonegen.pipeline;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import google.zonegen.ZonegenException;
import google.zonegen.config.ZonegenConfig.Config;
import google.zonegen.document.DocumentNormalizer;
import google.zonegen.document.RawDocument;
import google.zonegen.model.ZoneDocument;
import google.zonegen.model.ZoneModel;
import google.zonegen.output.NsdRenderer;
import google.zonegen.output.OutputFormat;
import google.zonegen.output.RenderedOutput;
import google.zonegen.output.StagedOutput;
import google.zonegen.output.UnboundRenderer;
import google.zonegen.output.ZoneRenderer;
import google.zonegen.resolve.DefaultResolver;
import google.zonegen.serial.SerialManager;
import google.zonegen.serial.SerialState;
import google.zonegen.transform.RecordTransformer;
import google.zonegen.util.StopwatchLogger;
import google.zonegen.validation.DocumentValidator;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Runs one generation as a single transaction.
 *
 * <p>The document is decoded, validated, resolved, transformed and rendered before anything is
 * written. Rendered files are staged, then the serial is committed, then the staged files are moved
 * into place. A failure at any point before the commit leaves the serial file and the output
 * untouched.
 */
public class ZonegenPipeline {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SerialManager serialManager;
  private final DocumentNormalizer normalizer;
  private final DocumentValidator validator;
  private final DefaultResolver resolver;
  private final RecordTransformer transformer;
  private final ImmutableMap<OutputFormat, ZoneRenderer> renderers;
  private final String stagingPrefix;

  @Inject
  public ZonegenPipeline(
      SerialManager serialManager,
      DocumentNormalizer normalizer,
      DocumentValidator validator,
      DefaultResolver resolver,
      RecordTransformer transformer,
      UnboundRenderer unboundRenderer,
      NsdRenderer nsdRenderer,
      @Config("stagingPrefix") String stagingPrefix) {
    this(
        serialManager,
        normalizer,
        validator,
        resolver,
        transformer,
        ImmutableMap.of(OutputFormat.UNBOUND, unboundRenderer, OutputFormat.NSD, nsdRenderer),
        stagingPrefix);
  }

  @VisibleForTesting
  ZonegenPipeline(
      SerialManager serialManager,
      DocumentNormalizer normalizer,
      DocumentValidator validator,
      DefaultResolver resolver,
      RecordTransformer transformer,
      ImmutableMap<OutputFormat, ZoneRenderer> renderers,
      String stagingPrefix) {
    this.serialManager = serialManager;
    this.normalizer = normalizer;
    this.validator = validator;
    this.resolver = resolver;
    this.transformer = transformer;
    this.renderers = renderers;
    this.stagingPrefix = stagingPrefix;
  }

  /**
   * Runs the request.
   *
   * @param stdout where single-file output goes when the request names no output path; written
   *     only after the serial is committed
   */
  public GenerationResult run(GenerationRequest request, PrintStream stdout)
      throws ZonegenException, IOException {
    checkArgument(
        request.output().isPresent() || request.outputFormat().isSingleFile(),
        "%s output needs an output directory",
        request.outputFormat().lowerCaseName());
    StopwatchLogger stopwatch = new StopwatchLogger("zone generation");
    try {
      SerialState serial = serialManager.load(request.serialFile());
      stopwatch.tick("load serial");
      RawDocument raw =
          normalizer.normalize(request.inputFormat().decoder().decode(request.document()));
      stopwatch.tick("decode");
      ZoneDocument document = validator.validate(raw);
      stopwatch.tick("validate");
      ZoneModel model = transformer.transform(resolver.resolve(document), serial.next().value());
      stopwatch.tick("transform");
      RenderedOutput rendered = renderers.get(request.outputFormat()).render(model);
      stopwatch.tick("render");

      if (request.output().isEmpty()) {
        serialManager.commit(serial);
        stdout.print(rendered.onlyContent());
        stdout.flush();
        return new GenerationResult(model, ImmutableList.of());
      }
      try (StagedOutput staged = stage(request, rendered)) {
        serialManager.commit(serial);
        ImmutableList<Path> published = staged.publish();
        stopwatch.tick("publish");
        logger.atInfo().log(
            "Wrote %d %s file(s) with serial %s in %d ms.",
            published.size(),
            request.outputFormat().lowerCaseName(),
            serial.next(),
            stopwatch.totalElapsed().toMillis());
        return new GenerationResult(model, published);
      }
    } catch (ZonegenException e) {
      logger.atSevere().log("Zone generation failed: %s", e.getMessage());
      throw e;
    } catch (IOException | RuntimeException e) {
      logger.atSevere().withCause(e).log("Zone generation failed.");
      throw e;
    }
  }

  private StagedOutput stage(GenerationRequest request, RenderedOutput rendered)
      throws IOException {
    Path output = request.output().get();
    if (!request.outputFormat().isSingleFile()) {
      return StagedOutput.stage(output, rendered, stagingPrefix);
    }
    Path file = output.toAbsolutePath().normalize();
    return StagedOutput.stage(
        file.getParent(),
        RenderedOutput.of(ImmutableMap.of(file.getFileName().toString(), rendered.onlyContent())),
        stagingPrefix);
  }
}
