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

import com.google.auto.value.AutoValue;
import google.zonegen.document.DocumentFormat;
import google.zonegen.output.OutputFormat;
import java.nio.file.Path;
import java.util.Optional;

/** What one run of the generator should read and write. */
@AutoValue
public abstract class GenerationRequest {

  /** The text of the zone document. */
  public abstract String document();

  public abstract DocumentFormat inputFormat();

  public abstract OutputFormat outputFormat();

  /**
   * The file (Unbound) or directory (NSD) to write to. Empty writes single-file output to
   * stdout.
   */
  public abstract Optional<Path> output();

  public abstract Path serialFile();

  public static Builder newBuilder() {
    return new AutoValue_GenerationRequest.Builder();
  }

  /** Builder for {@link GenerationRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setDocument(String document);

    public abstract Builder setInputFormat(DocumentFormat inputFormat);

    public abstract Builder setOutputFormat(OutputFormat outputFormat);

    public abstract Builder setOutput(Path output);

    public abstract Builder setOutput(Optional<Path> output);

    public abstract Builder setSerialFile(Path serialFile);

    public abstract GenerationRequest build();
  }
}
