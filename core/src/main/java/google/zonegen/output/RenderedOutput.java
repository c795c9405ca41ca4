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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/** Rendered files, keyed by their path relative to the output location, in write order. */
@AutoValue
public abstract class RenderedOutput {

  public abstract ImmutableMap<String, String> files();

  public static RenderedOutput of(ImmutableMap<String, String> files) {
    return new AutoValue_RenderedOutput(files);
  }

  /** Returns the content of a single-file output. */
  public String onlyContent() {
    checkState(files().size() == 1, "Expected one rendered file, got %s", files().keySet());
    return Iterables.getOnlyElement(files().values());
  }
}
