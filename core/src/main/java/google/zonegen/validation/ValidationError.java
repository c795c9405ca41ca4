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

package google.zonegen.validation;

import com.google.auto.value.AutoValue;
import google.zonegen.document.Diagnostics;
import google.zonegen.document.DocumentFormat;
import google.zonegen.document.SourcePosition;

/** One rejected field, located by its document path and source position. */
@AutoValue
public abstract class ValidationError {

  public abstract String path();

  public abstract SourcePosition position();

  public abstract String message();

  public static ValidationError create(String path, SourcePosition position, String message) {
    return new AutoValue_ValidationError(path, position, message);
  }

  /** Formats this error as a one-line diagnostic for a document of the given format. */
  public String format(DocumentFormat format) {
    return Diagnostics.format(format, path(), position(), message());
  }
}
