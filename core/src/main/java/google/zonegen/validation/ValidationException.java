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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import google.zonegen.ZonegenException;
import google.zonegen.document.DocumentFormat;

/** Thrown when a document has one or more invalid fields. Holds every error that was found. */
public class ValidationException extends ZonegenException {

  private final DocumentFormat format;
  private final ImmutableList<ValidationError> errors;

  public ValidationException(DocumentFormat format, ImmutableList<ValidationError> errors) {
    super(formatAll(format, errors));
    checkArgument(!errors.isEmpty(), "A validation failure needs at least one error");
    this.format = format;
    this.errors = errors;
  }

  public DocumentFormat getFormat() {
    return format;
  }

  public ImmutableList<ValidationError> getErrors() {
    return errors;
  }

  /** Returns one formatted diagnostic line per error. */
  public ImmutableList<String> getDiagnostics() {
    return errors.stream().map(e -> e.format(format)).collect(toImmutableList());
  }

  private static String formatAll(DocumentFormat format, ImmutableList<ValidationError> errors) {
    return Joiner.on('\n').join(errors.stream().map(e -> e.format(format)).iterator());
  }
}
