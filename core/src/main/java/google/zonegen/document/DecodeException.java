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

package google.zonegen.document;

import google.zonegen.ZonegenException;

/**
 * Thrown when a document does not conform to its surface syntax, or cannot be brought into the
 * canonical zone document shape.
 */
public class DecodeException extends ZonegenException {

  private final DocumentFormat format;
  private final String path;
  private final SourcePosition position;
  private final String problem;

  public DecodeException(
      DocumentFormat format, String path, SourcePosition position, String problem) {
    super(Diagnostics.format(format, path, position, problem));
    this.format = format;
    this.path = path;
    this.position = position;
    this.problem = problem;
  }

  public DecodeException(
      DocumentFormat format, SourcePosition position, String problem, Throwable cause) {
    super(Diagnostics.format(format, "", position, problem), cause);
    this.format = format;
    this.path = "";
    this.position = position;
    this.problem = problem;
  }

  public DocumentFormat getFormat() {
    return format;
  }

  public String getPath() {
    return path;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /** Returns the bare description of the failure, without path or location. */
  public String getProblem() {
    return problem;
  }
}
