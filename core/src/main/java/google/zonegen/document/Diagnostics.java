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

/** Formats diagnostics in the one-line form shared by decode and validation failures. */
public final class Diagnostics {

  /** Path shown for errors that concern the document root. */
  static final String ROOT_PATH = ".";

  /**
   * Returns {@code <FORMAT> parse error: Path: '<path>', Location: <position>, Error: <message>}.
   */
  public static String format(
      DocumentFormat format, String path, SourcePosition position, String message) {
    return String.format(
        "%s parse error: Path: '%s', Location: %s, Error: %s",
        format.displayName(), path.isEmpty() ? ROOT_PATH : path, position, message);
  }

  private Diagnostics() {}
}
