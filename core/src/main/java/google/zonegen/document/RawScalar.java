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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;

/** A leaf value together with the raw source text it was written as. */
public final class RawScalar extends RawNode {

  /** What the surface syntax resolved the scalar to. */
  public enum ScalarKind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    NULL,
    DATETIME
  }

  private final ScalarKind scalarKind;
  private final String text;

  public RawScalar(String path, SourcePosition position, ScalarKind scalarKind, String text) {
    super(path, position);
    this.scalarKind = checkNotNull(scalarKind, "scalarKind");
    this.text = checkNotNull(text, "text");
  }

  @Override
  public Kind kind() {
    return Kind.SCALAR;
  }

  public ScalarKind scalarKind() {
    return scalarKind;
  }

  /**
   * Returns the scalar's text. Integers are normalized to plain decimal and booleans to {@code
   * true} or {@code false}; everything else is kept as written.
   */
  public String text() {
    return text;
  }

  public boolean isNull() {
    return scalarKind == ScalarKind.NULL;
  }

  @Override
  public RawScalar withPath(String newPath) {
    return new RawScalar(newPath, position(), scalarKind, text);
  }

  @Override
  public String describe() {
    switch (scalarKind) {
      case NULL:
        return "null";
      case STRING:
        return String.format("string '%s'", text);
      default:
        return String.format("%s %s", Ascii.toLowerCase(scalarKind.name()), text);
    }
  }

  @Override
  public String toString() {
    return text;
  }
}
