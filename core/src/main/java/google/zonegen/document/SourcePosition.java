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

/**
 * A 1-based line and column in a source document.
 *
 * <p>Positions that cannot be determined (for example for implicitly created TOML tables) are
 * represented by {@link #UNKNOWN}.
 */
public record SourcePosition(int line, int column) {

  public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

  public static SourcePosition of(int line, int column) {
    return new SourcePosition(line, column);
  }

  public boolean isKnown() {
    return line > 0;
  }

  @Override
  public String toString() {
    return isKnown() ? String.format("line %d column %d", line, column) : "unknown";
  }
}
