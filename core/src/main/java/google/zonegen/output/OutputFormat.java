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

import com.google.common.base.Ascii;

/** The DNS servers output can be rendered for. */
public enum OutputFormat {
  /** One {@code unbound.conf} fragment with every zone, written to a file or stdout. */
  UNBOUND(true),
  /** One zone file per zone plus a {@code zones.conf} index, written to a directory. */
  NSD(false);

  private final boolean singleFile;

  OutputFormat(boolean singleFile) {
    this.singleFile = singleFile;
  }

  public boolean isSingleFile() {
    return singleFile;
  }

  public String lowerCaseName() {
    return Ascii.toLowerCase(name());
  }
}
