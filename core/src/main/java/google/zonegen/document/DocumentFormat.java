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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;

/** The surface syntaxes a zone document may be written in. */
public enum DocumentFormat {
  YAML("YAML", ImmutableSet.of("yaml", "yml")),
  TOML("TOML", ImmutableSet.of("toml"));

  private final String displayName;
  private final ImmutableSet<String> fileExtensions;

  DocumentFormat(String displayName, ImmutableSet<String> fileExtensions) {
    this.displayName = displayName;
    this.fileExtensions = fileExtensions;
  }

  public String displayName() {
    return displayName;
  }

  /** Returns a decoder for documents of this format. */
  public DocumentDecoder decoder() {
    return switch (this) {
      case YAML -> new YamlDocumentDecoder();
      case TOML -> new TomlDocumentDecoder();
    };
  }

  /** Guesses the format from the extension of {@code fileName}, if it has a known one. */
  public static Optional<DocumentFormat> fromFileName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0) {
      return Optional.empty();
    }
    String extension = Ascii.toLowerCase(fileName.substring(dot + 1));
    for (DocumentFormat format : values()) {
      if (format.fileExtensions.contains(extension)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
