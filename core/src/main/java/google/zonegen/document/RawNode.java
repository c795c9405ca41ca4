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

/**
 * An untyped node of a decoded zone document.
 *
 * <p>Every node remembers where it came from: the dotted path from the document root and the
 * position of its first character. Nodes are immutable.
 */
public abstract class RawNode {

  /** The structural kind of a node. */
  public enum Kind {
    SCALAR("a scalar"),
    SEQUENCE("a sequence"),
    MAPPING("a mapping");

    private final String description;

    Kind(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final String path;
  private final SourcePosition position;

  RawNode(String path, SourcePosition position) {
    this.path = checkNotNull(path, "path");
    this.position = checkNotNull(position, "position");
  }

  public abstract Kind kind();

  public String path() {
    return path;
  }

  public SourcePosition position() {
    return position;
  }

  /** Returns a copy of this subtree re-rooted at {@code newPath}. */
  public abstract RawNode withPath(String newPath);

  /** Returns a short description of this node for use in error messages. */
  public String describe() {
    return kind().description();
  }

  /** Returns the path of the mapping entry {@code key} under {@code parent}. */
  public static String childPath(String parent, String key) {
    return parent.isEmpty() ? key : parent + "." + key;
  }

  /** Returns the path of the sequence item {@code index} under {@code parent}. */
  public static String indexPath(String parent, int index) {
    return parent + "[" + index + "]";
  }
}
