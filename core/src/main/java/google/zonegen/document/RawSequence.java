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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.stream.IntStream;

/** An ordered list of nodes. */
public final class RawSequence extends RawNode {

  private final ImmutableList<RawNode> items;

  public RawSequence(String path, SourcePosition position, ImmutableList<RawNode> items) {
    super(path, position);
    this.items = items;
  }

  @Override
  public Kind kind() {
    return Kind.SEQUENCE;
  }

  public ImmutableList<RawNode> items() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  @Override
  public RawSequence withPath(String newPath) {
    return new RawSequence(
        newPath,
        position(),
        IntStream.range(0, items.size())
            .mapToObj(i -> items.get(i).withPath(indexPath(newPath, i)))
            .collect(toImmutableList()));
  }
}
