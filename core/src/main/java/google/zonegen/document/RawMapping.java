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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/** An ordered mapping from string keys to nodes. Keys are unique. */
public final class RawMapping extends RawNode {

  /** One key of a mapping, with the position of the key itself. */
  public record Entry(String key, SourcePosition keyPosition, RawNode value) {}

  private final ImmutableList<Entry> entries;

  public RawMapping(String path, SourcePosition position, ImmutableList<Entry> entries) {
    super(path, position);
    Set<String> seen = new HashSet<>();
    for (Entry entry : entries) {
      checkArgument(seen.add(entry.key()), "Duplicate key '%s' under '%s'", entry.key(), path);
    }
    this.entries = entries;
  }

  /** Returns an empty mapping at the given location. */
  public static RawMapping empty(String path, SourcePosition position) {
    return new RawMapping(path, position, ImmutableList.of());
  }

  @Override
  public Kind kind() {
    return Kind.MAPPING;
  }

  public ImmutableList<Entry> entries() {
    return entries;
  }

  public ImmutableSet<String> keys() {
    return entries.stream().map(Entry::key).collect(ImmutableSet.toImmutableSet());
  }

  public Optional<Entry> entry(String key) {
    return entries.stream().filter(e -> e.key().equals(key)).findFirst();
  }

  public Optional<RawNode> get(String key) {
    return entry(key).map(Entry::value);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public RawMapping withPath(String newPath) {
    return new RawMapping(
        newPath,
        position(),
        entries.stream()
            .map(
                e ->
                    new Entry(
                        e.key(), e.keyPosition(), e.value().withPath(childPath(newPath, e.key()))))
            .collect(toImmutableList()));
  }
}
