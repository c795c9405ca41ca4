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

import com.google.common.collect.ImmutableList;
import google.zonegen.document.RawScalar.ScalarKind;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import javax.annotation.Nullable;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlPosition;
import org.tomlj.TomlTable;

/**
 * Decodes TOML documents with tomlj.
 *
 * <p>tomlj does not promise to iterate table keys in document order, so keys are ordered by the
 * position they were defined at. Tables created implicitly by a dotted header have no position of
 * their own and sort after the keys that do, in tomlj's order.
 */
public class TomlDocumentDecoder implements DocumentDecoder {

  @Override
  public RawDocument decode(String text) throws DecodeException {
    TomlParseResult result = Toml.parse(text);
    if (result.hasErrors()) {
      TomlParseError error = result.errors().get(0);
      throw new DecodeException(
          DocumentFormat.TOML, toPosition(error.position()), stripPosition(error), error);
    }
    return new RawDocument(DocumentFormat.TOML, convertTable(result, "", SourcePosition.of(1, 1)));
  }

  private RawMapping convertTable(TomlTable table, String path, SourcePosition position) {
    List<KeyAndPosition> keys = new ArrayList<>();
    for (String key : table.keySet()) {
      keys.add(new KeyAndPosition(key, toPosition(table.inputPositionOf(ImmutableList.of(key)))));
    }
    // List.sort is stable, so keys without a position keep their relative order.
    keys.sort(
        Comparator.comparing(KeyAndPosition::position, TomlDocumentDecoder::comparePositions));
    ImmutableList.Builder<RawMapping.Entry> entries = new ImmutableList.Builder<>();
    for (KeyAndPosition key : keys) {
      Object value = table.get(ImmutableList.of(key.key()));
      String childPath = RawNode.childPath(path, key.key());
      RawNode node = convert(value, childPath, key.position());
      entries.add(new RawMapping.Entry(key.key(), key.position(), node));
    }
    return new RawMapping(path, position, entries.build());
  }

  private RawNode convert(Object value, String path, SourcePosition position) {
    if (value instanceof TomlTable) {
      return convertTable((TomlTable) value, path, position);
    }
    if (value instanceof TomlArray) {
      TomlArray array = (TomlArray) value;
      ImmutableList.Builder<RawNode> items = new ImmutableList.Builder<>();
      for (int i = 0; i < array.size(); i++) {
        SourcePosition itemPosition = toPosition(array.inputPositionOf(i));
        items.add(
            convert(
                array.get(i),
                RawNode.indexPath(path, i),
                itemPosition.isKnown() ? itemPosition : position));
      }
      return new RawSequence(path, position, items.build());
    }
    if (value instanceof String) {
      return new RawScalar(path, position, ScalarKind.STRING, (String) value);
    }
    if (value instanceof Long || value instanceof Integer) {
      return new RawScalar(path, position, ScalarKind.INTEGER, value.toString());
    }
    if (value instanceof Double) {
      return new RawScalar(path, position, ScalarKind.FLOAT, value.toString());
    }
    if (value instanceof Boolean) {
      return new RawScalar(path, position, ScalarKind.BOOLEAN, value.toString());
    }
    if (value instanceof TemporalAccessor) {
      return new RawScalar(path, position, ScalarKind.DATETIME, value.toString());
    }
    throw new IllegalStateException(
        String.format("Unexpected TOML value of type %s at '%s'", value.getClass(), path));
  }

  private static String stripPosition(TomlParseError error) {
    // tomlj appends " (line L, column C)" to the message; the position is reported separately.
    String message = error.getMessage();
    int suffix = message.lastIndexOf(" (line ");
    return suffix > 0 ? message.substring(0, suffix) : message;
  }

  private static int comparePositions(SourcePosition a, SourcePosition b) {
    if (a.isKnown() != b.isKnown()) {
      return a.isKnown() ? -1 : 1;
    }
    return a.line() != b.line()
        ? Integer.compare(a.line(), b.line())
        : Integer.compare(a.column(), b.column());
  }

  private static SourcePosition toPosition(@Nullable TomlPosition position) {
    return position == null
        ? SourcePosition.UNKNOWN
        : SourcePosition.of(position.line(), position.column());
  }

  private record KeyAndPosition(String key, SourcePosition position) {}
}
