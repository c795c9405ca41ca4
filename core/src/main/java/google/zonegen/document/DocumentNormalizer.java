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
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites the alternative shapes a zone document may use into one canonical shape, so that
 * validation never needs to know which shape or syntax was used.
 *
 * <ul>
 *   <li>{@code zone}: a sequence of zone objects with a {@code name} field becomes a mapping keyed
 *       by that name.
 *   <li>{@code reverse}: a CIDR string, a sequence of CIDR strings, a sequence of objects with a
 *       {@code network} field, or a mapping from CIDR to overrides all become a mapping from CIDR
 *       to an override mapping.
 *   <li>zone {@code cname}: a sequence of objects with a {@code name} field becomes a mapping keyed
 *       by that name.
 * </ul>
 */
public class DocumentNormalizer {

  static final String ZONE = "zone";
  static final String REVERSE = "reverse";
  static final String CNAME = "cname";

  @Inject
  public DocumentNormalizer() {}

  public RawDocument normalize(RawDocument document) throws DecodeException {
    DocumentFormat format = document.format();
    RawMapping root = document.root();
    ImmutableList.Builder<RawMapping.Entry> entries = new ImmutableList.Builder<>();
    for (RawMapping.Entry entry : root.entries()) {
      RawNode value = entry.value();
      switch (entry.key()) {
        case ZONE:
          value = normalizeZones(format, value);
          break;
        case REVERSE:
          value = normalizeReverse(format, value);
          break;
        default:
          break;
      }
      entries.add(new RawMapping.Entry(entry.key(), entry.keyPosition(), value));
    }
    return new RawDocument(format, new RawMapping(root.path(), root.position(), entries.build()));
  }

  private RawNode normalizeZones(DocumentFormat format, RawNode zones) throws DecodeException {
    RawNode keyed = zones;
    if (zones instanceof RawSequence) {
      keyed = keyByField(format, (RawSequence) zones, "name", "zone");
    }
    if (!(keyed instanceof RawMapping)) {
      // Left for the validator to report as a shape error.
      return keyed;
    }
    RawMapping mapping = (RawMapping) keyed;
    ImmutableList.Builder<RawMapping.Entry> entries = new ImmutableList.Builder<>();
    for (RawMapping.Entry zone : mapping.entries()) {
      RawNode body = zone.value();
      if (body instanceof RawMapping && ((RawMapping) body).get(CNAME).isPresent()) {
        RawMapping zoneBody = (RawMapping) body;
        body = replaceEntry(zoneBody, CNAME, normalizeCnames(format, zoneBody.get(CNAME).get()));
      }
      entries.add(new RawMapping.Entry(zone.key(), zone.keyPosition(), body));
    }
    return new RawMapping(mapping.path(), mapping.position(), entries.build());
  }

  private RawNode normalizeCnames(DocumentFormat format, RawNode cnames) throws DecodeException {
    return cnames instanceof RawSequence
        ? keyByField(format, (RawSequence) cnames, "name", "CNAME")
        : cnames;
  }

  private RawNode normalizeReverse(DocumentFormat format, RawNode reverse) throws DecodeException {
    String path = reverse.path();
    if (reverse instanceof RawScalar) {
      RawScalar scalar = (RawScalar) reverse;
      if (scalar.isNull()) {
        return RawMapping.empty(path, scalar.position());
      }
      return new RawMapping(
          path, scalar.position(), ImmutableList.of(emptyNetwork(path, scalar)));
    }
    if (reverse instanceof RawMapping) {
      RawMapping mapping = (RawMapping) reverse;
      ImmutableList.Builder<RawMapping.Entry> entries = new ImmutableList.Builder<>();
      for (RawMapping.Entry entry : mapping.entries()) {
        RawNode value = entry.value();
        if (value instanceof RawScalar && ((RawScalar) value).isNull()) {
          value = RawMapping.empty(value.path(), value.position());
        }
        entries.add(new RawMapping.Entry(entry.key(), entry.keyPosition(), value));
      }
      return new RawMapping(path, mapping.position(), entries.build());
    }
    RawSequence sequence = (RawSequence) reverse;
    Map<String, RawMapping.Entry> networks = new LinkedHashMap<>();
    for (RawNode item : sequence.items()) {
      RawMapping.Entry entry;
      if (item instanceof RawScalar) {
        entry = emptyNetwork(path, (RawScalar) item);
      } else if (item instanceof RawMapping) {
        entry = extractKey(format, (RawMapping) item, "network", path, "reverse network");
      } else {
        throw new DecodeException(
            format,
            item.path(),
            item.position(),
            String.format(
                "reverse network must be a CIDR string or a mapping, found %s", item.describe()));
      }
      putUnique(format, networks, entry, "reverse network");
    }
    return new RawMapping(path, sequence.position(), ImmutableList.copyOf(networks.values()));
  }

  private static RawMapping.Entry emptyNetwork(String parentPath, RawScalar cidr) {
    String childPath = RawNode.childPath(parentPath, cidr.text());
    return new RawMapping.Entry(
        cidr.text(), cidr.position(), RawMapping.empty(childPath, cidr.position()));
  }

  /** Turns a sequence of objects into a mapping keyed by each object's {@code field}. */
  private static RawMapping keyByField(
      DocumentFormat format, RawSequence sequence, String field, String what)
      throws DecodeException {
    Map<String, RawMapping.Entry> entries = new LinkedHashMap<>();
    for (RawNode item : sequence.items()) {
      if (!(item instanceof RawMapping)) {
        throw new DecodeException(
            format,
            item.path(),
            item.position(),
            String.format("%s entry must be a mapping, found %s", what, item.describe()));
      }
      putUnique(
          format,
          entries,
          extractKey(format, (RawMapping) item, field, sequence.path(), what),
          what);
    }
    return new RawMapping(
        sequence.path(), sequence.position(), ImmutableList.copyOf(entries.values()));
  }

  /**
   * Removes {@code field} from {@code object} and returns the remainder as an entry keyed by the
   * field's value, re-rooted under {@code parentPath}.
   */
  private static RawMapping.Entry extractKey(
      DocumentFormat format, RawMapping object, String field, String parentPath, String what)
      throws DecodeException {
    Optional<RawNode> keyNode = object.get(field);
    if (keyNode.isEmpty()) {
      throw new DecodeException(
          format,
          object.path(),
          object.position(),
          String.format("%s entry is missing required field '%s'", what, field));
    }
    if (!(keyNode.get() instanceof RawScalar)
        || ((RawScalar) keyNode.get()).scalarKind() != RawScalar.ScalarKind.STRING) {
      throw new DecodeException(
          format,
          keyNode.get().path(),
          keyNode.get().position(),
          String.format("%s field '%s' must be a string", what, field));
    }
    String key = ((RawScalar) keyNode.get()).text();
    ImmutableList<RawMapping.Entry> rest =
        object.entries().stream()
            .filter(e -> !e.key().equals(field))
            .collect(ImmutableList.toImmutableList());
    RawMapping remainder =
        new RawMapping(object.path(), object.position(), rest)
            .withPath(RawNode.childPath(parentPath, key));
    return new RawMapping.Entry(key, keyNode.get().position(), remainder);
  }

  private static void putUnique(
      DocumentFormat format,
      Map<String, RawMapping.Entry> entries,
      RawMapping.Entry entry,
      String what)
      throws DecodeException {
    if (entries.containsKey(entry.key())) {
      throw new DecodeException(
          format,
          entry.value().path(),
          entry.keyPosition(),
          String.format("duplicate %s '%s'", what, entry.key()));
    }
    entries.put(entry.key(), entry);
  }

  private static RawMapping replaceEntry(RawMapping mapping, String key, RawNode value) {
    return new RawMapping(
        mapping.path(),
        mapping.position(),
        mapping.entries().stream()
            .map(e -> e.key().equals(key) ? new RawMapping.Entry(key, e.keyPosition(), value) : e)
            .collect(ImmutableList.toImmutableList()));
  }
}
