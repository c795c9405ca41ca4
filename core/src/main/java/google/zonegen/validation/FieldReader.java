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

package google.zonegen.validation;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.net.InetAddresses;
import google.zonegen.document.RawMapping;
import google.zonegen.document.RawNode;
import google.zonegen.document.RawScalar;
import google.zonegen.document.RawScalar.ScalarKind;
import google.zonegen.document.RawSequence;
import google.zonegen.document.SourcePosition;
import google.zonegen.model.ZoneDefaults;
import java.math.BigInteger;
import java.net.InetAddress;
import java.util.Optional;
import javax.annotation.Nullable;
import org.xbill.DNS.Name;
import org.xbill.DNS.TextParseException;

/**
 * Converts raw nodes into typed values, recording an error against the node for every value it
 * rejects.
 *
 * <p>Every accessor returns an empty {@link Optional} when the value was rejected, so callers can
 * keep walking the document and report all problems at once.
 */
final class FieldReader {

  private final ImmutableList.Builder<ValidationError> errors = new ImmutableList.Builder<>();
  private int errorCount;

  void error(RawNode node, String message) {
    errorAt(node.path(), node.position(), message);
  }

  void error(RawNode node, String format, Object... args) {
    error(node, String.format(format, args));
  }

  /** Records an error at an explicit position, such as that of a mapping key. */
  void errorAt(String path, SourcePosition position, String message) {
    errors.add(ValidationError.create(path, position, message));
    errorCount++;
  }

  boolean hasErrors() {
    return errorCount > 0;
  }

  ImmutableList<ValidationError> errors() {
    return errors.build();
  }

  /** Reports every key of {@code mapping} that is not in {@code allowed}. */
  void rejectUnknownFields(RawMapping mapping, ImmutableSet<String> allowed) {
    for (RawMapping.Entry entry : mapping.entries()) {
      if (!allowed.contains(entry.key())) {
        errorAt(
            entry.value().path(),
            entry.keyPosition(),
            String.format(
                "unknown field '%s', expected one of: %s",
                entry.key(), String.join(", ", allowed)));
      }
    }
  }

  Optional<RawNode> required(RawMapping mapping, String key) {
    Optional<RawNode> value = mapping.get(key).filter(v -> !isNull(v));
    if (value.isEmpty()) {
      error(mapping, "missing required field '%s'", key);
    }
    return value;
  }

  /** Returns the field unless it is absent or explicitly null. */
  static Optional<RawNode> optional(RawMapping mapping, String key) {
    return mapping.get(key).filter(v -> !isNull(v));
  }

  Optional<RawMapping> mapping(RawNode node, String what) {
    if (node instanceof RawMapping) {
      return Optional.of((RawMapping) node);
    }
    error(node, "%s must be a mapping, found %s", what, node.describe());
    return Optional.empty();
  }

  /** Accepts only string scalars. */
  Optional<String> string(RawNode node, String what) {
    if (isScalarOfKind(node, ScalarKind.STRING)) {
      return Optional.of(((RawScalar) node).text());
    }
    error(node, "%s must be a string, found %s", what, node.describe());
    return Optional.empty();
  }

  /** Accepts any non-null scalar and returns its text. Used for addresses and networks. */
  Optional<String> text(RawNode node, String what) {
    if (node instanceof RawScalar && !isNull(node)) {
      return Optional.of(((RawScalar) node).text());
    }
    error(node, "%s must be a scalar, found %s", what, node.describe());
    return Optional.empty();
  }

  Optional<Boolean> bool(RawNode node, String what) {
    if (isScalarOfKind(node, ScalarKind.BOOLEAN)) {
      return Optional.of(Boolean.parseBoolean(((RawScalar) node).text()));
    }
    error(node, "%s must be a boolean, found %s", what, node.describe());
    return Optional.empty();
  }

  /** Reads a TTL-like value in {@code [1, 2147483647]}. */
  Optional<Long> timeValue(RawNode node, String fieldWord) {
    Optional<BigInteger> value = integer(node, fieldWord);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    int sign = value.get().signum();
    if (sign == 0) {
      error(node, "%s cannot be zero", fieldWord);
    } else if (sign < 0) {
      error(node, "%s cannot be negative", fieldWord);
    } else if (value.get().compareTo(BigInteger.valueOf(ZoneDefaults.MAX_TIME_VALUE)) > 0) {
      error(node, "%s too large (max %d)", fieldWord, ZoneDefaults.MAX_TIME_VALUE);
    } else {
      return Optional.of(value.get().longValue());
    }
    return Optional.empty();
  }

  /** Reads a priority, weight or port in {@code [0, 65535]}. */
  Optional<Integer> uint16(RawNode node, String fieldWord) {
    Optional<BigInteger> value = integer(node, fieldWord);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    if (value.get().signum() < 0
        || value.get().compareTo(BigInteger.valueOf(ZoneDefaults.MAX_UINT16)) > 0) {
      error(
          node,
          "%s must be between 0 and %d, got %s",
          fieldWord,
          ZoneDefaults.MAX_UINT16,
          value.get());
      return Optional.empty();
    }
    return Optional.of(value.get().intValue());
  }

  private Optional<BigInteger> integer(RawNode node, String fieldWord) {
    if (isScalarOfKind(node, ScalarKind.INTEGER)) {
      return Optional.of(new BigInteger(((RawScalar) node).text()));
    }
    error(node, "%s must be an integer, found %s", fieldWord, node.describe());
    return Optional.empty();
  }

  /** A scalar or mapping is one item; a sequence is its items. */
  static ImmutableList<RawNode> oneOrMany(RawNode node) {
    return node instanceof RawSequence ? ((RawSequence) node).items() : ImmutableList.of(node);
  }

  /**
   * Reads a DNS name, expanding it against {@code origin} when one is given.
   *
   * @param origin the zone origin in text form, or null outside of any zone
   */
  Optional<Name> name(RawNode node, @Nullable String origin, String what) {
    Optional<String> text = string(node, what);
    if (text.isEmpty()) {
      return Optional.empty();
    }
    return nameFromText(node, text.get(), origin);
  }

  Optional<Name> nameFromText(RawNode node, String text, @Nullable String origin) {
    return nameFromText(node.path(), node.position(), text, origin);
  }

  /** Like {@link #name} for a name given as text, such as a mapping key. */
  Optional<Name> nameFromText(
      String path, SourcePosition position, String text, @Nullable String origin) {
    String expanded = DnsNames.expand(text, origin);
    Optional<String> problem = DnsNames.checkFullyQualified(expanded);
    if (problem.isPresent()) {
      errorAt(path, position, problem.get());
      return Optional.empty();
    }
    try {
      return Optional.of(Name.fromString(expanded));
    } catch (TextParseException e) {
      errorAt(path, position, String.format("invalid DNS name '%s': %s", expanded, e.getMessage()));
      return Optional.empty();
    }
  }

  Optional<InetAddress> address(RawNode node) {
    Optional<String> text = text(node, "IP address");
    if (text.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(InetAddresses.forString(text.get().trim()));
    } catch (IllegalArgumentException e) {
      error(node, "invalid IP address '%s'", text.get());
      return Optional.empty();
    }
  }

  /** Reads one address or a non-empty sequence of addresses. */
  Optional<ImmutableList<InetAddress>> addresses(RawNode node) {
    ImmutableList<RawNode> items = oneOrMany(node);
    if (items.isEmpty()) {
      error(node, "at least one IP address is required");
      return Optional.empty();
    }
    ImmutableList<Optional<InetAddress>> parsed =
        items.stream().map(this::address).collect(toImmutableList());
    if (parsed.stream().anyMatch(Optional::isEmpty)) {
      return Optional.empty();
    }
    return Optional.of(parsed.stream().map(Optional::get).collect(toImmutableList()));
  }

  private static boolean isNull(RawNode node) {
    return node instanceof RawScalar && ((RawScalar) node).isNull();
  }

  private static boolean isScalarOfKind(RawNode node, ScalarKind kind) {
    return node instanceof RawScalar && ((RawScalar) node).scalarKind() == kind;
  }
}
