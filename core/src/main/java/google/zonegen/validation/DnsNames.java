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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Syntax rules for DNS names, and expansion of the relative names used inside zones.
 *
 * <p>Labels are ASCII letters, digits and hyphens, optionally prefixed with a single underscore
 * for service labels such as {@code _http}. A {@code *} label is allowed only as the leftmost
 * label.
 */
public final class DnsNames {

  public static final int MAX_NAME_LENGTH = 253;
  public static final int MAX_LABEL_LENGTH = 63;

  private static final String APEX = "@";
  private static final String WILDCARD = "*";

  private static final CharMatcher LABEL_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('-'))
          .precomputed();

  private static final Splitter DOT = Splitter.on('.');

  /**
   * Expands {@code name} against {@code origin}: {@code @} becomes the origin, a name ending in a
   * dot is kept, anything else gets the origin appended. Without an origin the name is returned
   * trimmed but otherwise unchanged.
   */
  public static String expand(String name, @Nullable String origin) {
    String trimmed = name.trim();
    if (origin == null || trimmed.endsWith(".")) {
      return trimmed;
    }
    if (trimmed.equals(APEX)) {
      return origin;
    }
    return trimmed + "." + origin;
  }

  /** Returns the first rule a fully qualified name breaks, if any. */
  public static Optional<String> checkFullyQualified(String name) {
    if (!name.endsWith(".")) {
      return Optional.of(String.format("Host must be fully qualified: %s", name));
    }
    if (name.equals(".")) {
      return Optional.empty();
    }
    String withoutRoot = name.substring(0, name.length() - 1);
    if (withoutRoot.length() > MAX_NAME_LENGTH) {
      return Optional.of(
          String.format("DNS name too long (max %d chars): %s", MAX_NAME_LENGTH, name));
    }
    List<String> labels = DOT.splitToList(withoutRoot);
    for (int i = 0; i < labels.size(); i++) {
      Optional<String> problem = checkLabel(labels.get(i), i == 0, name);
      if (problem.isPresent()) {
        return problem;
      }
    }
    return Optional.empty();
  }

  private static Optional<String> checkLabel(String label, boolean leftmost, String name) {
    if (label.isEmpty()) {
      return Optional.of(String.format("DNS name has empty label: %s", name));
    }
    if (label.length() > MAX_LABEL_LENGTH) {
      return Optional.of(
          String.format("DNS label too long (max %d chars): %s", MAX_LABEL_LENGTH, label));
    }
    if (label.contains(WILDCARD)) {
      if (!label.equals(WILDCARD)) {
        return Optional.of(String.format("Wildcard '*' must be entire label, got: %s", label));
      }
      return leftmost
          ? Optional.empty()
          : Optional.of(String.format("Wildcard '*' must be leftmost label, got: %s", name));
    }
    String body = label.startsWith("_") ? label.substring(1) : label;
    if (body.isEmpty() || !LABEL_CHARS.matchesAllOf(body)) {
      return Optional.of(String.format("DNS label has invalid characters: %s", label));
    }
    if (body.startsWith("-") || body.endsWith("-")) {
      return Optional.of(String.format("DNS label cannot start or end with hyphen: %s", label));
    }
    return Optional.empty();
  }

  private DnsNames() {}
}
