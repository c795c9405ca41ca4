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
import org.xbill.DNS.Name;
import org.xbill.DNS.TextParseException;

/** Rules for the zone contact address, and its conversion into an SOA mailbox name. */
public final class EmailAddresses {

  static final int MAX_LENGTH = 254;
  static final int MAX_LOCAL_LENGTH = 64;
  static final int MAX_LABEL_LENGTH = 63;

  private static final CharMatcher ALPHANUMERIC =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .precomputed();
  private static final CharMatcher LOCAL_CHARS = ALPHANUMERIC.or(CharMatcher.anyOf(".+_-"));
  private static final CharMatcher DOMAIN_CHARS = ALPHANUMERIC.or(CharMatcher.is('-'));
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  /** Returns a description of what is wrong with {@code email}, if anything. */
  public static Optional<String> check(String email) {
    if (email.length() > MAX_LENGTH) {
      return problem("Email too long (max %d chars): %s", MAX_LENGTH, email);
    }
    int at = email.indexOf('@');
    if (at < 0) {
      return problem("Email must contain '@': %s", email);
    }
    if (email.indexOf('@', at + 1) >= 0) {
      return problem("Email must contain exactly one '@': %s", email);
    }
    String local = email.substring(0, at);
    String domain = email.substring(at + 1);
    if (local.isEmpty()) {
      return problem("Email local part cannot be empty: %s", email);
    }
    if (local.length() > MAX_LOCAL_LENGTH) {
      return problem("Email local part too long (max %d chars): %s", MAX_LOCAL_LENGTH, email);
    }
    if (local.startsWith(".") || local.endsWith(".")) {
      return problem("Email local part cannot start or end with '.': %s", email);
    }
    if (local.contains("..")) {
      return problem("Email local part cannot contain consecutive dots: %s", email);
    }
    if (!LOCAL_CHARS.matchesAllOf(local)) {
      return problem("Email local part has invalid characters: %s", email);
    }
    return checkDomain(domain.endsWith(".") ? domain.substring(0, domain.length() - 1) : domain);
  }

  private static Optional<String> checkDomain(String domain) {
    if (!domain.contains(".")) {
      return problem("Email domain must contain at least one dot: %s", domain);
    }
    List<String> labels = Splitter.on('.').splitToList(domain);
    for (String label : labels) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        return problem("Email domain label must be 1-%d chars: %s", MAX_LABEL_LENGTH, domain);
      }
      if (!DOMAIN_CHARS.matchesAllOf(label)) {
        return problem("Email domain has invalid characters: %s", domain);
      }
      if (label.startsWith("-") || label.endsWith("-")) {
        return problem("Email domain label cannot start or end with hyphen: %s", label);
      }
    }
    if (DIGITS.matchesAllOf(labels.get(labels.size() - 1))) {
      return problem("Email domain TLD cannot be all numeric: %s", domain);
    }
    return Optional.empty();
  }

  /**
   * Converts a valid address into the SOA mailbox form, escaping dots in the local part:
   * {@code john.doe@example.com} becomes {@code john\.doe.example.com.}.
   */
  public static Name toMailbox(String email) {
    int at = email.indexOf('@');
    String local = email.substring(0, at).replace(".", "\\.");
    String domain = email.substring(at + 1);
    String mailbox = local + "." + (domain.endsWith(".") ? domain : domain + ".");
    try {
      return Name.fromString(mailbox);
    } catch (TextParseException e) {
      throw new IllegalArgumentException("Not a valid mailbox: " + mailbox, e);
    }
  }

  private static Optional<String> problem(String format, Object... args) {
    return Optional.of(String.format(format, args));
  }

  private EmailAddresses() {}
}
