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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Strings;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DnsNames}. */
class DnsNamesTest {

  @Test
  void testExpand_relativeName_appendsOrigin() {
    assertThat(DnsNames.expand("www", "example.com.")).isEqualTo("www.example.com.");
  }

  @Test
  void testExpand_apex_isOrigin() {
    assertThat(DnsNames.expand("@", "example.com.")).isEqualTo("example.com.");
  }

  @Test
  void testExpand_absoluteName_isKept() {
    assertThat(DnsNames.expand("mail.example.org.", "example.com."))
        .isEqualTo("mail.example.org.");
  }

  @Test
  void testExpand_noOrigin_isUnchanged() {
    assertThat(DnsNames.expand(" ns1.example.com ", null)).isEqualTo("ns1.example.com");
  }

  @Test
  void testCheckFullyQualified_validNames() {
    assertThat(DnsNames.checkFullyQualified("www.example.com.")).isEmpty();
    assertThat(DnsNames.checkFullyQualified("*.example.com.")).isEmpty();
    assertThat(DnsNames.checkFullyQualified("_http._tcp.example.com.")).isEmpty();
    assertThat(DnsNames.checkFullyQualified("xn--bcher-kva.example.")).isEmpty();
  }

  @Test
  void testCheckFullyQualified_missingTrailingDot() {
    assertThat(DnsNames.checkFullyQualified("www.example.com"))
        .hasValue("Host must be fully qualified: www.example.com");
  }

  @Test
  void testCheckFullyQualified_emptyLabel() {
    assertThat(DnsNames.checkFullyQualified("www..example.com."))
        .hasValue("DNS name has empty label: www..example.com.");
  }

  @Test
  void testCheckFullyQualified_labelTooLong() {
    String label = Strings.repeat("a", 64);
    assertThat(DnsNames.checkFullyQualified(label + ".example.com."))
        .hasValue("DNS label too long (max 63 chars): " + label);
  }

  @Test
  void testCheckFullyQualified_nameTooLong() {
    String label = Strings.repeat("a", 60);
    String name = Strings.repeat(label + ".", 5);
    assertThat(DnsNames.checkFullyQualified(name).get()).startsWith("DNS name too long");
  }

  @Test
  void testCheckFullyQualified_partialWildcard() {
    assertThat(DnsNames.checkFullyQualified("w*.example.com."))
        .hasValue("Wildcard '*' must be entire label, got: w*");
  }

  @Test
  void testCheckFullyQualified_wildcardNotLeftmost() {
    assertThat(DnsNames.checkFullyQualified("www.*.example.com."))
        .hasValue("Wildcard '*' must be leftmost label, got: www.*.example.com.");
  }

  @Test
  void testCheckFullyQualified_invalidCharacters() {
    assertThat(DnsNames.checkFullyQualified("ww_w.example.com."))
        .hasValue("DNS label has invalid characters: ww_w");
  }

  @Test
  void testCheckFullyQualified_hyphenAtEdge() {
    assertThat(DnsNames.checkFullyQualified("-www.example.com."))
        .hasValue("DNS label cannot start or end with hyphen: -www");
  }
}
